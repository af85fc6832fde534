package agents.concierge.store;

/**
 * Raised when the backing store cannot complete a JDBC operation.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
