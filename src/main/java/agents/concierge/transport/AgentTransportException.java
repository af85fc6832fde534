package agents.concierge.transport;

/**
 * An envelope could not be delivered or its reply could not be read.
 */
public class AgentTransportException extends RuntimeException {

    public AgentTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
