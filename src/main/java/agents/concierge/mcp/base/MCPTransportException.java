package agents.concierge.mcp.base;

/**
 * The tool-call server could not be reached, timed out, or sent a body that decodes neither
 * as JSON nor as a server-sent-events <code>data:</code> line.
 */
public class MCPTransportException extends RuntimeException {

    public MCPTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
