package agents.concierge.mcp.base;

/**
 * A tool-call server answered with a JSON-RPC <code>error</code> member, or a tool handler
 * rejected its input. Carries the JSON-RPC error code.
 */
public class MCPToolException extends RuntimeException {

    private final int code;

    public MCPToolException(int code, String message) {
        super(message);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
