package agents.concierge.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * Represents a JSON-RPC request in MCP protocol format.
 * The id is kept as sent so it can be echoed back unchanged (clients send integers).
 */
public class MCPRequest {

    private final String jsonrpc = "2.0";
    private final Object id;
    private final String method;
    private final JsonObject params;

    public MCPRequest(Object id, String method, JsonObject params) {
        this.id = id;
        this.method = method;
        this.params = params != null ? params : new JsonObject();
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public Object getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public JsonObject getParams() {
        return params;
    }

    /**
     * Convert to JSON for transmission. <code>params</code> is always present.
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("jsonrpc", jsonrpc)
            .put("id", id)
            .put("method", method)
            .put("params", params);
    }

    /**
     * Create from incoming JSON
     *
     * @throws ClassCastException when <code>params</code> or <code>method</code> has the wrong type
     */
    public static MCPRequest fromJson(JsonObject json) {
        return new MCPRequest(
            json.getValue("id"),
            json.getString("method"),
            json.getJsonObject("params", new JsonObject())
        );
    }

    public boolean isValid() {
        return method != null && !method.isEmpty();
    }

    @Override
    public String toString() {
        return "MCPRequest{id=" + id + ", method='" + method + "', params=" + params + "}";
    }
}
