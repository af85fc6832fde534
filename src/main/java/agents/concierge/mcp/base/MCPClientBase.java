package agents.concierge.mcp.base;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import java.util.concurrent.atomic.AtomicLong;

import static agents.concierge.Driver.logLevel;

/**
 * Base class for MCP client handles.
 * A handle talks to exactly one MCP server over HTTP and owns its session state: the
 * session id issued by the server on first contact and a monotonically increasing request id.
 * Handles are not shared between components; each specialist creates its own.
 */
public class MCPClientBase {

    public static final String SESSION_HEADER = "Mcp-Session-Id";

    protected final Vertx vertx;
    protected final String serverName;
    protected final String serverUrl;
    protected final long timeoutMs;

    private final WebClient webClient;
    private final AtomicLong requestCounter = new AtomicLong(0);
    private volatile String sessionId;

    /**
     * @param serverName friendly name used in log lines
     * @param serverUrl full URL of the JSON-RPC endpoint, e.g. <code>http://localhost:8080/mcp</code>
     * @param timeoutMs bound on each request
     */
    public MCPClientBase(Vertx vertx, String serverName, String serverUrl, long timeoutMs) {
        if (serverUrl == null || !(serverUrl.startsWith("http://") || serverUrl.startsWith("https://"))) {
            throw new IllegalArgumentException("Invalid server URL: " + serverUrl);
        }
        this.vertx = vertx;
        this.serverName = serverName;
        this.serverUrl = serverUrl;
        this.timeoutMs = timeoutMs;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
            .setConnectTimeout((int) Math.min(timeoutMs, Integer.MAX_VALUE))
            .setKeepAlive(true)
            .setMaxPoolSize(10));
    }

    /**
     * Perform the <code>initialize</code> handshake. Also establishes the session id.
     *
     * @return the server's capability and version info
     */
    public Future<JsonObject> initialize() {
        return rpc("initialize", new JsonObject())
            .onSuccess(result -> {
                if (logLevel >= 1) {
                    String name = result.getJsonObject("serverInfo", new JsonObject()).getString("name", "unknown");
                    vertx.eventBus().publish("log", serverName + " client initialized against " + name
                        + ",1," + getClass().getSimpleName() + ",MCP,System");
                }
            });
    }

    public Future<JsonArray> listTools() {
        return rpc("tools/list", new JsonObject())
            .map(result -> result.getJsonArray("tools", new JsonArray()));
    }

    /**
     * Call a tool and unwrap its embedded result.
     *
     * @return the decoded <code>content[0].text</code>: a JsonObject, JsonArray or scalar;
     *     <code>{"raw": text}</code> when the text is not JSON; an empty JsonObject when
     *     the result carries no content
     */
    public Future<Object> callTool(String toolName, JsonObject arguments) {
        JsonObject params = new JsonObject()
            .put("name", toolName)
            .put("arguments", arguments != null ? arguments : new JsonObject());

        if (logLevel >= 3) {
            vertx.eventBus().publish("log", "Calling tool " + toolName + " on " + serverName
                + ",3," + getClass().getSimpleName() + ",MCP,Tool");
        }

        return rpc("tools/call", params).map(MCPClientBase::unwrapToolResult);
    }

    /**
     * Session id issued by the server, or null before the first reply.
     */
    public String getSessionId() {
        return sessionId;
    }

    public void close() {
        webClient.close();
    }

    /**
     * Send one JSON-RPC envelope and return its <code>result</code> member.
     * Fails with {@link MCPToolException} on a JSON-RPC error and with
     * {@link MCPTransportException} on anything the protocol cannot explain.
     */
    protected Future<JsonObject> rpc(String method, JsonObject params) {
        MCPRequest request = new MCPRequest(requestCounter.incrementAndGet(), method, params);

        HttpRequest<Buffer> http = webClient.postAbs(serverUrl)
            .timeout(timeoutMs)
            .putHeader("Content-Type", "application/json")
            .putHeader("Accept", "application/json, text/event-stream");
        String currentSession = sessionId;
        if (currentSession != null) {
            http.putHeader(SESSION_HEADER, currentSession);
        }

        return http.sendJsonObject(request.toJson())
            .recover(err -> {
                vertx.eventBus().publish("log", serverName + " request " + method + " failed: " + err.getMessage()
                    + ",0," + getClass().getSimpleName() + ",MCP,Transport");
                return Future.failedFuture(new MCPTransportException(
                    "MCP request " + method + " to " + serverUrl + " failed: " + err.getMessage(), err));
            })
            .compose(this::handleResponse);
    }

    private Future<JsonObject> handleResponse(HttpResponse<Buffer> response) {
        String issued = response.getHeader(SESSION_HEADER);
        if (issued != null && sessionId == null) {
            sessionId = issued;
        }

        JsonObject body;
        try {
            body = decodeBody(response.getHeader("Content-Type"), response.bodyAsString());
        } catch (MCPTransportException e) {
            return Future.failedFuture(e);
        }

        MCPResponse mcpResponse = MCPResponse.fromJson(body);
        if (mcpResponse.isError()) {
            return Future.failedFuture(new MCPToolException(mcpResponse.getErrorCode(), mcpResponse.getErrorMessage()));
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            return Future.failedFuture(new MCPTransportException(
                "MCP server " + serverName + " answered HTTP " + response.statusCode(), null));
        }
        return Future.succeededFuture(mcpResponse.getResult());
    }

    /**
     * Decode a response body. A plain JSON object is tried first; failing that, the first
     * server-sent-events <code>data:</code> line that holds a JSON object is used.
     *
     * @throws MCPTransportException when neither form decodes
     */
    public static JsonObject decodeBody(String contentType, String body) {
        if (body == null || body.trim().isEmpty()) {
            throw new MCPTransportException("Empty response body (content-type " + contentType + ")", null);
        }

        String trimmed = body.trim();
        DecodeException lastFailure = null;
        if (trimmed.startsWith("{")) {
            try {
                return new JsonObject(trimmed);
            } catch (DecodeException e) {
                lastFailure = e;
            }
        }

        for (String line : trimmed.split("\n")) {
            String candidate = line.trim();
            if (candidate.startsWith("data:")) {
                try {
                    return new JsonObject(candidate.substring(5).trim());
                } catch (DecodeException e) {
                    lastFailure = e;
                }
            }
        }

        String preview = trimmed.length() > 200 ? trimmed.substring(0, 200) : trimmed;
        throw new MCPTransportException("No valid JSON or SSE data in response (content-type "
            + contentType + "): " + preview, lastFailure);
    }

    /**
     * Parse the embedded JSON text of a <code>tools/call</code> result.
     */
    public static Object unwrapToolResult(JsonObject result) {
        JsonArray content = result.getJsonArray("content");
        if (content == null || content.isEmpty()) {
            return new JsonObject();
        }
        Object first = content.getValue(0);
        String text = first instanceof JsonObject ? ((JsonObject) first).getString("text", "{}") : "{}";
        String trimmed = text.trim();
        try {
            if (trimmed.startsWith("{")) {
                return new JsonObject(trimmed);
            }
            if (trimmed.startsWith("[")) {
                return new JsonArray(trimmed);
            }
            return Json.decodeValue(trimmed);
        } catch (DecodeException e) {
            return new JsonObject().put("raw", text);
        }
    }
}
