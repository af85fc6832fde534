package agents.concierge.mcp.base;

import agents.concierge.services.MCPRouterService;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

import static agents.concierge.Driver.logLevel;

/**
 * Base class for MCP servers.
 *
 * <p>Serves the JSON-RPC endpoint on the base path itself:</p>
 * <ul>
 *   <li><code>POST {base}</code> handles <code>initialize</code>, <code>tools/list</code> and
 *       <code>tools/call</code>, answering plain JSON with an <code>Mcp-Session-Id</code> header,</li>
 *   <li><code>GET {base}</code> streams the session's queued responses as server-sent events
 *       with a keep-alive comment every second,</li>
 *   <li><code>GET {base}/tools/list</code>, <code>POST {base}/tools/call</code> and
 *       <code>GET {base}/health</code> are direct endpoints returning raw payloads.</li>
 * </ul>
 * JSON-RPC errors travel with HTTP 200; only failures outside the protocol answer 500.
 */
public abstract class MCPServerBase extends AbstractVerticle {

    public static final String PROTOCOL_VERSION = "2024-11-05";
    private static final long KEEPALIVE_INTERVAL_MS = 1000;
    private static final int MAX_QUEUED_MESSAGES = 100;

    protected Router router;
    protected final Map<String, MCPTool> tools = new LinkedHashMap<>();
    protected final String serverName;
    protected final String serverPath;
    protected final MCPRouterService routerService;

    // session id -> responses waiting for the GET stream
    private final Map<String, Deque<JsonObject>> sessions = new ConcurrentHashMap<>();

    protected MCPServerBase(String serverName, String serverPath, MCPRouterService routerService) {
        this.serverName = serverName;
        this.serverPath = serverPath;
        this.routerService = routerService;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        initializeTools();

        // Exact-path endpoints first so they win over the sub-router mount
        routerService.registerEndpoint(HttpMethod.POST, serverPath, this::handleRpc);
        routerService.registerEndpoint(HttpMethod.GET, serverPath, this::handleStream);

        router = Router.router(vertx);
        router.get("/tools/list").handler(this::handleDirectToolsList);
        router.post("/tools/call").handler(this::handleDirectToolCall);
        router.get("/health").handler(ctx -> sendJson(ctx, 200, new JsonObject()
            .put("status", "healthy")
            .put("service", "mcp-server")));
        routerService.registerRouter(serverPath, router);

        vertx.eventBus().publish("log", serverName + " registered at path: " + serverPath
            + " with " + tools.size() + " tools,2,MCPServerBase,MCP,System");
        startPromise.complete();
    }

    /**
     * Register the tools this server provides via {@link #registerTool(MCPTool)}.
     */
    protected abstract void initializeTools();

    /**
     * Run a tool. Arguments have already been checked against the tool's required list.
     * Fail the future with {@link MCPToolException} to choose the JSON-RPC error code;
     * any other failure is reported as an internal error.
     *
     * @return the structured result, a JsonObject, JsonArray or scalar
     */
    protected abstract Future<Object> executeTool(String toolName, JsonObject arguments);

    protected void registerTool(MCPTool tool) {
        tools.put(tool.getName(), tool);
        if (logLevel >= 3) {
            vertx.eventBus().publish("log", serverName + " registered tool: " + tool.getName() + ",3,MCPServerBase,MCP,System");
        }
    }

    protected List<MCPTool> getAllTools() {
        return new ArrayList<>(tools.values());
    }

    /**
     * Information returned by <code>initialize</code>.
     */
    protected JsonObject serverInfo() {
        return new JsonObject()
            .put("protocolVersion", PROTOCOL_VERSION)
            .put("capabilities", new JsonObject().put("tools", new JsonObject()))
            .put("serverInfo", new JsonObject()
                .put("name", serverName)
                .put("version", "1.0.0"));
    }

    /* ---------- JSON-RPC endpoint ---------- */

    private void handleRpc(RoutingContext ctx) {
        String sessionId = resolveSession(ctx);

        JsonObject body;
        try {
            body = ctx.body().asJsonObject();
        } catch (DecodeException | ClassCastException e) {
            body = null;
        }
        if (body == null) {
            reply(ctx, sessionId, 400, MCPResponse.error(null, MCPResponse.ErrorCodes.PARSE_ERROR, "Parse error: body is not a JSON object"));
            return;
        }

        MCPRequest request;
        try {
            request = MCPRequest.fromJson(body);
        } catch (ClassCastException e) {
            reply(ctx, sessionId, 400, MCPResponse.error(body.getValue("id"), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request: " + e.getMessage()));
            return;
        }
        if (!request.isValid()) {
            reply(ctx, sessionId, 400, MCPResponse.error(request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request: missing method"));
            return;
        }

        if (logLevel >= 3) {
            vertx.eventBus().publish("log", serverName + " handling " + request.getMethod() + " (session " + sessionId + "),3,MCPServerBase,MCP,Request");
        }

        Future<MCPResponse> response;
        try {
            response = dispatch(request);
        } catch (RuntimeException e) {
            response = Future.failedFuture(e);
        }

        response
            .onSuccess(r -> reply(ctx, sessionId, 200, r))
            .onFailure(err -> {
                vertx.eventBus().publish("log", serverName + " failed on " + request.getMethod() + ": " + err.getMessage() + ",0,MCPServerBase,MCP,Request");
                reply(ctx, sessionId, 500, MCPResponse.error(request.getId(), MCPResponse.ErrorCodes.INTERNAL_ERROR, String.valueOf(err.getMessage())));
            });
    }

    private Future<MCPResponse> dispatch(MCPRequest request) {
        Object id = request.getId();
        switch (request.getMethod()) {
            case "initialize":
                return Future.succeededFuture(MCPResponse.success(id, serverInfo()));
            case "tools/list":
                return Future.succeededFuture(MCPResponse.success(id, new JsonObject().put("tools", toolCatalog())));
            case "tools/call":
                return callTool(id, request.getParams());
            default:
                return Future.succeededFuture(MCPResponse.error(id, MCPResponse.ErrorCodes.METHOD_NOT_FOUND,
                    "Method not found: " + request.getMethod()));
        }
    }

    private Future<MCPResponse> callTool(Object id, JsonObject params) {
        String toolName = params.getString("name");
        JsonObject arguments = params.getJsonObject("arguments", new JsonObject());

        return invoke(toolName, arguments)
            .map(result -> MCPResponse.success(id, new JsonObject()
                .put("content", new JsonArray().add(new JsonObject()
                    .put("type", "text")
                    .put("text", Json.encodePrettily(result))))))
            .otherwise(err -> {
                int code = err instanceof MCPToolException
                    ? ((MCPToolException) err).getCode()
                    : MCPResponse.ErrorCodes.INTERNAL_ERROR;
                return MCPResponse.error(id, code, String.valueOf(err.getMessage()));
            });
    }

    /**
     * Validate and run a tool; shared by the JSON-RPC and direct endpoints.
     */
    private Future<Object> invoke(String toolName, JsonObject arguments) {
        if (toolName == null || toolName.isEmpty()) {
            return Future.failedFuture(new MCPToolException(MCPResponse.ErrorCodes.INVALID_PARAMS, "Missing tool name"));
        }
        MCPTool tool = tools.get(toolName);
        if (tool == null) {
            return Future.failedFuture(new MCPToolException(MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Unknown tool: " + toolName));
        }
        for (String required : tool.requiredArguments()) {
            if (arguments.getValue(required) == null) {
                return Future.failedFuture(new MCPToolException(MCPResponse.ErrorCodes.INVALID_PARAMS,
                    "Missing required argument '" + required + "' for tool " + toolName));
            }
        }
        try {
            return executeTool(toolName, arguments);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private String resolveSession(RoutingContext ctx) {
        String sessionId = ctx.request().getHeader(MCPClientBase.SESSION_HEADER);
        if (sessionId == null || sessionId.trim().isEmpty()) {
            sessionId = UUID.randomUUID().toString();
            if (logLevel >= 3) {
                vertx.eventBus().publish("log", serverName + " issued session " + sessionId + ",3,MCPServerBase,MCP,Session");
            }
        }
        sessions.computeIfAbsent(sessionId, k -> new ConcurrentLinkedDeque<>());
        return sessionId;
    }

    private void reply(RoutingContext ctx, String sessionId, int status, MCPResponse response) {
        JsonObject json = response.toJson();
        Deque<JsonObject> queue = sessions.get(sessionId);
        if (queue != null) {
            queue.addLast(json);
            while (queue.size() > MAX_QUEUED_MESSAGES) {
                queue.pollFirst();
            }
        }
        ctx.response().putHeader(MCPClientBase.SESSION_HEADER, sessionId);
        sendJson(ctx, status, json);
    }

    /* ---------- GET stream ---------- */

    private void handleStream(RoutingContext ctx) {
        String sessionId = resolveSession(ctx);
        Deque<JsonObject> queue = sessions.get(sessionId);
        HttpServerResponse response = ctx.response();

        response
            .putHeader("Content-Type", "text/event-stream")
            .putHeader("Cache-Control", "no-cache")
            .putHeader("Connection", "keep-alive")
            .putHeader("X-Accel-Buffering", "no")
            .putHeader(MCPClientBase.SESSION_HEADER, sessionId)
            .setChunked(true);
        response.write(": connected\n\n");

        long timerId = vertx.setPeriodic(KEEPALIVE_INTERVAL_MS, id -> {
            if (response.closed() || response.ended()) {
                vertx.cancelTimer(id);
                return;
            }
            JsonObject next = queue.pollFirst();
            if (next == null) {
                response.write(": keepalive\n\n");
            }
            while (next != null) {
                response.write("data: " + next.encode() + "\n\n");
                next = queue.pollFirst();
            }
        });

        response.closeHandler(v -> {
            vertx.cancelTimer(timerId);
            if (logLevel >= 3) {
                vertx.eventBus().publish("log", "Stream closed for session " + sessionId + ",3,MCPServerBase,MCP,Session");
            }
        });
    }

    /* ---------- direct endpoints ---------- */

    private void handleDirectToolsList(RoutingContext ctx) {
        sendJson(ctx, 200, new JsonObject().put("tools", toolCatalog()));
    }

    private void handleDirectToolCall(RoutingContext ctx) {
        JsonObject body;
        try {
            body = ctx.body().asJsonObject();
        } catch (DecodeException | ClassCastException e) {
            body = null;
        }
        if (body == null) {
            sendJson(ctx, 400, new JsonObject().put("detail", "Body must be a JSON object"));
            return;
        }

        invoke(body.getString("name"), body.getJsonObject("arguments", new JsonObject()))
            .onSuccess(result -> ctx.response()
                .setStatusCode(200)
                .putHeader("content-type", "application/json")
                .end(Json.encode(result)))
            .onFailure(err -> {
                int status = 500;
                if (err instanceof MCPToolException) {
                    int code = ((MCPToolException) err).getCode();
                    status = code == MCPResponse.ErrorCodes.INVALID_PARAMS ? 400
                        : code == MCPResponse.ErrorCodes.METHOD_NOT_FOUND ? 404 : 500;
                }
                sendJson(ctx, status, new JsonObject().put("detail", String.valueOf(err.getMessage())));
            });
    }

    private JsonArray toolCatalog() {
        JsonArray catalog = new JsonArray();
        for (MCPTool tool : tools.values()) {
            catalog.add(tool.toJson());
        }
        return catalog;
    }

    protected void sendJson(RoutingContext ctx, int status, JsonObject body) {
        ctx.response()
            .setStatusCode(status)
            .putHeader("content-type", "application/json")
            .end(body.encode());
    }
}
