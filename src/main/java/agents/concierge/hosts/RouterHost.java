package agents.concierge.hosts;

import agents.concierge.a2a.AgentCards;
import agents.concierge.services.MCPRouterService;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

/**
 * Exposes the router agent over HTTP under <code>/router</code> and on the event bus at
 * <code>host.router.process</code>.
 */
public class RouterHost extends AbstractVerticle {

    public static final String BASE_PATH = "/router";
    public static final String PROCESS_ADDRESS = "host.router.process";

    private final RouterAgent routerAgent;
    private final MCPRouterService routerService;

    public RouterHost(RouterAgent routerAgent, MCPRouterService routerService) {
        this.routerAgent = routerAgent;
        this.routerService = routerService;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        Router router = Router.router(vertx);
        router.post("/query").handler(this::handleQuery);
        router.get("/health").handler(ctx -> sendJson(ctx, 200, new JsonObject()
            .put("status", "healthy")
            .put("agent", "router")));
        router.get("/agent-card").handler(ctx -> sendJson(ctx, 200, routerAgent.agentCard().toJson()));
        router.get("/agents").handler(ctx -> sendJson(ctx, 200, new JsonObject().put("agents", AgentCards.listAllAgents())));
        routerService.registerRouter(BASE_PATH, router);

        vertx.eventBus().consumer(PROCESS_ADDRESS, this::processMessage);

        log("RouterHost started at " + BASE_PATH, 1);
        startPromise.complete();
    }

    private void handleQuery(RoutingContext ctx) {
        JsonObject body;
        try {
            body = ctx.body().asJsonObject();
        } catch (DecodeException | ClassCastException e) {
            sendJson(ctx, 400, new JsonObject().put("detail", "Request body must be a JSON object"));
            return;
        }
        String query = body != null && body.getValue("query") instanceof String ? body.getString("query") : null;
        if (query == null) {
            sendJson(ctx, 400, new JsonObject().put("detail", "Missing 'query' field"));
            return;
        }
        String queryId = body.getValue("query_id") instanceof String ? body.getString("query_id") : null;

        routerAgent.processQuery(query, queryId)
            .onSuccess(result -> sendJson(ctx, 200, result))
            .onFailure(err -> {
                log("Query processing failed: " + err.getMessage(), 0);
                sendJson(ctx, 500, new JsonObject().put("detail", String.valueOf(err.getMessage())));
            });
    }

    private void processMessage(Message<JsonObject> message) {
        JsonObject request = message.body();
        String query = request != null ? request.getString("query") : null;
        if (query == null) {
            message.fail(400, "Missing 'query' field");
            return;
        }
        routerAgent.processQuery(query, request.getString("query_id"))
            .onSuccess(message::reply)
            .onFailure(err -> message.fail(500, err.getMessage()));
    }

    private static void sendJson(RoutingContext ctx, int status, JsonObject json) {
        ctx.response()
            .setStatusCode(status)
            .putHeader("content-type", "application/json")
            .end(json.encode());
    }

    private void log(String message, int level) {
        vertx.eventBus().publish("log", message + "," + level + ",RouterHost,Host,System");
    }
}
