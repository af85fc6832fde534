package agents.concierge.apis;

import agents.concierge.a2a.AgentMessage;
import agents.concierge.agents.SpecialistAgent;
import agents.concierge.services.MCPRouterService;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

import static agents.concierge.Driver.logLevel;

/**
 * HTTP face of one specialist: <code>POST {base}/process</code> takes an envelope and
 * answers with the reply envelope, plus health and agent-card endpoints.
 */
public class AgentServiceVerticle extends AbstractVerticle {

    private final SpecialistAgent agent;
    private final String basePath;
    private final MCPRouterService routerService;

    public AgentServiceVerticle(SpecialistAgent agent, String basePath, MCPRouterService routerService) {
        this.agent = agent;
        this.basePath = basePath;
        this.routerService = routerService;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        Router router = Router.router(vertx);
        router.post("/process").handler(this::handleProcess);
        router.get("/health").handler(ctx -> sendJson(ctx, 200, new JsonObject()
            .put("status", "healthy")
            .put("agent", agent.agentType().getValue())));
        router.get("/agent-card").handler(ctx -> sendJson(ctx, 200, agent.agentCard().toJson()));
        routerService.registerRouter(basePath, router);

        vertx.eventBus().publish("log", agent.agentCard().getName() + " service registered at " + basePath
            + ",1,AgentServiceVerticle,A2A,System");
        startPromise.complete();
    }

    private void handleProcess(RoutingContext ctx) {
        AgentMessage message;
        try {
            message = AgentMessage.fromJson(ctx.body().asJsonObject());
        } catch (DecodeException | IllegalArgumentException | ClassCastException e) {
            if (logLevel >= 1) {
                vertx.eventBus().publish("log", "Rejected envelope at " + basePath + ": " + e.getMessage()
                    + ",1,AgentServiceVerticle,A2A,Receive");
            }
            sendJson(ctx, 400, new JsonObject().put("detail", "Invalid envelope: " + e.getMessage()));
            return;
        }

        agent.process(message)
            .onSuccess(reply -> sendJson(ctx, 200, reply.toJson()))
            .onFailure(err -> {
                vertx.eventBus().publish("log", "Processing failed at " + basePath + ": " + err.getMessage()
                    + ",0,AgentServiceVerticle,A2A,Failure");
                sendJson(ctx, 500, new JsonObject().put("detail", String.valueOf(err.getMessage())));
            });
    }

    private static void sendJson(RoutingContext ctx, int status, JsonObject json) {
        ctx.response()
            .setStatusCode(status)
            .putHeader("content-type", "application/json")
            .end(json.encode());
    }
}
