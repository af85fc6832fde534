package agents.concierge.agents;

import agents.concierge.a2a.AgentAction;
import agents.concierge.a2a.AgentMessage;
import agents.concierge.mcp.clients.CustomerServiceClient;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import static agents.concierge.Driver.logLevel;

/**
 * Shared envelope handling for the specialists: decode the action, run it, and turn any
 * failure into an in-band error reply addressed back to the sender.
 */
public abstract class AbstractSpecialistAgent implements SpecialistAgent {

    protected final Vertx vertx;
    protected final CustomerServiceClient client;

    protected AbstractSpecialistAgent(Vertx vertx, CustomerServiceClient client) {
        this.vertx = vertx;
        this.client = client;
    }

    @Override
    public Future<AgentMessage> process(AgentMessage message) {
        String className = getClass().getSimpleName();
        AgentAction action = AgentAction.parse(message.getContent());
        if (logLevel >= 2) {
            vertx.eventBus().publish("log", "Received " + message.getType().getValue() + " '" + action.name()
                + "' from " + message.getFrom().getValue() + ",2," + className + ",Agent,Receive");
        }
        if (logLevel >= 4) {
            vertx.eventBus().publish("log", "Content: " + message.getContent().encode() + ",4," + className + ",Agent,Receive");
        }

        Future<JsonObject> outcome;
        try {
            outcome = perform(action);
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }

        return outcome
            .recover(err -> {
                vertx.eventBus().publish("log", "Action '" + action.name() + "' failed: " + err.getMessage()
                    + ",1," + className + ",Agent,Failure");
                return Future.succeededFuture(failure(err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName()));
            })
            .map(content -> {
                if (logLevel >= 3) {
                    vertx.eventBus().publish("log", "Sending response to " + message.getFrom().getValue()
                        + ",3," + className + ",Agent,Send");
                }
                return message.reply(content);
            });
    }

    /**
     * Run one action and produce the response content.
     */
    protected abstract Future<JsonObject> perform(AgentAction action);

    protected static JsonObject failure(String error) {
        return new JsonObject().put("success", false).put("error", error);
    }

    protected static Future<JsonObject> unknownAction(AgentAction action) {
        return Future.succeededFuture(failure("Unknown action: " + action.name()));
    }

    protected static Future<JsonObject> missing(String argument, AgentAction action) {
        return Future.succeededFuture(failure("Missing required field '" + argument + "' for " + action.name()));
    }
}
