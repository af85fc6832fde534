package agents.concierge.hosts.base;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * One coordination protocol. Issues its envelopes strictly one after another and
 * completes with the aggregate result.
 */
@FunctionalInterface
public interface ScenarioHandler {

    Future<JsonObject> handle(CoordinationRun run);
}
