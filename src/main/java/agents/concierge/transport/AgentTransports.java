package agents.concierge.transport;

import agents.concierge.a2a.AgentType;
import agents.concierge.agents.SpecialistAgent;
import agents.concierge.config.ConciergeConfig;
import io.vertx.core.Vertx;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses the transport strategy once, from configuration.
 */
public final class AgentTransports {

    private AgentTransports() {
    }

    public static AgentTransport create(Vertx vertx, ConciergeConfig config, List<SpecialistAgent> specialists) {
        if (config.isUseHttpTransport()) {
            Map<AgentType, String> urls = new EnumMap<>(AgentType.class);
            urls.put(AgentType.CUSTOMER_DATA, config.getCustomerDataAgentUrl());
            urls.put(AgentType.SUPPORT, config.getSupportAgentUrl());
            vertx.eventBus().publish("log", "Using HTTP-based A2A communication,1,AgentTransports,A2A,System");
            return new HttpAgentTransport(vertx, urls, config.getTimeoutMs());
        }
        vertx.eventBus().publish("log", "Using direct A2A communication,1,AgentTransports,A2A,System");
        return new DirectAgentTransport(specialists);
    }
}
