package agents.concierge.transport;

import agents.concierge.a2a.AgentMessage;
import agents.concierge.a2a.AgentType;
import agents.concierge.agents.SpecialistAgent;
import io.vertx.core.Future;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Calls the specialist object in-process.
 */
public class DirectAgentTransport implements AgentTransport {

    private final Map<AgentType, SpecialistAgent> agents = new EnumMap<>(AgentType.class);

    public DirectAgentTransport(List<SpecialistAgent> specialists) {
        for (SpecialistAgent agent : specialists) {
            agents.put(agent.agentType(), agent);
        }
    }

    @Override
    public Future<AgentMessage> send(AgentType recipient, AgentMessage message) {
        SpecialistAgent agent = agents.get(recipient);
        if (agent == null) {
            return Future.failedFuture(new AgentTransportException(
                "Cannot send message to " + recipient.getValue() + ": agent not available", null));
        }
        try {
            return agent.process(message)
                .recover(err -> Future.failedFuture(new AgentTransportException(
                    recipient.getValue() + " agent failed: " + err.getMessage(), err)));
        } catch (RuntimeException e) {
            return Future.failedFuture(new AgentTransportException(recipient.getValue() + " agent failed: " + e.getMessage(), e));
        }
    }
}
