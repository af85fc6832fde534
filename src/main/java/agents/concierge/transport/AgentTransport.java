package agents.concierge.transport;

import agents.concierge.a2a.AgentMessage;
import agents.concierge.a2a.AgentType;
import io.vertx.core.Future;

/**
 * Delivers an envelope to a specialist and yields its reply. Implementations differ only in
 * how the specialist is reached; a failed future always carries an {@link AgentTransportException}.
 */
public interface AgentTransport {

    Future<AgentMessage> send(AgentType recipient, AgentMessage message);
}
