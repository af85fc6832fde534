package agents.concierge.agents;

import agents.concierge.a2a.AgentCard;
import agents.concierge.a2a.AgentMessage;
import agents.concierge.a2a.AgentType;
import io.vertx.core.Future;

/**
 * A participant that performs one action per envelope, keyed on <code>content.action</code>.
 * The returned future never fails: every problem is reported in-band as
 * <code>{success: false, error}</code>.
 */
public interface SpecialistAgent {

    AgentType agentType();

    AgentCard agentCard();

    Future<AgentMessage> process(AgentMessage message);
}
