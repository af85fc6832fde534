package agents.concierge.a2a;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class AgentCardsTest {

    @Test
    @DisplayName("Registry lists the three participants")
    void listsAll() {
        JsonArray cards = AgentCards.listAllAgents();
        Assertions.assertEquals(3, cards.size());
        Assertions.assertEquals("router_agent", cards.getJsonObject(0).getString("agent_id"));
    }

    @Test
    @DisplayName("Tasks resolve to the agent offering them")
    void findsAgentForTask() {
        Assertions.assertEquals("customer_data_agent", AgentCards.findAgentForTask("get_customer_history"));
        Assertions.assertEquals("support_agent", AgentCards.findAgentForTask("check_can_handle"));
        Assertions.assertNull(AgentCards.findAgentForTask("launch_rocket"));
    }

    @Test
    @DisplayName("Card wire form carries capabilities and task schemas")
    void cardJson() {
        JsonObject card = AgentCards.getAgentCard("support_agent").toJson();
        Assertions.assertEquals("1.0.0", card.getString("version"));
        Assertions.assertTrue(card.getJsonArray("capabilities").contains("ticket_management"));
        Assertions.assertEquals("/a2a/support/process", card.getString("endpoint"));

        JsonObject schema = AgentCards.SUPPORT.getTaskSchema("create_ticket");
        Assertions.assertTrue(schema.getJsonArray("required").contains("priority"));
        Assertions.assertNull(AgentCards.getAgentCard("nobody"));
    }
}
