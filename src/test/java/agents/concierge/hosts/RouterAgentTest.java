package agents.concierge.hosts;

import agents.concierge.ConciergeTestSupport;
import agents.concierge.agents.SpecialistAgent;
import agents.concierge.hosts.base.intelligence.IntentAnalyzer;
import agents.concierge.transport.AgentTransport;
import agents.concierge.transport.DirectAgentTransport;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

@ExtendWith(VertxExtension.class)
public class RouterAgentTest {

    @TempDir
    Path dir;

    private ConciergeTestSupport.Fixture fixture;
    private RouterAgent router;

    @BeforeEach
    void start(Vertx vertx, VertxTestContext testContext) {
        ConciergeTestSupport.start(vertx, dir).onComplete(testContext.succeeding(f -> {
            fixture = f;
            router = routerWithLimit(vertx, 10);
            testContext.completeNow();
        }));
    }

    private RouterAgent routerWithLimit(Vertx vertx, int maxIterations) {
        List<SpecialistAgent> specialists = List.of(fixture.dataAgent, fixture.supportAgent);
        AgentTransport transport = new DirectAgentTransport(specialists);
        return new RouterAgent(vertx, transport, new IntentAnalyzer(), maxIterations);
    }

    @Test
    @DisplayName("Profile lookup is a single task allocation round trip")
    void taskAllocation(VertxTestContext testContext) {
        router.processQuery("Get customer information for ID 5", "q-5").onComplete(testContext.succeeding(result -> testContext.verify(() -> {
            Assertions.assertTrue(result.getBoolean("success"));
            Assertions.assertEquals("Task Allocation", result.getString("scenario"));
            Assertions.assertEquals("q-5", result.getString("query_id"));
            Assertions.assertTrue(result.getString("response").contains("Eve Davis"));
            Assertions.assertTrue(result.getString("response").contains("eve@example.com"));
            Assertions.assertEquals(new JsonArray()
                .add("Router → Data Agent: Get customer 5")
                .add("Data Agent → Router: Customer data retrieved"), result.getJsonArray("coordination_log"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Unknown id in a profile lookup is reported as an error")
    void taskAllocationUnknownCustomer(VertxTestContext testContext) {
        router.processQuery("Get customer information for ID 77", null).onComplete(testContext.succeeding(result -> testContext.verify(() -> {
            Assertions.assertFalse(result.getBoolean("success"));
            Assertions.assertEquals("Error: Could not retrieve customer information for ID 77", result.getString("response"));
            Assertions.assertNotNull(result.getString("query_id"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Support question with an id carries the customer context to support")
    void taskAllocationWithSupport(VertxTestContext testContext) {
        router.processQuery("Need help for 12345", null).onComplete(testContext.succeeding(result -> testContext.verify(() -> {
            Assertions.assertTrue(result.getBoolean("success"));
            Assertions.assertEquals("Task Allocation", result.getString("scenario"));
            Assertions.assertEquals("Premium Customer", result.getJsonObject("customer_info").getString("name"));
            Assertions.assertTrue(result.getString("response").startsWith("I'm here to help!"));
            Assertions.assertEquals(4, result.getJsonArray("coordination_log").size());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Cancellation with billing trouble negotiates with support")
    void negotiation(VertxTestContext testContext) {
        router.processQuery("I want to cancel my subscription but I'm having billing issues", null)
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                Assertions.assertEquals("Negotiation/Escalation", result.getString("scenario"));
                JsonObject negotiation = result.getJsonObject("negotiation");
                Assertions.assertTrue(negotiation.getBoolean("support_can_handle"));
                Assertions.assertFalse(negotiation.getBoolean("context_provided"));

                JsonArray log = result.getJsonArray("coordination_log");
                Assertions.assertTrue(log.size() >= 4);
                Assertions.assertEquals(0, log.size() % 2);
                Assertions.assertEquals("Router → Support: Can you handle this?", log.getString(0));
                Assertions.assertEquals("Support → Router: I can handle this", log.getString(1));
                Assertions.assertTrue(result.getString("response").contains("cancel your subscription"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Negotiation fetches context when the query names a customer")
    void negotiationWithContext(VertxTestContext testContext) {
        router.processQuery("Customer 2 wants a refund on billing", null)
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                JsonObject negotiation = result.getJsonObject("negotiation");
                Assertions.assertFalse(negotiation.getBoolean("support_can_handle"));
                Assertions.assertTrue(negotiation.getBoolean("context_provided"));
                Assertions.assertEquals(6, result.getJsonArray("coordination_log").size());
                Assertions.assertEquals("Data Agent → Router: Context provided", result.getJsonArray("coordination_log").getString(3));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Negotiation for an unknown customer still logs every reply")
    void negotiationUnknownCustomer(VertxTestContext testContext) {
        router.processQuery("Customer 99 wants to cancel, billing problem", null).onComplete(testContext.succeeding(result -> testContext.verify(() -> {
            JsonArray log = result.getJsonArray("coordination_log");
            Assertions.assertEquals("Negotiation/Escalation", result.getString("scenario"));
            Assertions.assertEquals(0, log.size() % 2);
            Assertions.assertEquals("Data Agent → Router: Customer 99 not found", log.getString(3));
            Assertions.assertFalse(result.getJsonObject("negotiation").getBoolean("context_provided"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Id 0 names no customer")
    void zeroIdIsAbsent(VertxTestContext testContext) {
        router.processQuery("Get customer information for ID 0", null)
            .compose(lookup -> router.processQuery("Update my email to zero@example.com for customer 0 and show my ticket history", null)
                .map(update -> {
                    testContext.verify(() -> {
                        Assertions.assertEquals("Task Allocation", lookup.getString("scenario"));
                        Assertions.assertTrue(lookup.getBoolean("success"));
                        Assertions.assertEquals("Router → Support Agent: Handle support query",
                            lookup.getJsonArray("coordination_log").getString(0));

                        Assertions.assertEquals("Customer ID required for updates", update.getString("error"));
                        Assertions.assertTrue(update.getJsonArray("coordination_log").isEmpty());
                    });
                    return update;
                }))
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Active customers are joined with their open tickets")
    void complexQuery(VertxTestContext testContext) {
        router.processQuery("Show me all active customers who have open tickets", null)
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                Assertions.assertEquals("Complex Query Coordination", result.getString("scenario"));
                JsonObject statistics = result.getJsonObject("statistics");
                Assertions.assertEquals(6, statistics.getInteger("active_customers"));
                Assertions.assertEquals(2, statistics.getInteger("customers_with_open_tickets"));
                Assertions.assertEquals(2, statistics.getInteger("total_open_tickets"));

                String response = result.getString("response");
                Assertions.assertTrue(response.startsWith("Found 2 active customer(s) with open tickets:"));
                Assertions.assertTrue(response.contains("• Ticket #1: Account access issue (Priority: medium)"));
                Assertions.assertTrue(response.contains("• Ticket #3: Billing inquiry (Priority: high)"));
                Assertions.assertFalse(response.contains("Password reset"));
                Assertions.assertFalse(response.contains("Premium account upgrade"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Update and ticket history run in order and report both")
    void multiIntentUpdate(VertxTestContext testContext) {
        router.processQuery("Update my email to new@email.com for customer 1 and show my ticket history", null)
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                Assertions.assertEquals("Multi-Intent Query", result.getString("scenario"));
                Assertions.assertEquals("Updated customer 1: {\"email\":\"new@email.com\"}", result.getJsonArray("actions").getString(0));
                Assertions.assertEquals("new@email.com", result.getJsonObject("customer_info").getString("email"));
                Assertions.assertEquals(2, result.getJsonArray("ticket_history").size());
                Assertions.assertEquals(new JsonArray()
                    .add("Router → Data Agent: Update customer 1")
                    .add("Data Agent → Router: Update successful")
                    .add("Router → Data Agent: Get customer info")
                    .add("Data Agent → Router: Customer data retrieved")
                    .add("Router → Data Agent: Get ticket history")
                    .add("Data Agent → Router: Found 2 tickets"), result.getJsonArray("coordination_log"));
                Assertions.assertTrue(result.getString("response").startsWith("Updates completed:"));
                Assertions.assertTrue(result.getString("response").contains("Ticket History (2 tickets):"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Update without a customer id is refused before any call")
    void multiIntentWithoutId(VertxTestContext testContext) {
        router.processQuery("Update my email and show my ticket history", null)
            .compose(result -> fixture.dataClient.getCustomer(1).map(alice -> {
                testContext.verify(() -> {
                    Assertions.assertFalse(result.getBoolean("success"));
                    Assertions.assertEquals("Customer ID required for updates", result.getString("error"));
                    Assertions.assertTrue(result.getJsonArray("coordination_log").isEmpty());
                    Assertions.assertEquals("alice@example.com", alice.getString("email"));
                });
                return alice;
            }))
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Update for an unknown customer logs a reply for every request")
    void multiIntentUnknownCustomer(VertxTestContext testContext) {
        router.processQuery("Update my email to ghost@example.com for customer 99 and show my ticket history", null)
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                JsonArray log = result.getJsonArray("coordination_log");
                Assertions.assertEquals("Multi-Intent Query", result.getString("scenario"));
                Assertions.assertEquals(0, log.size() % 2);
                Assertions.assertEquals(new JsonArray()
                    .add("Router → Data Agent: Update customer 99")
                    .add("Data Agent → Router: Update failed for customer 99")
                    .add("Router → Data Agent: Get customer info")
                    .add("Data Agent → Router: Customer 99 not found")
                    .add("Router → Data Agent: Get ticket history")
                    .add("Data Agent → Router: Found 0 tickets"), log);
                Assertions.assertTrue(result.getJsonArray("actions").isEmpty());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Premium customers' high-priority tickets are reported")
    void multiStep(VertxTestContext testContext) {
        router.processQuery("Show high-priority tickets for premium customers", null)
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                Assertions.assertEquals("Multi-Step Coordination", result.getString("scenario"));
                Assertions.assertEquals(6, result.getJsonObject("statistics").getInteger("customers_found"));
                Assertions.assertEquals(2, result.getJsonObject("statistics").getInteger("tickets_found"));
                String response = result.getString("response");
                Assertions.assertTrue(response.startsWith("Found 2 high-priority ticket(s) for premium customers:"));
                Assertions.assertTrue(response.contains("  Customer: Bob Smith (ID: 2)"));
                Assertions.assertTrue(response.contains("  Customer: Premium Customer (ID: 12345)"));
                Assertions.assertEquals(4, result.getJsonArray("coordination_log").size());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Read-only scenario repeated gives the same answer")
    void idempotentReads(VertxTestContext testContext) {
        String query = "Show me all active customers who have open tickets";
        router.processQuery(query, "same")
            .compose(first -> router.processQuery(query, "same").map(second -> {
                testContext.verify(() -> {
                    Assertions.assertEquals(first.getString("response"), second.getString("response"));
                    Assertions.assertEquals(first.getJsonObject("statistics"), second.getJsonObject("statistics"));
                    Assertions.assertEquals(first, second);
                });
                return second;
            }))
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Fallback counts as another pass and respects the iteration limit")
    void iterationLimit(Vertx vertx, VertxTestContext testContext) {
        RouterAgent limited = routerWithLimit(vertx, 1);
        limited.processQuery("show me customer 1", null)
            .compose(capped -> router.processQuery("show me customer 1", null).map(fallback -> {
                testContext.verify(() -> {
                    Assertions.assertFalse(capped.getBoolean("success"));
                    Assertions.assertEquals("Maximum iterations reached", capped.getString("error"));

                    Assertions.assertTrue(fallback.getBoolean("success"));
                    Assertions.assertEquals("Task Allocation", fallback.getString("scenario"));
                    Assertions.assertTrue(fallback.getString("response").contains("Alice Johnson"));
                });
                return fallback;
            }))
            .onComplete(testContext.succeedingThenComplete());
    }
}
