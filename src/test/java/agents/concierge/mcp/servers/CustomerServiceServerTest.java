package agents.concierge.mcp.servers;

import agents.concierge.ConciergeTestSupport;
import agents.concierge.mcp.base.MCPClientBase;
import agents.concierge.mcp.clients.CustomerServiceClient;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
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
public class CustomerServiceServerTest {

    @TempDir
    Path dir;

    private ConciergeTestSupport.Fixture fixture;

    @BeforeEach
    void start(Vertx vertx, VertxTestContext testContext) {
        ConciergeTestSupport.start(vertx, dir).onComplete(testContext.succeeding(f -> {
            fixture = f;
            testContext.completeNow();
        }));
    }

    @Test
    @DisplayName("initialize reports the server name and protocol version")
    void initialize(VertxTestContext testContext) {
        fixture.dataClient.initialize().onComplete(testContext.succeeding(info -> testContext.verify(() -> {
            Assertions.assertEquals("2024-11-05", info.getString("protocolVersion"));
            Assertions.assertEquals("customer-service-mcp", info.getJsonObject("serverInfo").getString("name"));
            Assertions.assertNotNull(fixture.dataClient.getSessionId());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Tool catalog lists all five tools")
    void listsTools(VertxTestContext testContext) {
        fixture.dataClient.listTools().onComplete(testContext.succeeding(tools -> testContext.verify(() -> {
            Assertions.assertEquals(5, tools.size());
            Assertions.assertEquals("get_customer", tools.getJsonObject(0).getString("name"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("get_customer round trip returns the customer and keeps one session")
    void getCustomerRoundTrip(VertxTestContext testContext) {
        CustomerServiceClient client = fixture.dataClient;
        client.getCustomer(1)
            .compose(first -> {
                String session = client.getSessionId();
                return client.getCustomer(2).map(second -> {
                    testContext.verify(() -> {
                        Assertions.assertEquals(1, first.getInteger("id"));
                        Assertions.assertEquals("Alice Johnson", first.getString("name"));
                        Assertions.assertEquals(2, second.getInteger("id"));
                        Assertions.assertNotNull(session);
                        Assertions.assertEquals(session, client.getSessionId());
                    });
                    return second;
                });
            })
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Unknown customer reads as null, not as a failure")
    void unknownCustomerIsNull(VertxTestContext testContext) {
        fixture.dataClient.getCustomer(999).onComplete(testContext.succeeding(customer -> testContext.verify(() -> {
            Assertions.assertNull(customer);
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Update then create ticket then history")
    void writesThroughTools(VertxTestContext testContext) {
        CustomerServiceClient client = fixture.dataClient;
        client.updateCustomer(3, new JsonObject().put("phone", "555-7777"))
            .compose(updated -> client.createTicket(3, "Broken widget", "high").map(ticket -> {
                testContext.verify(() -> {
                    Assertions.assertTrue(updated);
                    Assertions.assertEquals("open", ticket.getString("status"));
                });
                return ticket;
            }))
            .compose(ticket -> client.getCustomer(3))
            .compose(customer -> client.getTicketsByPriority("high", List.of(3)).map(tickets -> {
                testContext.verify(() -> {
                    Assertions.assertEquals("555-7777", customer.getString("phone"));
                    Assertions.assertEquals(1, tickets.size());
                    Assertions.assertEquals("Broken widget", tickets.getJsonObject(0).getString("issue"));
                });
                return tickets;
            }))
            .compose(v -> client.updateCustomer(999, new JsonObject().put("name", "Ghost")))
            .onComplete(testContext.succeeding(updated -> testContext.verify(() -> {
                Assertions.assertFalse(updated);
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Scanning every active customer finds both high-priority tickets")
    void ticketsByPriorityAcrossActive(VertxTestContext testContext) {
        fixture.supportClient.getTicketsByPriority("high", null).onComplete(testContext.succeeding(tickets -> testContext.verify(() -> {
            Assertions.assertEquals(2, tickets.size());
            Assertions.assertEquals(2, tickets.getJsonObject(0).getInteger("customer_id"));
            Assertions.assertEquals(12345, tickets.getJsonObject(1).getInteger("customer_id"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Protocol errors carry JSON-RPC codes")
    void protocolErrors(Vertx vertx, VertxTestContext testContext) {
        WebClient web = WebClient.create(vertx);
        JsonObject unknownMethod = new JsonObject().put("jsonrpc", "2.0").put("id", 1).put("method", "resources/list");
        JsonObject missingArgument = new JsonObject().put("jsonrpc", "2.0").put("id", 2).put("method", "tools/call")
            .put("params", new JsonObject().put("name", "get_customer").put("arguments", new JsonObject()));
        JsonObject unknownTool = new JsonObject().put("jsonrpc", "2.0").put("id", 3).put("method", "tools/call")
            .put("params", new JsonObject().put("name", "drop_tables"));

        web.postAbs(fixture.mcpUrl()).sendJsonObject(unknownMethod)
            .compose(r1 -> web.postAbs(fixture.mcpUrl()).sendJsonObject(missingArgument).map(r2 -> {
                testContext.verify(() -> {
                    Assertions.assertEquals(200, r1.statusCode());
                    Assertions.assertNotNull(r1.getHeader(MCPClientBase.SESSION_HEADER));
                    Assertions.assertEquals(-32601, r1.bodyAsJsonObject().getJsonObject("error").getInteger("code"));
                    Assertions.assertEquals(-32602, r2.bodyAsJsonObject().getJsonObject("error").getInteger("code"));
                });
                return r2;
            }))
            .compose(r2 -> web.postAbs(fixture.mcpUrl()).sendJsonObject(unknownTool))
            .compose(r3 -> web.postAbs(fixture.mcpUrl()).sendBuffer(Buffer.buffer("{not json")).map(r4 -> {
                testContext.verify(() -> {
                    Assertions.assertEquals(-32601, r3.bodyAsJsonObject().getJsonObject("error").getInteger("code"));
                    Assertions.assertEquals(400, r4.statusCode());
                    Assertions.assertEquals(-32700, r4.bodyAsJsonObject().getJsonObject("error").getInteger("code"));
                });
                return r4;
            }))
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Ids outside int range or with a fraction are rejected, not truncated")
    void nonIntegralIdsRejected(Vertx vertx, VertxTestContext testContext) {
        WebClient web = WebClient.create(vertx);
        JsonObject wrapped = new JsonObject().put("jsonrpc", "2.0").put("id", 1).put("method", "tools/call")
            .put("params", new JsonObject().put("name", "get_customer")
                .put("arguments", new JsonObject().put("customer_id", 4294967297L)));
        JsonObject fractional = new JsonObject().put("jsonrpc", "2.0").put("id", 2).put("method", "tools/call")
            .put("params", new JsonObject().put("name", "get_customer")
                .put("arguments", new JsonObject().put("customer_id", 1.9)));

        web.postAbs(fixture.mcpUrl()).sendJsonObject(wrapped)
            .compose(r1 -> web.postAbs(fixture.mcpUrl()).sendJsonObject(fractional).map(r2 -> {
                testContext.verify(() -> {
                    JsonObject first = r1.bodyAsJsonObject();
                    JsonObject second = r2.bodyAsJsonObject();
                    Assertions.assertNull(first.getValue("result"));
                    Assertions.assertEquals(-32602, first.getJsonObject("error").getInteger("code"));
                    Assertions.assertNull(second.getValue("result"));
                    Assertions.assertEquals(-32602, second.getJsonObject("error").getInteger("code"));
                });
                return r2;
            }))
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Direct endpoints return raw tool payloads")
    void directEndpoints(Vertx vertx, VertxTestContext testContext) {
        WebClient web = WebClient.create(vertx);
        web.postAbs(fixture.mcpUrl() + "/tools/call")
            .sendJsonObject(new JsonObject().put("name", "get_customer").put("arguments", new JsonObject().put("customer_id", 4)))
            .compose(found -> web.postAbs(fixture.mcpUrl() + "/tools/call")
                .sendJsonObject(new JsonObject().put("name", "nope")).map(missing -> {
                    testContext.verify(() -> {
                        Assertions.assertEquals(200, found.statusCode());
                        Assertions.assertEquals("Diana Prince", found.bodyAsJsonObject().getString("name"));
                        Assertions.assertEquals(404, missing.statusCode());
                    });
                    return missing;
                }))
            .compose(v -> web.getAbs(fixture.mcpUrl() + "/health").send())
            .onComplete(testContext.succeeding(health -> testContext.verify(() -> {
                Assertions.assertEquals("healthy", health.bodyAsJsonObject().getString("status"));
                testContext.completeNow();
            })));
    }
}
