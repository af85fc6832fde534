package agents.concierge.transport;

import agents.concierge.ConciergeTestSupport;
import agents.concierge.a2a.AgentMessage;
import agents.concierge.a2a.AgentType;
import agents.concierge.a2a.MessageType;
import agents.concierge.agents.SpecialistAgent;
import agents.concierge.hosts.RouterAgent;
import agents.concierge.hosts.base.intelligence.IntentAnalyzer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@ExtendWith(VertxExtension.class)
public class HttpAgentTransportTest {

    private static final List<String> QUERIES = List.of(
        "Get customer information for ID 5",
        "I want to cancel my subscription but I'm having billing issues",
        "Show me all active customers who have open tickets",
        "Show high-priority tickets for premium customers");

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

    private HttpAgentTransport httpTransport(Vertx vertx, String baseUrl) {
        Map<AgentType, String> urls = new EnumMap<>(AgentType.class);
        urls.put(AgentType.CUSTOMER_DATA, baseUrl + "/a2a/customer-data");
        urls.put(AgentType.SUPPORT, baseUrl + "/a2a/support");
        return new HttpAgentTransport(vertx, urls, ConciergeTestSupport.TIMEOUT_MS);
    }

    @Test
    @DisplayName("Direct and HTTP transports give the same aggregate results")
    void strategiesAreEquivalent(Vertx vertx, VertxTestContext testContext) {
        List<SpecialistAgent> specialists = List.of(fixture.dataAgent, fixture.supportAgent);
        RouterAgent direct = new RouterAgent(vertx, new DirectAgentTransport(specialists), new IntentAnalyzer(), 10);
        RouterAgent overHttp = new RouterAgent(vertx, httpTransport(vertx, fixture.baseUrl()), new IntentAnalyzer(), 10);

        Future<Void> chain = Future.succeededFuture();
        for (int i = 0; i < QUERIES.size(); i++) {
            String query = QUERIES.get(i);
            String queryId = "eq-" + i;
            chain = chain.compose(v -> direct.processQuery(query, queryId)
                .compose(viaDirect -> overHttp.processQuery(query, queryId).map(viaHttp -> {
                    testContext.verify(() -> {
                        Assertions.assertTrue(viaDirect.getBoolean("success"), query);
                        Assertions.assertEquals(viaDirect, viaHttp, query);
                    });
                    return null;
                })));
        }
        chain.onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Envelope travels to the specialist service and back")
    void sendsEnvelope(Vertx vertx, VertxTestContext testContext) {
        AgentMessage request = new AgentMessage(AgentType.ROUTER, AgentType.CUSTOMER_DATA, MessageType.REQUEST,
            new JsonObject().put("action", "get_customer").put("customer_id", 2), "q-http");

        httpTransport(vertx, fixture.baseUrl()).send(AgentType.CUSTOMER_DATA, request)
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                Assertions.assertEquals(AgentType.CUSTOMER_DATA, reply.getFrom());
                Assertions.assertEquals(MessageType.RESPONSE, reply.getType());
                Assertions.assertEquals("q-http", reply.getQueryId());
                Assertions.assertEquals("Bob Smith", reply.getContent().getJsonObject("customer").getString("name"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Unreachable specialist aborts the scenario with an error result")
    void unreachableSpecialist(Vertx vertx, VertxTestContext testContext) {
        RouterAgent router = new RouterAgent(vertx, httpTransport(vertx, "http://localhost:1"), new IntentAnalyzer(), 10);

        router.processQuery("Get customer information for ID 5", "q-down")
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                Assertions.assertFalse(result.getBoolean("success"));
                Assertions.assertEquals("Task Allocation", result.getString("scenario"));
                Assertions.assertTrue(result.getString("error").contains("/a2a/customer-data/process"));
                Assertions.assertTrue(result.getString("response").startsWith("Error: "));
                Assertions.assertEquals(1, result.getJsonArray("coordination_log").size());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Non-2xx answer fails the hop")
    void rejectedEnvelope(Vertx vertx, VertxTestContext testContext) {
        Map<AgentType, String> urls = new EnumMap<>(AgentType.class);
        urls.put(AgentType.SUPPORT, fixture.baseUrl() + "/a2a/nowhere");
        HttpAgentTransport transport = new HttpAgentTransport(vertx, urls, ConciergeTestSupport.TIMEOUT_MS);
        AgentMessage request = new AgentMessage(AgentType.ROUTER, AgentType.SUPPORT, MessageType.REQUEST,
            new JsonObject().put("action", "check_can_handle").put("query", "hi"), null);

        transport.send(AgentType.SUPPORT, request).onComplete(testContext.failing(err -> testContext.verify(() -> {
            Assertions.assertTrue(err instanceof AgentTransportException);
            Assertions.assertTrue(err.getMessage().contains("404"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Missing specialist in direct mode fails the hop")
    void directMissingAgent(VertxTestContext testContext) {
        DirectAgentTransport transport = new DirectAgentTransport(List.of(fixture.dataAgent));
        AgentMessage request = new AgentMessage(AgentType.ROUTER, AgentType.SUPPORT, MessageType.REQUEST, new JsonObject(), null);

        transport.send(AgentType.SUPPORT, request).onComplete(testContext.failing(err -> testContext.verify(() -> {
            Assertions.assertEquals("Cannot send message to support: agent not available", err.getMessage());
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Specialist service rejects a malformed envelope with 400")
    void serviceRejectsMalformedEnvelope(Vertx vertx, VertxTestContext testContext) {
        WebClient web = WebClient.create(vertx);
        web.postAbs(fixture.baseUrl() + "/a2a/support/process")
            .sendJsonObject(new JsonObject().put("from", "router").put("to", "nobody").put("type", "request"))
            .compose(bad -> web.getAbs(fixture.baseUrl() + "/a2a/support/health").send().map(health -> {
                testContext.verify(() -> {
                    Assertions.assertEquals(400, bad.statusCode());
                    Assertions.assertNotNull(bad.bodyAsJsonObject().getString("detail"));
                    Assertions.assertEquals("support", health.bodyAsJsonObject().getString("agent"));
                });
                return health;
            }))
            .onComplete(testContext.succeedingThenComplete());
    }
}
