package agents.concierge.hosts;

import agents.concierge.ConciergeTestSupport;
import agents.concierge.hosts.base.intelligence.IntentAnalyzer;
import agents.concierge.transport.DirectAgentTransport;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.ReplyException;
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
public class RouterHostTest {

    @TempDir
    Path dir;

    private ConciergeTestSupport.Fixture fixture;

    @BeforeEach
    void start(Vertx vertx, VertxTestContext testContext) {
        ConciergeTestSupport.start(vertx, dir)
            .compose(f -> {
                fixture = f;
                RouterAgent router = new RouterAgent(vertx,
                    new DirectAgentTransport(List.of(f.dataAgent, f.supportAgent)), new IntentAnalyzer(), 10);
                return vertx.deployVerticle(new RouterHost(router, f.routerService));
            })
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("POST /router/query answers with the aggregate result")
    void query(Vertx vertx, VertxTestContext testContext) {
        WebClient.create(vertx)
            .postAbs(fixture.baseUrl() + "/router/query")
            .sendJsonObject(new JsonObject().put("query", "Get customer information for ID 1").put("query_id", "http-1"))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                JsonObject result = response.bodyAsJsonObject();
                Assertions.assertEquals("http-1", result.getString("query_id"));
                Assertions.assertTrue(result.getString("response").contains("Alice Johnson"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Missing query is a 400")
    void missingQuery(Vertx vertx, VertxTestContext testContext) {
        WebClient.create(vertx)
            .postAbs(fixture.baseUrl() + "/router/query")
            .sendJsonObject(new JsonObject().put("question", "hi"))
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(400, response.statusCode());
                Assertions.assertEquals("Missing 'query' field", response.bodyAsJsonObject().getString("detail"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Discovery endpoints list the agent cards")
    void discovery(Vertx vertx, VertxTestContext testContext) {
        WebClient web = WebClient.create(vertx);
        web.getAbs(fixture.baseUrl() + "/router/agents").send()
            .compose(agents -> web.getAbs(fixture.baseUrl() + "/router/agent-card").send().map(card -> {
                testContext.verify(() -> {
                    Assertions.assertEquals(3, agents.bodyAsJsonObject().getJsonArray("agents").size());
                    Assertions.assertEquals("router_agent", card.bodyAsJsonObject().getString("agent_id"));
                });
                return card;
            }))
            .onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Event bus address processes queries")
    void eventBus(Vertx vertx, VertxTestContext testContext) {
        vertx.eventBus().<JsonObject>request(RouterHost.PROCESS_ADDRESS, new JsonObject().put("query", "Get customer information for ID 3"))
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                Assertions.assertTrue(reply.body().getString("response").contains("Charlie Brown"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Event bus address rejects a message without query")
    void eventBusMissingQuery(Vertx vertx, VertxTestContext testContext) {
        vertx.eventBus().<JsonObject>request(RouterHost.PROCESS_ADDRESS, new JsonObject())
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                Assertions.assertEquals(400, ((ReplyException) err).failureCode());
                testContext.completeNow();
            })));
    }
}
