package agents.concierge.transport;

import agents.concierge.a2a.AgentMessage;
import agents.concierge.a2a.AgentType;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import java.util.EnumMap;
import java.util.Map;

import static agents.concierge.Driver.logLevel;

/**
 * Posts the envelope to <code>{base URL}/process</code> of the specialist's service and
 * decodes the JSON reply. No retries: one failed hop fails the future.
 */
public class HttpAgentTransport implements AgentTransport {

    private final Vertx vertx;
    private final WebClient webClient;
    private final Map<AgentType, String> baseUrls = new EnumMap<>(AgentType.class);
    private final long timeoutMs;

    public HttpAgentTransport(Vertx vertx, Map<AgentType, String> baseUrls, long timeoutMs) {
        this.vertx = vertx;
        this.baseUrls.putAll(baseUrls);
        this.timeoutMs = timeoutMs;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
            .setConnectTimeout((int) Math.min(timeoutMs, Integer.MAX_VALUE))
            .setKeepAlive(true));
    }

    @Override
    public Future<AgentMessage> send(AgentType recipient, AgentMessage message) {
        String baseUrl = baseUrls.get(recipient);
        if (baseUrl == null) {
            return Future.failedFuture(new AgentTransportException(
                "Cannot send message to " + recipient.getValue() + ": no endpoint configured", null));
        }
        String url = baseUrl + "/process";
        if (logLevel >= 3) {
            vertx.eventBus().publish("log", "POST " + url + " for query " + message.getQueryId() + ",3,HttpAgentTransport,A2A,Send");
        }

        return webClient.postAbs(url)
            .timeout(timeoutMs)
            .putHeader("Content-Type", "application/json")
            .sendJsonObject(message.toJson())
            .recover(err -> Future.failedFuture(new AgentTransportException(
                "HTTP A2A communication with " + url + " failed: " + err.getMessage(), err)))
            .compose(response -> decode(url, response));
    }

    private Future<AgentMessage> decode(String url, HttpResponse<Buffer> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            vertx.eventBus().publish("log", url + " answered HTTP " + response.statusCode() + ",0,HttpAgentTransport,A2A,Receive");
            return Future.failedFuture(new AgentTransportException(
                url + " answered HTTP " + response.statusCode() + ": " + response.bodyAsString(), null));
        }
        try {
            JsonObject body = response.bodyAsJsonObject();
            return Future.succeededFuture(AgentMessage.fromJson(body));
        } catch (DecodeException | IllegalArgumentException | ClassCastException e) {
            return Future.failedFuture(new AgentTransportException("Undecodable reply from " + url + ": " + e.getMessage(), e));
        }
    }

    public void close() {
        webClient.close();
    }
}
