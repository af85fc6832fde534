package agents.concierge.a2a;

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Envelope exchanged between the router and the specialists.
 *
 * <p>Immutable: the content is copied on the way in and on the way out.
 * Wire form: <code>{from, to, type, content, query_id, timestamp}</code>.</p>
 */
public final class AgentMessage {

    private final AgentType from;
    private final AgentType to;
    private final MessageType type;
    private final JsonObject content;
    private final String queryId;
    private final Instant timestamp;

    /**
     * @param queryId correlation id of the run; a fresh one is generated when null
     */
    public AgentMessage(AgentType from, AgentType to, MessageType type, JsonObject content, String queryId) {
        this(from, to, type, content, queryId, Instant.now());
    }

    private AgentMessage(AgentType from, AgentType to, MessageType type, JsonObject content, String queryId, Instant timestamp) {
        if (from == null || to == null || type == null) {
            throw new IllegalArgumentException("Envelope needs from, to and type");
        }
        this.from = from;
        this.to = to;
        this.type = type;
        this.content = content != null ? content.copy() : new JsonObject();
        this.queryId = queryId != null ? queryId : UUID.randomUUID().toString();
        this.timestamp = timestamp;
    }

    public AgentType getFrom() {
        return from;
    }

    public AgentType getTo() {
        return to;
    }

    public MessageType getType() {
        return type;
    }

    public JsonObject getContent() {
        return content.copy();
    }

    public String getQueryId() {
        return queryId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Response envelope addressed back to the sender, carrying the same query id.
     */
    public AgentMessage reply(JsonObject responseContent) {
        return new AgentMessage(to, from, MessageType.RESPONSE, responseContent, queryId);
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("from", from.getValue())
            .put("to", to.getValue())
            .put("type", type.getValue())
            .put("content", content.copy())
            .put("query_id", queryId)
            .put("timestamp", timestamp.toString());
    }

    /**
     * Decode the wire form. The <code>from_agent</code>, <code>to_agent</code> and
     * <code>message_type</code> spellings are accepted as well.
     *
     * @throws IllegalArgumentException when a participant or type is missing or unknown
     */
    public static AgentMessage fromJson(JsonObject json) {
        if (json == null) {
            throw new IllegalArgumentException("Envelope body is missing");
        }
        AgentType from = AgentType.fromValue(firstString(json, "from", "from_agent"));
        AgentType to = AgentType.fromValue(firstString(json, "to", "to_agent"));
        MessageType type = MessageType.fromValue(firstString(json, "type", "message_type"));

        Object content = json.getValue("content");
        if (content != null && !(content instanceof JsonObject)) {
            throw new IllegalArgumentException("Envelope content must be an object");
        }

        Instant timestamp = Instant.now();
        String sent = json.getValue("timestamp") instanceof String ? json.getString("timestamp") : null;
        if (sent != null) {
            try {
                timestamp = Instant.parse(sent);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid envelope timestamp: " + sent, e);
            }
        }

        return new AgentMessage(from, to, type, (JsonObject) content, json.getString("query_id"), timestamp);
    }

    private static String firstString(JsonObject json, String key, String alternative) {
        Object value = json.getValue(key);
        if (value == null) {
            value = json.getValue(alternative);
        }
        return value instanceof String ? (String) value : null;
    }

    @Override
    public String toString() {
        return "AgentMessage{" + from.getValue() + " -> " + to.getValue() + ", type=" + type.getValue()
            + ", query_id='" + queryId + "', content=" + content.encode() + "}";
    }
}
