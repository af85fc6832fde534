package agents.concierge.a2a;

public enum MessageType {
    QUERY("query"),
    REQUEST("request"),
    RESPONSE("response"),
    ESCALATION("escalation"),
    COORDINATION("coordination");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MessageType fromValue(String value) {
        for (MessageType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + value);
    }
}
