package agents.concierge.a2a;

/**
 * Participants of a coordination run.
 */
public enum AgentType {
    ROUTER("router"),
    CUSTOMER_DATA("customer_data"),
    SUPPORT("support");

    private final String value;

    AgentType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AgentType fromValue(String value) {
        for (AgentType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + value);
    }
}
