package agents.concierge.a2a;

public enum AgentCapability {
    DATA_RETRIEVAL("data_retrieval"),
    DATA_UPDATE("data_update"),
    TICKET_MANAGEMENT("ticket_management"),
    QUERY_ROUTING("query_routing"),
    SUPPORT_RESPONSE("support_response"),
    COORDINATION("coordination");

    private final String value;

    AgentCapability(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
