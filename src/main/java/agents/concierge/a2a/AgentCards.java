package agents.concierge.a2a;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static registry of the cards of all participants.
 */
public final class AgentCards {

    public static final AgentCard ROUTER = new AgentCard(
        "router_agent",
        "Router Agent",
        "Orchestrator agent that routes queries and coordinates other agents",
        List.of(AgentCapability.QUERY_ROUTING, AgentCapability.COORDINATION),
        new JsonArray()
            .add(task("route_query", "Analyze query intent and route to appropriate agents", schema()
                .put("properties", new JsonObject()
                    .put("query", typed("string").put("description", "Customer query"))
                    .put("query_id", typed("string").put("description", "Unique query identifier")))
                .put("required", new JsonArray().add("query"))))
            .add(task("coordinate_agents", "Coordinate multiple agents to handle complex queries", schema()
                .put("properties", new JsonObject()
                    .put("agents", typed("array").put("description", "List of agent IDs to coordinate"))
                    .put("tasks", typed("array").put("description", "Tasks to distribute"))
                    .put("query_id", typed("string").put("description", "Query identifier")))
                .put("required", new JsonArray().add("agents").add("tasks")))),
        "/router/query");

    public static final AgentCard CUSTOMER_DATA = new AgentCard(
        "customer_data_agent",
        "Customer Data Agent",
        "Specialist agent for customer data operations via MCP",
        List.of(AgentCapability.DATA_RETRIEVAL, AgentCapability.DATA_UPDATE),
        new JsonArray()
            .add(task("get_customer", "Retrieve customer information by ID", customerIdSchema()))
            .add(task("list_customers", "List customers filtered by status", schema()
                .put("properties", new JsonObject()
                    .put("status", statusEnum())
                    .put("limit", typed("integer").put("default", 100)))
                .put("required", new JsonArray().add("status"))))
            .add(task("update_customer", "Update customer information", schema()
                .put("properties", new JsonObject()
                    .put("customer_id", typed("integer"))
                    .put("data", typed("object").put("properties", new JsonObject()
                        .put("name", typed("string"))
                        .put("email", typed("string"))
                        .put("phone", typed("string"))
                        .put("status", statusEnum()))))
                .put("required", new JsonArray().add("customer_id").add("data"))))
            .add(task("get_customer_history", "Get customer ticket history", customerIdSchema()))
            .add(task("get_premium_customers", "List the customers treated as premium (all active customers)", schema()
                .put("properties", new JsonObject()))),
        "/a2a/customer-data/process");

    public static final AgentCard SUPPORT = new AgentCard(
        "support_agent",
        "Support Agent",
        "Specialist agent for customer support operations",
        List.of(AgentCapability.TICKET_MANAGEMENT, AgentCapability.SUPPORT_RESPONSE),
        new JsonArray()
            .add(task("handle_support", "Handle customer support queries", schema()
                .put("properties", new JsonObject()
                    .put("query", typed("string").put("description", "Support query"))
                    .put("customer_info", typed("object").put("description", "Customer context")))
                .put("required", new JsonArray().add("query"))))
            .add(task("create_ticket", "Create a new support ticket", schema()
                .put("properties", new JsonObject()
                    .put("customer_id", typed("integer"))
                    .put("issue", typed("string"))
                    .put("priority", priorityEnum()))
                .put("required", new JsonArray().add("customer_id").add("issue").add("priority"))))
            .add(task("get_tickets_by_priority", "Get tickets filtered by priority", schema()
                .put("properties", new JsonObject()
                    .put("priority", priorityEnum())
                    .put("customer_ids", idArray()))
                .put("required", new JsonArray().add("priority"))))
            .add(task("check_can_handle", "Check if agent can handle a query", schema()
                .put("properties", new JsonObject().put("query", typed("string")))
                .put("required", new JsonArray().add("query"))))
            .add(task("get_open_tickets_for_customers", "Get the open tickets of the given customers", schema()
                .put("properties", new JsonObject().put("customer_ids", idArray()))
                .put("required", new JsonArray().add("customer_ids")))),
        "/a2a/support/process");

    private static final Map<String, AgentCard> REGISTRY;

    static {
        Map<String, AgentCard> registry = new LinkedHashMap<>();
        registry.put(ROUTER.getAgentId(), ROUTER);
        registry.put(CUSTOMER_DATA.getAgentId(), CUSTOMER_DATA);
        registry.put(SUPPORT.getAgentId(), SUPPORT);
        REGISTRY = Collections.unmodifiableMap(registry);
    }

    private AgentCards() {
    }

    /**
     * @return the card, or null for an unknown agent id
     */
    public static AgentCard getAgentCard(String agentId) {
        return REGISTRY.get(agentId);
    }

    public static JsonArray listAllAgents() {
        JsonArray cards = new JsonArray();
        REGISTRY.values().forEach(card -> cards.add(card.toJson()));
        return cards;
    }

    /**
     * @return id of the first agent (in registry order) offering the task, or null
     */
    public static String findAgentForTask(String taskName) {
        for (AgentCard card : REGISTRY.values()) {
            if (card.canHandleTask(taskName)) {
                return card.getAgentId();
            }
        }
        return null;
    }

    private static JsonObject task(String name, String description, JsonObject inputSchema) {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("input_schema", inputSchema)
            .put("output_schema", schema());
    }

    private static JsonObject schema() {
        return typed("object");
    }

    private static JsonObject typed(String type) {
        return new JsonObject().put("type", type);
    }

    private static JsonObject customerIdSchema() {
        return schema()
            .put("properties", new JsonObject().put("customer_id", typed("integer").put("description", "Customer ID")))
            .put("required", new JsonArray().add("customer_id"));
    }

    private static JsonObject statusEnum() {
        return typed("string").put("enum", new JsonArray().add("active").add("disabled"));
    }

    private static JsonObject priorityEnum() {
        return typed("string").put("enum", new JsonArray().add("low").add("medium").add("high"));
    }

    private static JsonObject idArray() {
        return typed("array").put("items", typed("integer"));
    }
}
