package agents.concierge.agents;

import agents.concierge.a2a.AgentAction;
import agents.concierge.a2a.AgentCard;
import agents.concierge.a2a.AgentCards;
import agents.concierge.a2a.AgentType;
import agents.concierge.mcp.clients.CustomerServiceClient;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

/**
 * Specialist for customer records: lookups, listings, updates and ticket history,
 * all served through the customer-service MCP client.
 */
public class CustomerDataAgent extends AbstractSpecialistAgent {

    public CustomerDataAgent(Vertx vertx, CustomerServiceClient client) {
        super(vertx, client);
    }

    @Override
    public AgentType agentType() {
        return AgentType.CUSTOMER_DATA;
    }

    @Override
    public AgentCard agentCard() {
        return AgentCards.CUSTOMER_DATA;
    }

    @Override
    protected Future<JsonObject> perform(AgentAction action) {
        return switch (action.kind()) {
            case GET_CUSTOMER -> getCustomer((AgentAction.GetCustomer) action);
            case LIST_CUSTOMERS -> listCustomers((AgentAction.ListCustomers) action);
            case UPDATE_CUSTOMER -> updateCustomer((AgentAction.UpdateCustomer) action);
            case GET_CUSTOMER_HISTORY -> getHistory((AgentAction.GetCustomerHistory) action);
            case GET_PREMIUM_CUSTOMERS -> premiumCustomers();
            default -> unknownAction(action);
        };
    }

    private Future<JsonObject> getCustomer(AgentAction.GetCustomer action) {
        Integer customerId = action.getCustomerId();
        if (customerId == null) {
            return missing("customer_id", action);
        }
        return client.getCustomer(customerId).map(customer -> customer != null
            ? new JsonObject().put("success", true).put("customer", customer)
            : failure("Customer " + customerId + " not found"));
    }

    private Future<JsonObject> listCustomers(AgentAction.ListCustomers action) {
        return client.listCustomers(action.getStatus(), action.getLimit())
            .map(customers -> new JsonObject()
                .put("success", true)
                .put("customers", customers)
                .put("count", customers.size()));
    }

    private Future<JsonObject> updateCustomer(AgentAction.UpdateCustomer action) {
        Integer customerId = action.getCustomerId();
        if (customerId == null) {
            return missing("customer_id", action);
        }
        return client.updateCustomer(customerId, action.getData())
            .map(updated -> new JsonObject()
                .put("success", updated)
                .put("customer_id", customerId));
    }

    private Future<JsonObject> getHistory(AgentAction.GetCustomerHistory action) {
        Integer customerId = action.getCustomerId();
        if (customerId == null) {
            return missing("customer_id", action);
        }
        return client.getCustomerHistory(customerId)
            .map(history -> new JsonObject()
                .put("success", true)
                .put("history", history)
                .put("count", history.size()));
    }

    // No tier column exists, so every active customer counts as premium
    private Future<JsonObject> premiumCustomers() {
        return client.listCustomers("active", CustomerServiceClient.BULK_LIMIT)
            .map(customers -> new JsonObject()
                .put("success", true)
                .put("customers", customers)
                .put("count", customers.size()));
    }
}
