package agents.concierge.mcp.clients;

import agents.concierge.mcp.base.MCPClientBase;
import agents.concierge.mcp.base.MCPToolException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Typed client for the customer-service MCP server.
 *
 * <p>A JSON-RPC error from the server reads as "nothing there": <code>null</code>, an empty
 * array or <code>false</code>. Transport failures are not converted and fail the future.</p>
 */
public class CustomerServiceClient extends MCPClientBase {

    public static final int BULK_LIMIT = 1000;

    public CustomerServiceClient(Vertx vertx, String serverUrl, long timeoutMs) {
        super(vertx, "customer-service", serverUrl, timeoutMs);
    }

    /**
     * @return the customer, or null when the server does not know the id
     */
    public Future<JsonObject> getCustomer(int customerId) {
        return callTool("get_customer", new JsonObject().put("customer_id", customerId))
            .map(result -> {
                if (result instanceof JsonObject && ((JsonObject) result).containsKey("id")) {
                    return (JsonObject) result;
                }
                return (JsonObject) null;
            })
            .recover(toolErrorAs(null));
    }

    public Future<JsonArray> listCustomers(String status, int limit) {
        return callTool("list_customers", new JsonObject().put("status", status).put("limit", limit))
            .map(CustomerServiceClient::asArray)
            .recover(toolErrorAs(new JsonArray()));
    }

    /**
     * @return true when the server confirmed the update
     */
    public Future<Boolean> updateCustomer(int customerId, JsonObject data) {
        return callTool("update_customer", new JsonObject().put("customer_id", customerId).put("data", data))
            .map(result -> result instanceof JsonObject && ((JsonObject) result).containsKey("message"))
            .recover(toolErrorAs(Boolean.FALSE));
    }

    /**
     * @return the created ticket including its <code>ticket_id</code>, or null when rejected
     */
    public Future<JsonObject> createTicket(int customerId, String issue, String priority) {
        return callTool("create_ticket", new JsonObject()
                .put("customer_id", customerId)
                .put("issue", issue)
                .put("priority", priority))
            .map(result -> result instanceof JsonObject ? (JsonObject) result : null)
            .recover(toolErrorAs(null));
    }

    public Future<JsonArray> getCustomerHistory(int customerId) {
        return callTool("get_customer_history", new JsonObject().put("customer_id", customerId))
            .map(CustomerServiceClient::asArray)
            .recover(toolErrorAs(new JsonArray()));
    }

    /**
     * Tickets of the given priority across the listed customers, fetched one customer at a
     * time in list order. With no ids, every active customer is scanned.
     */
    public Future<JsonArray> getTicketsByPriority(String priority, List<Integer> customerIds) {
        Future<List<Integer>> ids;
        if (customerIds == null || customerIds.isEmpty()) {
            ids = listCustomers("active", BULK_LIMIT).map(CustomerServiceClient::idsOf);
        } else {
            ids = Future.succeededFuture(customerIds);
        }

        return ids
            .compose(this::collectHistories)
            .map(tickets -> {
                JsonArray matching = new JsonArray();
                for (int i = 0; i < tickets.size(); i++) {
                    JsonObject ticket = tickets.getJsonObject(i);
                    if (priority != null && priority.equals(ticket.getString("priority"))) {
                        matching.add(ticket);
                    }
                }
                return matching;
            });
    }

    public Future<JsonArray> getCustomersByStatus(String status) {
        return listCustomers(status, BULK_LIMIT);
    }

    /**
     * Concatenate the ticket histories of the given customers, strictly one call after another.
     */
    public Future<JsonArray> collectHistories(List<Integer> customerIds) {
        Future<JsonArray> chain = Future.succeededFuture(new JsonArray());
        for (Integer customerId : customerIds) {
            chain = chain.compose(all -> getCustomerHistory(customerId).map(history -> all.addAll(history)));
        }
        return chain;
    }

    public static List<Integer> idsOf(JsonArray customers) {
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < customers.size(); i++) {
            Integer id = customers.getJsonObject(i).getInteger("id");
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static JsonArray asArray(Object result) {
        if (result instanceof JsonArray) {
            return (JsonArray) result;
        }
        if (result instanceof JsonObject && ((JsonObject) result).getValue("result") instanceof JsonArray) {
            return ((JsonObject) result).getJsonArray("result");
        }
        return new JsonArray();
    }

    private <T> Function<Throwable, Future<T>> toolErrorAs(T fallback) {
        return err -> {
            if (err instanceof MCPToolException) {
                vertx.eventBus().publish("log", serverName + " tool error treated as empty: " + err.getMessage()
                    + ",2,CustomerServiceClient,MCP,Tool");
                return Future.succeededFuture(fallback);
            }
            return Future.failedFuture(err);
        };
    }
}
