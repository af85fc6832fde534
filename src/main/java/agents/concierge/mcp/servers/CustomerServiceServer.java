package agents.concierge.mcp.servers;

import agents.concierge.mcp.base.MCPResponse;
import agents.concierge.mcp.base.MCPServerBase;
import agents.concierge.mcp.base.MCPTool;
import agents.concierge.mcp.base.MCPToolException;
import agents.concierge.services.MCPRouterService;
import agents.concierge.store.CustomerStore;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.util.Set;
import java.util.concurrent.Callable;

import static agents.concierge.Driver.logLevel;

/**
 * MCP server exposing the customer and ticket store as five tools:
 * <code>get_customer</code>, <code>list_customers</code>, <code>update_customer</code>,
 * <code>create_ticket</code> and <code>get_customer_history</code>.
 * Store access is blocking and runs on the worker pool.
 */
public class CustomerServiceServer extends MCPServerBase {

    public static final String SERVER_NAME = "customer-service-mcp";

    private static final Set<String> PRIORITIES = Set.of("low", "medium", "high");
    private static final int DEFAULT_LIST_LIMIT = 100;

    private final CustomerStore store;

    public CustomerServiceServer(CustomerStore store, String serverPath, MCPRouterService routerService) {
        super(SERVER_NAME, serverPath, routerService);
        this.store = store;
    }

    @Override
    protected void initializeTools() {
        registerTool(MCPTool.builder("get_customer", "Retrieve customer information by customer ID")
            .integer("customer_id", "The customer ID to retrieve", true)
            .build());

        registerTool(MCPTool.builder("list_customers", "List customers filtered by status with optional limit")
            .string("status", "Filter by customer status", true, "active", "disabled")
            .integer("limit", "Maximum number of customers to return", false)
            .build());

        JsonObject updatable = new JsonObject()
            .put("name", new JsonObject().put("type", "string"))
            .put("email", new JsonObject().put("type", "string"))
            .put("phone", new JsonObject().put("type", "string"))
            .put("status", new JsonObject().put("type", "string")
                .put("enum", new JsonArray().add("active").add("disabled")));
        registerTool(MCPTool.builder("update_customer", "Update customer information")
            .integer("customer_id", "The customer ID to update", true)
            .object("data", "Customer data fields to update (name, email, phone, status)", true, updatable)
            .build());

        registerTool(MCPTool.builder("create_ticket", "Create a new support ticket")
            .integer("customer_id", "The customer ID for this ticket", true)
            .string("issue", "Description of the issue", true)
            .string("priority", "Ticket priority level", true, "low", "medium", "high")
            .build());

        registerTool(MCPTool.builder("get_customer_history", "Get all tickets for a customer")
            .integer("customer_id", "The customer ID to get history for", true)
            .build());
    }

    @Override
    protected Future<Object> executeTool(String toolName, JsonObject arguments) {
        if (logLevel >= 3) {
            vertx.eventBus().publish("log", "Executing tool " + toolName + ",3,CustomerServiceServer,MCP,Tool");
        }
        switch (toolName) {
            case "get_customer": {
                int customerId = intArgument(arguments, "customer_id");
                return blocking(() -> {
                    JsonObject customer = store.getCustomer(customerId);
                    if (customer == null) {
                        throw new MCPToolException(MCPResponse.ErrorCodes.INTERNAL_ERROR, "Customer " + customerId + " not found");
                    }
                    return customer;
                });
            }
            case "list_customers": {
                String status = arguments.getString("status");
                int limit = arguments.getValue("limit") == null ? DEFAULT_LIST_LIMIT : intArgument(arguments, "limit");
                return blocking(() -> store.listCustomers(status, limit));
            }
            case "update_customer": {
                int customerId = intArgument(arguments, "customer_id");
                JsonObject data = objectArgument(arguments, "data");
                return blocking(() -> {
                    int changed;
                    try {
                        changed = store.updateCustomer(customerId, data);
                    } catch (IllegalArgumentException e) {
                        throw new MCPToolException(MCPResponse.ErrorCodes.INTERNAL_ERROR, e.getMessage());
                    }
                    if (changed == 0) {
                        throw new MCPToolException(MCPResponse.ErrorCodes.INTERNAL_ERROR, "Customer " + customerId + " not found");
                    }
                    return new JsonObject().put("message", "Customer " + customerId + " updated");
                });
            }
            case "create_ticket": {
                int customerId = intArgument(arguments, "customer_id");
                String issue = arguments.getString("issue");
                String priority = arguments.getString("priority");
                if (!PRIORITIES.contains(priority)) {
                    throw new MCPToolException(MCPResponse.ErrorCodes.INVALID_PARAMS, "Invalid priority: " + priority);
                }
                return blocking(() -> store.createTicket(customerId, issue, priority));
            }
            case "get_customer_history": {
                int customerId = intArgument(arguments, "customer_id");
                return blocking(() -> store.getCustomerHistory(customerId));
            }
            default:
                throw new MCPToolException(MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Unknown tool: " + toolName);
        }
    }

    private Future<Object> blocking(Callable<Object> work) {
        return vertx.executeBlocking(work, false);
    }

    private static int intArgument(JsonObject arguments, String name) {
        Object value = arguments.getValue(name);
        if (value instanceof Number) {
            // 4294967297 or 1.9 must not silently become customer 1
            try {
                return new BigDecimal(value.toString()).intValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new MCPToolException(MCPResponse.ErrorCodes.INVALID_PARAMS, "Argument '" + name + "' must be an integer, got " + value);
            }
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new MCPToolException(MCPResponse.ErrorCodes.INVALID_PARAMS, "Argument '" + name + "' must be an integer");
            }
        }
        throw new MCPToolException(MCPResponse.ErrorCodes.INVALID_PARAMS, "Argument '" + name + "' must be an integer");
    }

    private static JsonObject objectArgument(JsonObject arguments, String name) {
        Object value = arguments.getValue(name);
        if (value instanceof JsonObject) {
            return (JsonObject) value;
        }
        throw new MCPToolException(MCPResponse.ErrorCodes.INVALID_PARAMS, "Argument '" + name + "' must be an object");
    }
}
