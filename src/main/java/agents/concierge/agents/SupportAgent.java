package agents.concierge.agents;

import agents.concierge.a2a.AgentAction;
import agents.concierge.a2a.AgentCard;
import agents.concierge.a2a.AgentCards;
import agents.concierge.a2a.AgentType;
import agents.concierge.mcp.clients.CustomerServiceClient;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Specialist for support work: canned responses, ticket creation and ticket queries.
 */
public class SupportAgent extends AbstractSpecialistAgent {

    private final int premiumCustomerId;

    public SupportAgent(Vertx vertx, CustomerServiceClient client, int premiumCustomerId) {
        super(vertx, client);
        this.premiumCustomerId = premiumCustomerId;
    }

    @Override
    public AgentType agentType() {
        return AgentType.SUPPORT;
    }

    @Override
    public AgentCard agentCard() {
        return AgentCards.SUPPORT;
    }

    @Override
    protected Future<JsonObject> perform(AgentAction action) {
        return switch (action.kind()) {
            case HANDLE_SUPPORT -> Future.succeededFuture(supportResponse((AgentAction.HandleSupport) action));
            case CREATE_TICKET -> createTicket((AgentAction.CreateTicket) action);
            case GET_TICKETS_BY_PRIORITY -> ticketsByPriority((AgentAction.GetTicketsByPriority) action);
            case CHECK_CAN_HANDLE -> Future.succeededFuture(checkCanHandle(((AgentAction.CheckCanHandle) action).getQuery()));
            case GET_OPEN_TICKETS_FOR_CUSTOMERS -> openTickets((AgentAction.GetOpenTicketsForCustomers) action);
            default -> unknownAction(action);
        };
    }

    /**
     * Pick a canned answer by vocabulary, first match wins. The tier is empty without
     * customer context, otherwise premium for the privileged id and standard for the rest.
     */
    JsonObject supportResponse(AgentAction.HandleSupport action) {
        String query = action.getQuery().toLowerCase();
        JsonArray actions = new JsonArray();
        String text;

        if (query.contains("upgrade") || query.contains("premium")) {
            text = "I can help you upgrade your account! Our premium tier includes priority support, advanced features, and exclusive benefits.";
            actions.add("Account upgrade assistance provided");
        } else if (query.contains("cancel")) {
            text = "I understand you'd like to cancel your subscription. Before we proceed, let me address any concerns you might have. What's the main reason for cancellation?";
            actions.add("Cancellation inquiry handled");
        } else if (query.contains("help") || query.contains("support")) {
            text = "I'm here to help! What specific issue are you experiencing? I can assist with account management, technical problems, billing questions, and more.";
        } else if (query.contains("billing")) {
            text = "I can help with billing questions. Let me look into your account details to provide accurate information.";
            actions.add("Billing inquiry routed");
        } else {
            text = "I'm here to assist you. How can I help today?";
        }

        JsonObject customerInfo = action.getCustomerInfo();
        String tier = "";
        if (customerInfo != null) {
            Object id = customerInfo.getValue("id");
            tier = id instanceof Number && ((Number) id).longValue() == premiumCustomerId ? "premium" : "standard";
        }

        return new JsonObject()
            .put("success", true)
            .put("response", text)
            .put("customer_tier", tier)
            .put("actions", actions)
            .put("customer_info", customerInfo);
    }

    /**
     * Capability heuristic. The condition is true unless the query mentions both "refund"
     * and "billing"; the reason text is kept consistent with that.
     */
    static JsonObject checkCanHandle(String query) {
        String lower = query.toLowerCase();
        // TODO: an "and" was probably meant here (decline anything touching refunds or billing); confirm before changing routing
        boolean canHandle = !lower.contains("refund") || !lower.contains("billing");
        return new JsonObject()
            .put("can_handle", canHandle)
            .put("reason", canHandle ? "I can handle this" : "May need billing context");
    }

    private Future<JsonObject> createTicket(AgentAction.CreateTicket action) {
        if (action.getCustomerId() == null) {
            return missing("customer_id", action);
        }
        if (action.getIssue() == null) {
            return missing("issue", action);
        }
        return client.createTicket(action.getCustomerId(), action.getIssue(), action.getPriority())
            .map(ticket -> ticket != null
                ? new JsonObject().put("success", true).put("ticket", ticket)
                : failure("Ticket could not be created for customer " + action.getCustomerId()));
    }

    private Future<JsonObject> ticketsByPriority(AgentAction.GetTicketsByPriority action) {
        if (action.getPriority() == null) {
            return missing("priority", action);
        }
        return client.getTicketsByPriority(action.getPriority(), action.getCustomerIds())
            .map(tickets -> new JsonObject()
                .put("success", true)
                .put("tickets", tickets)
                .put("count", tickets.size()));
    }

    private Future<JsonObject> openTickets(AgentAction.GetOpenTicketsForCustomers action) {
        return client.collectHistories(action.getCustomerIds())
            .map(history -> {
                JsonArray open = new JsonArray();
                for (int i = 0; i < history.size(); i++) {
                    JsonObject ticket = history.getJsonObject(i);
                    if ("open".equals(ticket.getString("status"))) {
                        open.add(ticket);
                    }
                }
                return new JsonObject()
                    .put("success", true)
                    .put("tickets", open)
                    .put("count", open.size());
            });
    }
}
