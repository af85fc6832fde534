package agents.concierge.hosts;

import agents.concierge.a2a.AgentAction;
import agents.concierge.a2a.AgentCard;
import agents.concierge.a2a.AgentCards;
import agents.concierge.a2a.AgentMessage;
import agents.concierge.a2a.AgentType;
import agents.concierge.a2a.MessageType;
import agents.concierge.hosts.base.CoordinationRun;
import agents.concierge.hosts.base.Scenario;
import agents.concierge.hosts.base.ScenarioHandler;
import agents.concierge.hosts.base.intelligence.IntentAnalyzer;
import agents.concierge.hosts.base.intelligence.IntentTag;
import agents.concierge.hosts.base.intelligence.QueryIntent;
import agents.concierge.mcp.clients.CustomerServiceClient;
import agents.concierge.transport.AgentTransport;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static agents.concierge.Driver.logLevel;

/**
 * Orchestrator that classifies a query, picks one coordination scenario and drives the
 * specialists through it.
 *
 * <p>Every scenario is a chain of envelope round-trips: the next envelope is only sent once
 * the reply to the previous one has arrived. Each hop appends one line to the coordination
 * log when it is sent and one when its reply is accepted.</p>
 *
 * <p>{@link #processQuery(String, String)} never fails: transport errors, the iteration
 * limit and missing arguments all come back as a result with <code>success:false</code>.</p>
 */
public class RouterAgent {

    private static final Pattern EMAIL = Pattern.compile("(\\S+@\\S+\\.\\S+)");

    private final Vertx vertx;
    private final AgentTransport transport;
    private final IntentAnalyzer intentAnalyzer;
    private final int maxIterations;
    private final Map<Scenario, ScenarioHandler> handlers = new EnumMap<>(Scenario.class);

    public RouterAgent(Vertx vertx, AgentTransport transport, IntentAnalyzer intentAnalyzer, int maxIterations) {
        this.vertx = vertx;
        this.transport = transport;
        this.intentAnalyzer = intentAnalyzer;
        this.maxIterations = maxIterations;

        handlers.put(Scenario.TASK_ALLOCATION, this::handleTaskAllocation);
        handlers.put(Scenario.COMPLEX_QUERY, this::handleComplexQuery);
        handlers.put(Scenario.MULTI_INTENT, this::handleMultiIntentUpdate);
        handlers.put(Scenario.NEGOTIATION, this::handleNegotiation);
        handlers.put(Scenario.MULTI_STEP, this::handleMultiStep);
        handlers.put(Scenario.FALLBACK, run -> route(run, Scenario.TASK_ALLOCATION));
    }

    public AgentCard agentCard() {
        return AgentCards.ROUTER;
    }

    /**
     * @param queryId correlation id for the whole run; generated when null
     */
    public Future<JsonObject> processQuery(String query, String queryId) {
        String id = queryId != null ? queryId : UUID.randomUUID().toString();
        QueryIntent intent = intentAnalyzer.analyze(query);
        // Commas would split the CSV log columns
        log("Processing query " + id + ": " + query.replace(',', ';'), 2);
        log("Detected intent: " + intent, 3);

        CoordinationRun run = new CoordinationRun(query, id, intent);
        Future<JsonObject> outcome;
        try {
            outcome = route(run, Scenario.select(query.toLowerCase(), intent));
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }

        return outcome.recover(err -> {
            String reason = err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
            log("Query " + id + " failed in " + (run.getScenario() != null ? run.getScenario().getLabel() : "routing")
                + ": " + reason, 0);
            return Future.succeededFuture(run.errorResult(reason));
        });
    }

    private Future<JsonObject> route(CoordinationRun run, Scenario scenario) {
        if (!run.enter(scenario, maxIterations)) {
            log("Iteration limit of " + maxIterations + " reached for query " + run.getQueryId(), 1);
            return Future.succeededFuture(run.errorResult("Maximum iterations reached"));
        }
        log("Scenario selected: " + scenario.name() + " (pass " + run.getIterations() + ")", 2);
        return handlers.get(scenario).handle(run);
    }

    /* ---------- scenarios ---------- */

    private Future<JsonObject> handleTaskAllocation(CoordinationRun run) {
        QueryIntent intent = run.getIntent();
        Integer customerId = targetCustomer(intent);

        // A plain profile lookup never involves support
        if (customerId != null && !intent.isNeedsSupport() && intent.hasIntent(IntentTag.GET_CUSTOMER_INFO)) {
            return request(run, AgentType.CUSTOMER_DATA, new AgentAction.GetCustomer(customerId),
                    "Router → Data Agent: Get customer " + customerId)
                .map(content -> {
                    if (!succeeded(content)) {
                        run.logStep("Data Agent → Router: Customer " + customerId + " not found");
                        return run.result("Error: Could not retrieve customer information for ID " + customerId, false);
                    }
                    JsonObject customer = object(content, "customer");
                    run.setCustomerInfo(customer);
                    run.logStep("Data Agent → Router: Customer data retrieved");
                    String text = customer != null
                        ? ReportFormatter.customerProfile(customer)
                        : "Customer " + customerId + " not found.";
                    return run.result(text, true).put("customer_info", customer);
                });
        }

        return lookupCustomer(run, "Router → Data Agent: Get customer " + customerId, "Data Agent → Router: Customer data retrieved")
            .compose(v -> {
                if (intent.isNeedsSupport() || run.getCustomerInfo() == null) {
                    return request(run, AgentType.SUPPORT, new AgentAction.HandleSupport(run.getQuery(), run.getCustomerInfo()),
                            "Router → Support Agent: Handle support query")
                        .map(content -> {
                            run.logStep("Support Agent → Router: Response generated");
                            return run.result(text(content, "response", "Unable to generate response"), true)
                                .put("customer_info", run.getCustomerInfo());
                        });
                }
                return Future.succeededFuture(run.result(ReportFormatter.customerProfile(run.getCustomerInfo()), true)
                    .put("customer_info", run.getCustomerInfo()));
            });
    }

    private Future<JsonObject> handleNegotiation(CoordinationRun run) {
        return request(run, AgentType.SUPPORT, new AgentAction.CheckCanHandle(run.getQuery()),
                "Router → Support: Can you handle this?")
            .compose(check -> {
                boolean canHandle = Boolean.TRUE.equals(check.getValue("can_handle"));
                run.logStep("Support → Router: " + text(check, "reason", ""));

                return lookupCustomer(run, "Router → Data Agent: Get customer context", "Data Agent → Router: Context provided")
                    .compose(v -> request(run, AgentType.SUPPORT, new AgentAction.HandleSupport(run.getQuery(), run.getCustomerInfo()),
                        "Router → Support: Generate response with context"))
                    .map(content -> {
                        run.logStep("Support → Router: Coordinated response ready");
                        return run.result(text(content, "response", "Unable to generate response"), true)
                            .put("customer_info", run.getCustomerInfo())
                            .put("negotiation", new JsonObject()
                                .put("support_can_handle", canHandle)
                                .put("context_provided", run.getCustomerInfo() != null));
                    });
            });
    }

    private Future<JsonObject> handleComplexQuery(CoordinationRun run) {
        return request(run, AgentType.CUSTOMER_DATA,
                new AgentAction.ListCustomers("active", CustomerServiceClient.BULK_LIMIT),
                "Router → Data Agent: Get all active customers")
            .compose(listed -> {
                JsonArray customers = array(listed, "customers");
                run.logStep("Data Agent → Router: Found " + customers.size() + " active customers");

                List<Integer> ids = CustomerServiceClient.idsOf(customers);
                return request(run, AgentType.SUPPORT, new AgentAction.GetOpenTicketsForCustomers(ids),
                        "Router → Support: Get open tickets")
                    .map(found -> {
                        JsonArray tickets = array(found, "tickets");
                        run.logStep("Support → Router: Found " + tickets.size() + " open tickets");

                        Map<Integer, List<JsonObject>> grouped = ReportFormatter.groupByCustomer(customers, tickets);
                        return run.result(ReportFormatter.openTicketReport(customers, grouped), true)
                            .put("statistics", new JsonObject()
                                .put("active_customers", customers.size())
                                .put("customers_with_open_tickets", grouped.size())
                                .put("total_open_tickets", tickets.size()));
                    });
            });
    }

    private Future<JsonObject> handleMultiIntentUpdate(CoordinationRun run) {
        Integer customerId = targetCustomer(run.getIntent());
        if (customerId == null) {
            // Refused before any envelope leaves, so nothing is half-updated
            return Future.succeededFuture(run.errorResult("Customer ID required for updates"));
        }

        JsonObject updateData = new JsonObject();
        Matcher email = EMAIL.matcher(run.getQuery());
        if (email.find()) {
            updateData.put("email", email.group(1));
        }
        JsonArray actions = new JsonArray();

        Future<Void> update = Future.succeededFuture();
        if (!updateData.isEmpty()) {
            update = request(run, AgentType.CUSTOMER_DATA, new AgentAction.UpdateCustomer(customerId, updateData),
                    "Router → Data Agent: Update customer " + customerId)
                .map(content -> {
                    if (succeeded(content)) {
                        actions.add("Updated customer " + customerId + ": " + updateData.encode());
                        run.logStep("Data Agent → Router: Update successful");
                    } else {
                        run.logStep("Data Agent → Router: Update failed for customer " + customerId);
                    }
                    return null;
                });
        }

        return update
            .compose(v -> request(run, AgentType.CUSTOMER_DATA, new AgentAction.GetCustomer(customerId),
                "Router → Data Agent: Get customer info"))
            .compose(content -> {
                if (succeeded(content)) {
                    run.setCustomerInfo(object(content, "customer"));
                    run.logStep("Data Agent → Router: Customer data retrieved");
                } else {
                    run.logStep("Data Agent → Router: Customer " + customerId + " not found");
                }
                return request(run, AgentType.CUSTOMER_DATA, new AgentAction.GetCustomerHistory(customerId),
                    "Router → Data Agent: Get ticket history");
            })
            .map(content -> {
                JsonArray history = array(content, "history");
                run.logStep("Data Agent → Router: Found " + history.size() + " tickets");
                return run.result(ReportFormatter.updateAndHistoryReport(actions, run.getCustomerInfo(), history), true)
                    .put("customer_info", run.getCustomerInfo())
                    .put("ticket_history", history)
                    .put("actions", actions);
            });
    }

    private Future<JsonObject> handleMultiStep(CoordinationRun run) {
        return request(run, AgentType.CUSTOMER_DATA, new AgentAction.GetPremiumCustomers(),
                "Router → Data Agent: Get premium customers")
            .compose(listed -> {
                JsonArray customers = array(listed, "customers");
                run.logStep("Data Agent → Router: Found " + customers.size() + " customers");

                List<Integer> ids = CustomerServiceClient.idsOf(customers);
                return request(run, AgentType.SUPPORT, new AgentAction.GetTicketsByPriority("high", ids),
                        "Router → Support: Get high-priority tickets")
                    .map(found -> {
                        JsonArray tickets = array(found, "tickets");
                        run.logStep("Support → Router: Found " + tickets.size() + " high-priority tickets");
                        return run.result(ReportFormatter.priorityTicketReport(customers, tickets), true)
                            .put("statistics", new JsonObject()
                                .put("customers_found", customers.size())
                                .put("tickets_found", tickets.size()));
                    });
            });
    }

    /* ---------- envelope plumbing ---------- */

    /**
     * Fetch the customer named in the query into the run, if the query names one. Every
     * request gets its inbound line, a not-found wording when the specialist had no match.
     */
    private Future<Void> lookupCustomer(CoordinationRun run, String outboundLine, String inboundLine) {
        Integer customerId = targetCustomer(run.getIntent());
        if (customerId == null) {
            return Future.succeededFuture();
        }
        return request(run, AgentType.CUSTOMER_DATA, new AgentAction.GetCustomer(customerId), outboundLine)
            .map(content -> {
                if (succeeded(content)) {
                    run.setCustomerInfo(object(content, "customer"));
                    run.logStep(inboundLine);
                } else {
                    run.logStep("Data Agent → Router: Customer " + customerId + " not found");
                }
                return null;
            });
    }

    private Future<JsonObject> request(CoordinationRun run, AgentType recipient, AgentAction action, String outboundLine) {
        run.logStep(outboundLine);
        AgentMessage message = new AgentMessage(AgentType.ROUTER, recipient, MessageType.REQUEST, action.toContent(), run.getQueryId());
        if (logLevel >= 3) {
            log("Sending '" + action.name() + "' to " + recipient.getValue(), 3);
        }
        return transport.send(recipient, message).map(reply -> {
            if (logLevel >= 4) {
                log("Reply from " + recipient.getValue() + ": " + reply.getContent().encode(), 4);
            }
            return reply.getContent();
        });
    }

    /**
     * The customer the query is about. Id 0 never names a customer and counts as absent.
     */
    private static Integer targetCustomer(QueryIntent intent) {
        Integer customerId = intent.getCustomerId();
        return customerId == null || customerId == 0 ? null : customerId;
    }

    private static boolean succeeded(JsonObject content) {
        return Boolean.TRUE.equals(content.getValue("success"));
    }

    private static String text(JsonObject content, String key, String fallback) {
        Object value = content.getValue(key);
        return value instanceof String ? (String) value : fallback;
    }

    private static JsonObject object(JsonObject content, String key) {
        Object value = content.getValue(key);
        return value instanceof JsonObject ? (JsonObject) value : null;
    }

    private static JsonArray array(JsonObject content, String key) {
        Object value = content.getValue(key);
        return value instanceof JsonArray ? (JsonArray) value : new JsonArray();
    }

    private void log(String message, int level) {
        if (logLevel >= level) {
            vertx.eventBus().publish("log", message + "," + level + ",RouterAgent,Router,Coordination");
        }
    }
}
