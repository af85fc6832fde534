package agents.concierge.hosts;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain-text renderings of the aggregate results.
 */
public final class ReportFormatter {

    private ReportFormatter() {
    }

    public static String customerProfile(JsonObject customer) {
        return "Customer Information:\n"
            + "  ID: " + field(customer, "id") + "\n"
            + "  Name: " + field(customer, "name") + "\n"
            + "  Email: " + field(customer, "email") + "\n"
            + "  Phone: " + field(customer, "phone") + "\n"
            + "  Status: " + field(customer, "status");
    }

    /**
     * Group tickets under their customers. Tickets of customers not in the list are
     * dropped; customers keep the order in which their first ticket appears.
     */
    public static Map<Integer, List<JsonObject>> groupByCustomer(JsonArray customers, JsonArray tickets) {
        Map<Integer, List<JsonObject>> grouped = new LinkedHashMap<>();
        for (int i = 0; i < tickets.size(); i++) {
            JsonObject ticket = tickets.getJsonObject(i);
            Integer customerId = ticket.getInteger("customer_id");
            if (customerId == null || findCustomer(customers, customerId) == null) {
                continue;
            }
            grouped.computeIfAbsent(customerId, id -> new ArrayList<>()).add(ticket);
        }
        return grouped;
    }

    public static String openTicketReport(JsonArray customers, Map<Integer, List<JsonObject>> grouped) {
        List<String> lines = new ArrayList<>();
        lines.add("Found " + grouped.size() + " active customer(s) with open tickets:\n");
        for (Map.Entry<Integer, List<JsonObject>> entry : grouped.entrySet()) {
            JsonObject customer = findCustomer(customers, entry.getKey());
            List<JsonObject> tickets = entry.getValue();
            lines.add("- " + field(customer, "name") + " (ID: " + entry.getKey() + ", Email: " + field(customer, "email") + ")");
            lines.add("  Open Tickets: " + tickets.size());
            for (JsonObject ticket : tickets) {
                lines.add("    • Ticket #" + field(ticket, "id") + ": " + field(ticket, "issue")
                    + " (Priority: " + field(ticket, "priority") + ")");
            }
            lines.add("");
        }
        return String.join("\n", lines);
    }

    public static String updateAndHistoryReport(JsonArray actions, JsonObject customer, JsonArray history) {
        List<String> lines = new ArrayList<>();
        if (!actions.isEmpty()) {
            lines.add("Updates completed:");
            for (int i = 0; i < actions.size(); i++) {
                lines.add("  ✓ " + actions.getValue(i));
            }
            lines.add("");
        }
        if (customer != null) {
            lines.add("Customer Information:");
            lines.add("  Name: " + field(customer, "name"));
            lines.add("  Email: " + field(customer, "email"));
            lines.add("  Status: " + field(customer, "status"));
            lines.add("");
        }
        lines.add("Ticket History (" + history.size() + " tickets):");
        if (history.isEmpty()) {
            lines.add("  No tickets found.");
        }
        for (int i = 0; i < history.size(); i++) {
            JsonObject ticket = history.getJsonObject(i);
            lines.add("  • Ticket #" + field(ticket, "id") + ": " + field(ticket, "issue"));
            lines.add("    Status: " + field(ticket, "status") + ", Priority: " + field(ticket, "priority"));
            lines.add("    Created: " + field(ticket, "created_at"));
        }
        return String.join("\n", lines);
    }

    public static String priorityTicketReport(JsonArray customers, JsonArray tickets) {
        if (tickets.isEmpty()) {
            return "No high-priority tickets found for premium customers.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("Found " + tickets.size() + " high-priority ticket(s) for premium customers:\n");
        for (int i = 0; i < tickets.size(); i++) {
            JsonObject ticket = tickets.getJsonObject(i);
            Integer customerId = ticket.getInteger("customer_id");
            JsonObject customer = customerId != null ? findCustomer(customers, customerId) : null;
            String name = customer != null && customer.getValue("name") != null
                ? customer.getValue("name").toString()
                : "Customer " + customerId;
            lines.add("- Ticket #" + field(ticket, "id") + ": " + field(ticket, "issue"));
            lines.add("  Customer: " + name + " (ID: " + customerId + ")");
            lines.add("  Status: " + field(ticket, "status") + ", Priority: " + field(ticket, "priority"));
            lines.add("");
        }
        return String.join("\n", lines);
    }

    static JsonObject findCustomer(JsonArray customers, int customerId) {
        for (int i = 0; i < customers.size(); i++) {
            JsonObject customer = customers.getJsonObject(i);
            Integer id = customer.getInteger("id");
            if (id != null && id == customerId) {
                return customer;
            }
        }
        return null;
    }

    private static String field(JsonObject json, String key) {
        Object value = json != null ? json.getValue(key) : null;
        return value != null ? value.toString() : "N/A";
    }
}
