package agents.concierge.a2a;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The closed set of actions an envelope can ask a specialist to perform, keyed on the
 * <code>action</code> field of the content. Each variant carries its own typed arguments.
 * Parsing is lenient: a missing or malformed argument becomes null so the receiving
 * specialist can answer with an in-band error.
 */
public abstract class AgentAction {

    public enum Kind {
        GET_CUSTOMER("get_customer"),
        LIST_CUSTOMERS("list_customers"),
        UPDATE_CUSTOMER("update_customer"),
        GET_CUSTOMER_HISTORY("get_customer_history"),
        GET_PREMIUM_CUSTOMERS("get_premium_customers"),
        HANDLE_SUPPORT("handle_support"),
        CREATE_TICKET("create_ticket"),
        GET_TICKETS_BY_PRIORITY("get_tickets_by_priority"),
        CHECK_CAN_HANDLE("check_can_handle"),
        GET_OPEN_TICKETS_FOR_CUSTOMERS("get_open_tickets_for_customers"),
        UNKNOWN(null);

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        static Kind fromWire(String name) {
            for (Kind kind : values()) {
                if (kind.wireName != null && kind.wireName.equals(name)) {
                    return kind;
                }
            }
            return UNKNOWN;
        }
    }

    private final Kind kind;

    private AgentAction(Kind kind) {
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Name as it appears on the wire.
     */
    public String name() {
        return kind.getWireName();
    }

    /**
     * Envelope content for this action, including the <code>action</code> field.
     */
    public final JsonObject toContent() {
        JsonObject content = new JsonObject().put("action", name());
        writeArguments(content);
        return content;
    }

    protected abstract void writeArguments(JsonObject content);

    public static AgentAction parse(JsonObject content) {
        Object rawName = content.getValue("action");
        String name = rawName instanceof String ? (String) rawName : null;
        switch (Kind.fromWire(name)) {
            case GET_CUSTOMER:
                return new GetCustomer(optInt(content, "customer_id"));
            case LIST_CUSTOMERS: {
                Integer limit = optInt(content, "limit");
                return new ListCustomers(optString(content, "status", "active"), limit != null ? limit : ListCustomers.DEFAULT_LIMIT);
            }
            case UPDATE_CUSTOMER: {
                Object data = content.getValue("data");
                return new UpdateCustomer(optInt(content, "customer_id"), data instanceof JsonObject ? (JsonObject) data : new JsonObject());
            }
            case GET_CUSTOMER_HISTORY:
                return new GetCustomerHistory(optInt(content, "customer_id"));
            case GET_PREMIUM_CUSTOMERS:
                return new GetPremiumCustomers();
            case HANDLE_SUPPORT: {
                Object info = content.getValue("customer_info");
                return new HandleSupport(optString(content, "query", ""), info instanceof JsonObject ? (JsonObject) info : null);
            }
            case CREATE_TICKET:
                return new CreateTicket(optInt(content, "customer_id"), optString(content, "issue", null), optString(content, "priority", "medium"));
            case GET_TICKETS_BY_PRIORITY:
                return new GetTicketsByPriority(optString(content, "priority", null), optIntList(content, "customer_ids"));
            case CHECK_CAN_HANDLE:
                return new CheckCanHandle(optString(content, "query", ""));
            case GET_OPEN_TICKETS_FOR_CUSTOMERS: {
                List<Integer> ids = optIntList(content, "customer_ids");
                return new GetOpenTicketsForCustomers(ids != null ? ids : Collections.emptyList());
            }
            default:
                return new Unknown(name);
        }
    }

    static Integer optInt(JsonObject content, String key) {
        Object value = content.getValue(key);
        if (value instanceof Number) {
            return exactInt(value);
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * @return the value as an int, or null when it is not an integral number in int range
     */
    private static Integer exactInt(Object value) {
        if (!(value instanceof Number)) {
            return null;
        }
        try {
            return new BigDecimal(value.toString()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    static String optString(JsonObject content, String key, String fallback) {
        Object value = content.getValue(key);
        return value instanceof String ? (String) value : fallback;
    }

    static List<Integer> optIntList(JsonObject content, String key) {
        Object value = content.getValue(key);
        if (!(value instanceof JsonArray)) {
            return null;
        }
        JsonArray array = (JsonArray) value;
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            Object item = array.getValue(i);
            Integer id = exactInt(item);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static JsonArray toArray(List<Integer> ids) {
        JsonArray array = new JsonArray();
        ids.forEach(array::add);
        return array;
    }

    /* ---------- customer-data actions ---------- */

    public static final class GetCustomer extends AgentAction {
        private final Integer customerId;

        public GetCustomer(Integer customerId) {
            super(Kind.GET_CUSTOMER);
            this.customerId = customerId;
        }

        public Integer getCustomerId() {
            return customerId;
        }

        @Override
        protected void writeArguments(JsonObject content) {
            content.put("customer_id", customerId);
        }
    }

    public static final class ListCustomers extends AgentAction {
        public static final int DEFAULT_LIMIT = 100;

        private final String status;
        private final int limit;

        public ListCustomers(String status, int limit) {
            super(Kind.LIST_CUSTOMERS);
            this.status = status;
            this.limit = limit;
        }

        public String getStatus() {
            return status;
        }

        public int getLimit() {
            return limit;
        }

        @Override
        protected void writeArguments(JsonObject content) {
            content.put("status", status).put("limit", limit);
        }
    }

    public static final class UpdateCustomer extends AgentAction {
        private final Integer customerId;
        private final JsonObject data;

        public UpdateCustomer(Integer customerId, JsonObject data) {
            super(Kind.UPDATE_CUSTOMER);
            this.customerId = customerId;
            this.data = data.copy();
        }

        public Integer getCustomerId() {
            return customerId;
        }

        public JsonObject getData() {
            return data.copy();
        }

        @Override
        protected void writeArguments(JsonObject content) {
            content.put("customer_id", customerId).put("data", data.copy());
        }
    }

    public static final class GetCustomerHistory extends AgentAction {
        private final Integer customerId;

        public GetCustomerHistory(Integer customerId) {
            super(Kind.GET_CUSTOMER_HISTORY);
            this.customerId = customerId;
        }

        public Integer getCustomerId() {
            return customerId;
        }

        @Override
        protected void writeArguments(JsonObject content) {
            content.put("customer_id", customerId);
        }
    }

    /**
     * "Premium" customers are the active ones; the store has no tier column.
     */
    public static final class GetPremiumCustomers extends AgentAction {
        public GetPremiumCustomers() {
            super(Kind.GET_PREMIUM_CUSTOMERS);
        }

        @Override
        protected void writeArguments(JsonObject content) {
            // no arguments
        }
    }

    /* ---------- support actions ---------- */

    public static final class HandleSupport extends AgentAction {
        private final String query;
        private final JsonObject customerInfo;

        public HandleSupport(String query, JsonObject customerInfo) {
            super(Kind.HANDLE_SUPPORT);
            this.query = query;
            this.customerInfo = customerInfo != null ? customerInfo.copy() : null;
        }

        public String getQuery() {
            return query;
        }

        /**
         * @return the customer context, or null when none was found
         */
        public JsonObject getCustomerInfo() {
            return customerInfo != null ? customerInfo.copy() : null;
        }

        @Override
        protected void writeArguments(JsonObject content) {
            content.put("query", query).put("customer_info", customerInfo != null ? customerInfo.copy() : null);
        }
    }

    public static final class CreateTicket extends AgentAction {
        private final Integer customerId;
        private final String issue;
        private final String priority;

        public CreateTicket(Integer customerId, String issue, String priority) {
            super(Kind.CREATE_TICKET);
            this.customerId = customerId;
            this.issue = issue;
            this.priority = priority;
        }

        public Integer getCustomerId() {
            return customerId;
        }

        public String getIssue() {
            return issue;
        }

        public String getPriority() {
            return priority;
        }

        @Override
        protected void writeArguments(JsonObject content) {
            content.put("customer_id", customerId).put("issue", issue).put("priority", priority);
        }
    }

    public static final class GetTicketsByPriority extends AgentAction {
        private final String priority;
        private final List<Integer> customerIds;

        /**
         * @param customerIds customers to scan; null scans every active customer
         */
        public GetTicketsByPriority(String priority, List<Integer> customerIds) {
            super(Kind.GET_TICKETS_BY_PRIORITY);
            this.priority = priority;
            this.customerIds = customerIds != null ? List.copyOf(customerIds) : null;
        }

        public String getPriority() {
            return priority;
        }

        public List<Integer> getCustomerIds() {
            return customerIds;
        }

        @Override
        protected void writeArguments(JsonObject content) {
            content.put("priority", priority);
            if (customerIds != null) {
                content.put("customer_ids", toArray(customerIds));
            }
        }
    }

    public static final class CheckCanHandle extends AgentAction {
        private final String query;

        public CheckCanHandle(String query) {
            super(Kind.CHECK_CAN_HANDLE);
            this.query = query;
        }

        public String getQuery() {
            return query;
        }

        @Override
        protected void writeArguments(JsonObject content) {
            content.put("query", query);
        }
    }

    public static final class GetOpenTicketsForCustomers extends AgentAction {
        private final List<Integer> customerIds;

        public GetOpenTicketsForCustomers(List<Integer> customerIds) {
            super(Kind.GET_OPEN_TICKETS_FOR_CUSTOMERS);
            this.customerIds = List.copyOf(customerIds);
        }

        public List<Integer> getCustomerIds() {
            return customerIds;
        }

        @Override
        protected void writeArguments(JsonObject content) {
            content.put("customer_ids", toArray(customerIds));
        }
    }

    /**
     * An action name no specialist recognises. Keeps the name for the error reply.
     */
    public static final class Unknown extends AgentAction {
        private final String requestedName;

        public Unknown(String requestedName) {
            super(Kind.UNKNOWN);
            this.requestedName = requestedName;
        }

        @Override
        public String name() {
            return requestedName;
        }

        @Override
        protected void writeArguments(JsonObject content) {
            // nothing beyond the name
        }
    }
}
