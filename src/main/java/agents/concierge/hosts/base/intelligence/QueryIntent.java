package agents.concierge.hosts.base.intelligence;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.List;

/**
 * Classification of one query. Computed once, consumed by the router, never stored.
 */
public final class QueryIntent {

    private final boolean needsCustomerData;
    private final boolean needsSupport;
    private final boolean complex;
    private final Integer customerId;
    private final List<IntentTag> intents;

    public QueryIntent(boolean needsCustomerData, boolean needsSupport, boolean complex,
                       Integer customerId, List<IntentTag> intents) {
        this.needsCustomerData = needsCustomerData;
        this.needsSupport = needsSupport;
        this.complex = complex;
        this.customerId = customerId;
        this.intents = Collections.unmodifiableList(List.copyOf(intents));
    }

    public boolean isNeedsCustomerData() {
        return needsCustomerData;
    }

    public boolean isNeedsSupport() {
        return needsSupport;
    }

    public boolean isComplex() {
        return complex;
    }

    /**
     * @return the extracted customer id, or null when the query names none
     */
    public Integer getCustomerId() {
        return customerId;
    }

    /**
     * Detected sub-intents in detection order.
     */
    public List<IntentTag> getIntents() {
        return intents;
    }

    public boolean hasIntent(IntentTag tag) {
        return intents.contains(tag);
    }

    public JsonObject toJson() {
        JsonArray tags = new JsonArray();
        intents.forEach(tag -> tags.add(tag.getValue()));
        return new JsonObject()
            .put("needs_customer_data", needsCustomerData)
            .put("needs_support", needsSupport)
            .put("is_complex", complex)
            .put("customer_id", customerId)
            .put("intents", tags);
    }

    @Override
    public String toString() {
        return toJson().encode();
    }
}
