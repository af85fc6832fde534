package agents.concierge.hosts.base.intelligence;

import java.util.List;

/**
 * Sub-intents recognised in a query, each with the words that signal it. A word matches
 * anywhere in the lower-cased query, including inside longer words.
 */
public enum IntentTag {
    GET_CUSTOMER_INFO("get_customer_info", List.of("customer", "account", "info", "information", "id")),
    SUPPORT("support", List.of("help", "support", "issue", "problem", "ticket")),
    BILLING_ISSUE("billing_issue", List.of("cancel", "billing", "refund", "charge")),
    TICKET_QUERY("ticket_query", List.of("status", "tickets", "history", "premium", "open tickets")),
    UPDATE("update", List.of("update", "change", "modify"));

    private final String value;
    private final List<String> vocabulary;

    IntentTag(String value, List<String> vocabulary) {
        this.value = value;
        this.vocabulary = vocabulary;
    }

    public String getValue() {
        return value;
    }

    public List<String> getVocabulary() {
        return vocabulary;
    }

    public boolean matches(String lowerQuery) {
        for (String word : vocabulary) {
            if (lowerQuery.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
