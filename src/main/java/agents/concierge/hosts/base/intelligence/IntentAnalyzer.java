package agents.concierge.hosts.base.intelligence;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based query classification against a fixed vocabulary table.
 *
 * <p>Pure and stateless: the same text always yields the same {@link QueryIntent}. A query
 * matching nothing yields an all-false intent, which routes to simple task allocation.</p>
 */
public class IntentAnalyzer {

    private static final Pattern LABELLED_ID = Pattern.compile("(?:id|customer)\\s+(\\d+)");
    private static final Pattern ANY_NUMBER = Pattern.compile("\\b(\\d+)\\b");
    private static final List<String> BULK_WORDS = List.of("show", "list", "all", "every");

    public QueryIntent analyze(String query) {
        String lower = query.toLowerCase();

        boolean needsCustomerData = false;
        boolean needsSupport = false;
        boolean complex = false;
        List<IntentTag> intents = new ArrayList<>();

        Integer customerId = extractCustomerId(query, lower);
        if (customerId != null) {
            needsCustomerData = true;
        }

        if (IntentTag.GET_CUSTOMER_INFO.matches(lower)) {
            needsCustomerData = true;
            intents.add(IntentTag.GET_CUSTOMER_INFO);
        }
        if (IntentTag.SUPPORT.matches(lower)) {
            needsSupport = true;
            intents.add(IntentTag.SUPPORT);
        }
        if (IntentTag.BILLING_ISSUE.matches(lower)) {
            needsSupport = true;
            complex = true;
            intents.add(IntentTag.BILLING_ISSUE);
        }
        if (IntentTag.TICKET_QUERY.matches(lower)) {
            needsCustomerData = true;
            needsSupport = true;
            intents.add(IntentTag.TICKET_QUERY);
        }
        if (IntentTag.UPDATE.matches(lower)) {
            needsCustomerData = true;
            intents.add(IntentTag.UPDATE);
        }

        for (String word : BULK_WORDS) {
            if (lower.contains(word)) {
                complex = true;
                break;
            }
        }
        if (intents.size() > 1) {
            complex = true;
        }

        return new QueryIntent(needsCustomerData, needsSupport, complex, customerId, intents);
    }

    /**
     * "id 7" or "customer 7" first, otherwise the first standalone number. A number too
     * large for an int is treated as no id at all.
     */
    static Integer extractCustomerId(String query, String lower) {
        Matcher matcher = LABELLED_ID.matcher(lower);
        if (!matcher.find()) {
            matcher = ANY_NUMBER.matcher(query);
            if (!matcher.find()) {
                return null;
            }
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
