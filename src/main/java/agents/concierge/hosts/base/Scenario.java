package agents.concierge.hosts.base;

import agents.concierge.hosts.base.intelligence.IntentTag;
import agents.concierge.hosts.base.intelligence.QueryIntent;

import java.util.function.BiPredicate;

/**
 * The coordination protocols, in selection order. The first scenario whose predicate
 * accepts the lower-cased query and its intent wins; {@link #FALLBACK} accepts everything.
 */
public enum Scenario {
    TASK_ALLOCATION("Task Allocation",
        (query, intent) -> !intent.isComplex()),
    COMPLEX_QUERY("Complex Query Coordination",
        (query, intent) -> query.contains("all active customers") && query.contains("open tickets")),
    MULTI_INTENT("Multi-Intent Query",
        (query, intent) -> query.contains("update") && query.contains("ticket history")),
    NEGOTIATION("Negotiation/Escalation",
        (query, intent) -> intent.hasIntent(IntentTag.BILLING_ISSUE) || query.contains("cancel")),
    MULTI_STEP("Multi-Step Coordination",
        (query, intent) -> intent.isComplex() && intent.getIntents().size() > 1),
    FALLBACK("Task Allocation",
        (query, intent) -> true);

    private final String label;
    private final BiPredicate<String, QueryIntent> predicate;

    Scenario(String label, BiPredicate<String, QueryIntent> predicate) {
        this.label = label;
        this.predicate = predicate;
    }

    /**
     * Name reported in the <code>scenario</code> field of the result.
     */
    public String getLabel() {
        return label;
    }

    public boolean accepts(String lowerQuery, QueryIntent intent) {
        return predicate.test(lowerQuery, intent);
    }

    public static Scenario select(String lowerQuery, QueryIntent intent) {
        for (Scenario scenario : values()) {
            if (scenario.accepts(lowerQuery, intent)) {
                return scenario;
            }
        }
        return FALLBACK;
    }
}
