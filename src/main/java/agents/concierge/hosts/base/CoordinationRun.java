package agents.concierge.hosts.base;

import agents.concierge.hosts.base.intelligence.QueryIntent;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * State of one query while its scenario runs: the coordination log, the customer context
 * picked up on the way, and how many times the run has been routed.
 *
 * <p>Owned by a single <code>processQuery</code> call and never shared between queries.</p>
 */
public class CoordinationRun {

    private final String query;
    private final String queryId;
    private final QueryIntent intent;
    private final List<String> coordinationLog = new ArrayList<>();

    private Scenario scenario;
    private JsonObject customerInfo;
    private int iterations;

    public CoordinationRun(String query, String queryId, QueryIntent intent) {
        this.query = query;
        this.queryId = queryId;
        this.intent = intent;
    }

    public String getQuery() {
        return query;
    }

    public String getQueryId() {
        return queryId;
    }

    public QueryIntent getIntent() {
        return intent;
    }

    public Scenario getScenario() {
        return scenario;
    }

    /**
     * Count one more routing pass into the given scenario.
     *
     * @return false once the pass count exceeds the limit
     */
    public boolean enter(Scenario next, int maxIterations) {
        iterations++;
        if (iterations > maxIterations) {
            return false;
        }
        scenario = next;
        return true;
    }

    public int getIterations() {
        return iterations;
    }

    public JsonObject getCustomerInfo() {
        return customerInfo;
    }

    public void setCustomerInfo(JsonObject customerInfo) {
        this.customerInfo = customerInfo;
    }

    public void logStep(String step) {
        coordinationLog.add(step);
    }

    public JsonArray getCoordinationLog() {
        return new JsonArray(new ArrayList<>(coordinationLog));
    }

    /**
     * Base of every aggregate result. Scenarios add their own fields on top.
     */
    public JsonObject result(String response, boolean success) {
        return new JsonObject()
            .put("query", query)
            .put("query_id", queryId)
            .put("scenario", scenario != null ? scenario.getLabel() : null)
            .put("response", response)
            .put("coordination_log", getCoordinationLog())
            .put("success", success);
    }

    public JsonObject errorResult(String error) {
        return result("Error: " + error, false).put("error", error);
    }
}
