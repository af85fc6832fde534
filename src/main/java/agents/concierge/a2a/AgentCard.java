package agents.concierge.a2a;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.List;

/**
 * Identity and capabilities an agent publishes for discovery.
 */
public class AgentCard {

    private final String agentId;
    private final String name;
    private final String description;
    private final String version = "1.0.0";
    private final List<AgentCapability> capabilities;
    private final JsonArray tasks;
    private final String endpoint;
    private final String createdAt = Instant.now().toString();

    public AgentCard(String agentId, String name, String description,
                     List<AgentCapability> capabilities, JsonArray tasks, String endpoint) {
        this.agentId = agentId;
        this.name = name;
        this.description = description;
        this.capabilities = List.copyOf(capabilities);
        this.tasks = tasks.copy();
        this.endpoint = endpoint;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getName() {
        return name;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public List<AgentCapability> getCapabilities() {
        return capabilities;
    }

    public boolean canHandleTask(String taskName) {
        return findTask(taskName) != null;
    }

    /**
     * @return the input schema of the named task, or null when the agent has no such task
     */
    public JsonObject getTaskSchema(String taskName) {
        JsonObject task = findTask(taskName);
        return task != null ? task.getJsonObject("input_schema").copy() : null;
    }

    private JsonObject findTask(String taskName) {
        for (int i = 0; i < tasks.size(); i++) {
            JsonObject task = tasks.getJsonObject(i);
            if (task.getString("name").equals(taskName)) {
                return task;
            }
        }
        return null;
    }

    public JsonObject toJson() {
        JsonArray capabilityNames = new JsonArray();
        capabilities.forEach(c -> capabilityNames.add(c.getValue()));
        return new JsonObject()
            .put("agent_id", agentId)
            .put("name", name)
            .put("description", description)
            .put("version", version)
            .put("capabilities", capabilityNames)
            .put("tasks", tasks.copy())
            .put("endpoint", endpoint)
            .put("created_at", createdAt);
    }
}
