package agents.concierge.mcp.base;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents an MCP tool definition with name, description, and input schema.
 *
 * <pre>
 * MCPTool tool = MCPTool.builder("get_customer", "Retrieve customer information by customer ID")
 *     .integer("customer_id", "The customer ID to retrieve", true)
 *     .build();
 * </pre>
 */
public class MCPTool {

    private final String name;
    private final String description;
    private final JsonObject inputSchema;

    public MCPTool(String name, String description, JsonObject inputSchema) {
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema != null ? inputSchema : new JsonObject().put("type", "object");
    }

    public static Builder builder(String name, String description) {
        return new Builder(name, description);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonObject getInputSchema() {
        return inputSchema;
    }

    /**
     * Names listed under <code>required</code> in the input schema.
     */
    public List<String> requiredArguments() {
        JsonArray required = inputSchema.getJsonArray("required");
        if (required == null) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<>();
        for (int i = 0; i < required.size(); i++) {
            names.add(required.getString(i));
        }
        return names;
    }

    /**
     * Convert to JSON format for MCP protocol
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("inputSchema", inputSchema);
    }

    public static MCPTool fromJson(JsonObject json) {
        return new MCPTool(
            json.getString("name"),
            json.getString("description"),
            json.getJsonObject("inputSchema")
        );
    }

    @Override
    public String toString() {
        return "MCPTool{name='" + name + "', description='" + description + "'}";
    }

    /**
     * Assembles a JSON-schema object of typed properties.
     */
    public static class Builder {
        private final String name;
        private final String description;
        private final JsonObject properties = new JsonObject();
        private final JsonArray required = new JsonArray();

        private Builder(String name, String description) {
            this.name = name;
            this.description = description;
        }

        public Builder integer(String property, String description, boolean isRequired) {
            return property(property, new JsonObject().put("type", "integer").put("description", description), isRequired);
        }

        public Builder string(String property, String description, boolean isRequired, String... allowed) {
            JsonObject spec = new JsonObject().put("type", "string");
            if (allowed.length > 0) {
                spec.put("enum", new JsonArray(List.of(allowed)));
            }
            spec.put("description", description);
            return property(property, spec, isRequired);
        }

        public Builder object(String property, String description, boolean isRequired, JsonObject nestedProperties) {
            JsonObject spec = new JsonObject().put("type", "object").put("description", description);
            if (nestedProperties != null) {
                spec.put("properties", nestedProperties);
            }
            return property(property, spec, isRequired);
        }

        public Builder property(String property, JsonObject spec, boolean isRequired) {
            properties.put(property, spec);
            if (isRequired) {
                required.add(property);
            }
            return this;
        }

        public MCPTool build() {
            JsonObject schema = new JsonObject()
                .put("type", "object")
                .put("properties", properties);
            if (!required.isEmpty()) {
                schema.put("required", required);
            }
            return new MCPTool(name, description, schema);
        }
    }
}
