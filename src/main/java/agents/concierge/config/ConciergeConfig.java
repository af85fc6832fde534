package agents.concierge.config;

import io.vertx.core.json.JsonObject;

/**
 * Runtime configuration for the concierge system.
 *
 * <p>Values come from system properties (populated from <code>.env.local</code> by the Driver)
 * and then from the OS environment, falling back to local single-process defaults.</p>
 */
public class ConciergeConfig {

    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final long DEFAULT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final int DEFAULT_PREMIUM_CUSTOMER_ID = 12345;

    private final int httpPort;
    private final String mcpServerUrl;
    private final boolean useHttpTransport;
    private final String customerDataAgentUrl;
    private final String supportAgentUrl;
    private final long timeoutMs;
    private final String dbPath;
    private final boolean seedDatabase;
    private final int maxIterations;
    private final int premiumCustomerId;

    private ConciergeConfig(Builder builder) {
        this.httpPort = builder.httpPort;
        this.mcpServerUrl = builder.mcpServerUrl;
        this.useHttpTransport = builder.useHttpTransport;
        this.customerDataAgentUrl = builder.customerDataAgentUrl;
        this.supportAgentUrl = builder.supportAgentUrl;
        this.timeoutMs = builder.timeoutMs;
        this.dbPath = builder.dbPath;
        this.seedDatabase = builder.seedDatabase;
        this.maxIterations = builder.maxIterations;
        this.premiumCustomerId = builder.premiumCustomerId;
    }

    /**
     * Load configuration from system properties and environment variables.
     */
    public static ConciergeConfig fromEnvironment() {
        int port = getInt("HTTP_PORT", DEFAULT_HTTP_PORT);
        String localBase = "http://localhost:" + port;
        return builder()
            .withHttpPort(port)
            .withMcpServerUrl(getString("MCP_SERVER_URL", localBase + "/mcp"))
            .withHttpTransport(getBoolean("A2A_USE_HTTP", false))
            .withCustomerDataAgentUrl(getString("A2A_CUSTOMER_DATA_URL", localBase + "/a2a/customer-data"))
            .withSupportAgentUrl(getString("A2A_SUPPORT_URL", localBase + "/a2a/support"))
            .withTimeoutMs(getLong("A2A_TIMEOUT_MS", DEFAULT_TIMEOUT_MS))
            .withDbPath(getString("DB_PATH", "./data/customer_service.db"))
            .withSeedDatabase(getBoolean("DB_SEED", true))
            .withMaxIterations(getInt("ROUTER_MAX_ITERATIONS", DEFAULT_MAX_ITERATIONS))
            .withPremiumCustomerId(getInt("PREMIUM_CUSTOMER_ID", DEFAULT_PREMIUM_CUSTOMER_ID))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getHttpPort() { return httpPort; }
    public String getMcpServerUrl() { return mcpServerUrl; }
    public boolean isUseHttpTransport() { return useHttpTransport; }
    public String getCustomerDataAgentUrl() { return customerDataAgentUrl; }
    public String getSupportAgentUrl() { return supportAgentUrl; }
    public long getTimeoutMs() { return timeoutMs; }
    public String getDbPath() { return dbPath; }
    public boolean isSeedDatabase() { return seedDatabase; }
    public int getMaxIterations() { return maxIterations; }
    public int getPremiumCustomerId() { return premiumCustomerId; }

    /**
     * Summary for startup logging
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("httpPort", httpPort)
            .put("mcpServerUrl", mcpServerUrl)
            .put("useHttpTransport", useHttpTransport)
            .put("customerDataAgentUrl", customerDataAgentUrl)
            .put("supportAgentUrl", supportAgentUrl)
            .put("timeoutMs", timeoutMs)
            .put("dbPath", dbPath)
            .put("seedDatabase", seedDatabase)
            .put("maxIterations", maxIterations)
            .put("premiumCustomerId", premiumCustomerId);
    }

    // Lookup helpers: system properties (dotenv) win over the OS environment

    private static String lookup(String key) {
        String value = System.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            value = System.getenv(key);
        }
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private static String getString(String key, String defaultValue) {
        String value = lookup(key);
        return value != null ? value : defaultValue;
    }

    private static boolean getBoolean(String key, boolean defaultValue) {
        String value = lookup(key);
        return value != null ? "true".equalsIgnoreCase(value) : defaultValue;
    }

    private static int getInt(String key, int defaultValue) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + " value: '" + value + "'. Must be an integer.", e);
        }
    }

    private static long getLong(String key, long defaultValue) {
        String value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + " value: '" + value + "'. Must be a number.", e);
        }
    }

    public static class Builder {
        private int httpPort = DEFAULT_HTTP_PORT;
        private String mcpServerUrl = "http://localhost:" + DEFAULT_HTTP_PORT + "/mcp";
        private boolean useHttpTransport = false;
        private String customerDataAgentUrl = "http://localhost:" + DEFAULT_HTTP_PORT + "/a2a/customer-data";
        private String supportAgentUrl = "http://localhost:" + DEFAULT_HTTP_PORT + "/a2a/support";
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private String dbPath = "./data/customer_service.db";
        private boolean seedDatabase = true;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private int premiumCustomerId = DEFAULT_PREMIUM_CUSTOMER_ID;

        public Builder withHttpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public Builder withMcpServerUrl(String mcpServerUrl) {
            this.mcpServerUrl = mcpServerUrl;
            return this;
        }

        public Builder withHttpTransport(boolean useHttpTransport) {
            this.useHttpTransport = useHttpTransport;
            return this;
        }

        public Builder withCustomerDataAgentUrl(String customerDataAgentUrl) {
            this.customerDataAgentUrl = customerDataAgentUrl;
            return this;
        }

        public Builder withSupportAgentUrl(String supportAgentUrl) {
            this.supportAgentUrl = supportAgentUrl;
            return this;
        }

        public Builder withTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder withDbPath(String dbPath) {
            this.dbPath = dbPath;
            return this;
        }

        public Builder withSeedDatabase(boolean seedDatabase) {
            this.seedDatabase = seedDatabase;
            return this;
        }

        public Builder withMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder withPremiumCustomerId(int premiumCustomerId) {
            this.premiumCustomerId = premiumCustomerId;
            return this;
        }

        public ConciergeConfig build() {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeoutMs);
            }
            if (maxIterations < 0) {
                throw new IllegalArgumentException("Max iterations must not be negative: " + maxIterations);
            }
            return new ConciergeConfig(this);
        }
    }
}
