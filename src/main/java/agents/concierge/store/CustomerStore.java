package agents.concierge.store;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQLite backing store for customers and their support tickets.
 *
 * <p>All methods are blocking JDBC calls; callers on an event loop must wrap them in
 * <code>vertx.executeBlocking</code>. Each call opens its own connection.</p>
 */
public class CustomerStore {

    public static final Set<String> UPDATABLE_FIELDS = Set.of("name", "email", "phone", "status");

    private final Path dbFile;
    private final String jdbcUrl;

    public CustomerStore(String dbPath) {
        this.dbFile = Path.of(dbPath);
        this.jdbcUrl = "jdbc:sqlite:" + dbFile;
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    /**
     * Create the schema if it does not exist yet.
     */
    public void init() {
        Path parent = dbFile.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to create database directory " + parent, e);
        }

        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS customers (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        name TEXT NOT NULL,
                        email TEXT,
                        phone TEXT,
                        status TEXT DEFAULT 'active',
                        created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                        updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tickets (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        customer_id INTEGER NOT NULL,
                        issue TEXT NOT NULL,
                        status TEXT DEFAULT 'open',
                        priority TEXT DEFAULT 'medium',
                        created_at DATETIME DEFAULT CURRENT_TIMESTAMP,
                        FOREIGN KEY (customer_id) REFERENCES customers(id)
                    )
                    """);
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize schema", e);
        }
    }

    /**
     * Drop all rows and load the sample customers and tickets.
     */
    public void resetAndSeed() {
        init();
        String now = LocalDateTime.now().toString();
        try (Connection conn = openConnection()) {
            conn.setAutoCommit(false);
            try (Statement st = conn.createStatement()) {
                st.execute("DELETE FROM tickets");
                st.execute("DELETE FROM customers");
                st.execute("DELETE FROM sqlite_sequence WHERE name IN ('customers', 'tickets')");
            }

            Object[][] customers = {
                {1, "Alice Johnson", "alice@example.com", "555-0101", "active"},
                {2, "Bob Smith", "bob@example.com", "555-0102", "active"},
                {3, "Charlie Brown", "charlie@example.com", "555-0103", "active"},
                {4, "Diana Prince", "diana@example.com", "555-0104", "active"},
                {5, "Eve Davis", "eve@example.com", "555-0105", "active"},
                {12345, "Premium Customer", "premium@example.com", "555-9999", "active"},
            };
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO customers (id, name, email, phone, status, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                for (Object[] c : customers) {
                    ps.setInt(1, (Integer) c[0]);
                    ps.setString(2, (String) c[1]);
                    ps.setString(3, (String) c[2]);
                    ps.setString(4, (String) c[3]);
                    ps.setString(5, (String) c[4]);
                    ps.setString(6, now);
                    ps.setString(7, now);
                    ps.addBatch();
                }
                ps.executeBatch();
            }

            Object[][] tickets = {
                {1, "Account access issue", "open", "medium"},
                {1, "Password reset", "resolved", "low"},
                {2, "Billing inquiry", "open", "high"},
                {12345, "Premium account upgrade", "in_progress", "high"},
                {3, "Product inquiry", "resolved", "low"},
            };
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO tickets (customer_id, issue, status, priority, created_at) VALUES (?, ?, ?, ?, ?)")) {
                for (Object[] t : tickets) {
                    ps.setInt(1, (Integer) t[0]);
                    ps.setString(2, (String) t[1]);
                    ps.setString(3, (String) t[2]);
                    ps.setString(4, (String) t[3]);
                    ps.setString(5, now);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to seed database", e);
        }
    }

    /**
     * @return the customer row, or null when no customer has this id
     */
    public JsonObject getCustomer(int customerId) {
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT * FROM customers WHERE id = ?")) {
            ps.setInt(1, customerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? toCustomer(rs) : null;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read customer " + customerId, e);
        }
    }

    public JsonArray listCustomers(String status, int limit) {
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT * FROM customers WHERE status = ? ORDER BY id LIMIT ?")) {
            ps.setString(1, status);
            ps.setInt(2, limit);
            JsonArray customers = new JsonArray();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    customers.add(toCustomer(rs));
                }
            }
            return customers;
        } catch (SQLException e) {
            throw new StoreException("Failed to list customers with status " + status, e);
        }
    }

    /**
     * Patch the whitelisted fields of a customer and refresh <code>updated_at</code>.
     * Unknown keys are ignored.
     *
     * @return number of rows changed (0 when the customer does not exist)
     * @throws IllegalArgumentException when no updatable field is present
     */
    public int updateCustomer(int customerId, JsonObject data) {
        List<String> columns = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        for (Map.Entry<String, Object> entry : data) {
            if (UPDATABLE_FIELDS.contains(entry.getKey())) {
                columns.add(entry.getKey() + " = ?");
                values.add(entry.getValue());
            }
        }
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No valid fields to update");
        }
        columns.add("updated_at = ?");
        values.add(LocalDateTime.now().toString());

        String sql = "UPDATE customers SET " + String.join(", ", columns) + " WHERE id = ?";
        try (Connection conn = openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            int index = 1;
            for (Object value : values) {
                ps.setObject(index++, value == null ? null : value.toString());
            }
            ps.setInt(index, customerId);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to update customer " + customerId, e);
        }
    }

    /**
     * Open a new ticket for a customer.
     *
     * @return the created ticket with its generated <code>ticket_id</code>
     */
    public JsonObject createTicket(int customerId, String issue, String priority) {
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "INSERT INTO tickets (customer_id, issue, status, priority, created_at) VALUES (?, ?, 'open', ?, ?)",
                 Statement.RETURN_GENERATED_KEYS)) {
            ps.setInt(1, customerId);
            ps.setString(2, issue);
            ps.setString(3, priority);
            ps.setString(4, LocalDateTime.now().toString());
            ps.executeUpdate();

            long ticketId;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StoreException("No id generated for new ticket", null);
                }
                ticketId = keys.getLong(1);
            }
            return new JsonObject()
                .put("ticket_id", ticketId)
                .put("customer_id", customerId)
                .put("issue", issue)
                .put("status", "open")
                .put("priority", priority);
        } catch (SQLException e) {
            throw new StoreException("Failed to create ticket for customer " + customerId, e);
        }
    }

    /**
     * All tickets of a customer, newest first.
     */
    public JsonArray getCustomerHistory(int customerId) {
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "SELECT * FROM tickets WHERE customer_id = ? ORDER BY created_at DESC, id DESC")) {
            ps.setInt(1, customerId);
            JsonArray tickets = new JsonArray();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tickets.add(new JsonObject()
                        .put("id", rs.getInt("id"))
                        .put("customer_id", rs.getInt("customer_id"))
                        .put("issue", rs.getString("issue"))
                        .put("status", rs.getString("status"))
                        .put("priority", rs.getString("priority"))
                        .put("created_at", rs.getString("created_at")));
                }
            }
            return tickets;
        } catch (SQLException e) {
            throw new StoreException("Failed to read ticket history for customer " + customerId, e);
        }
    }

    private static JsonObject toCustomer(ResultSet rs) throws SQLException {
        return new JsonObject()
            .put("id", rs.getInt("id"))
            .put("name", rs.getString("name"))
            .put("email", rs.getString("email"))
            .put("phone", rs.getString("phone"))
            .put("status", rs.getString("status"))
            .put("created_at", rs.getString("created_at"))
            .put("updated_at", rs.getString("updated_at"));
    }
}
