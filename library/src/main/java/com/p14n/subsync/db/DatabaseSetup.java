package com.p14n.subsync.db;

import com.p14n.subsync.data.SubscriptionServiceConfig;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public class DatabaseSetup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);

    public static final String SUBSCRIPTION_SAGAS = "subscription_sagas";
    public static final String SUBSCRIPTION_CLIENT_SAGAS = "subscription_client_sagas";

    private final DataSource ds;

    public DatabaseSetup(SubscriptionServiceConfig cfg) {
        this(PoolSetup.createPool(cfg));
    }

    public DatabaseSetup(DataSource ds) {
        this.ds = ds;
    }

    public DatabaseSetup setupAll() {
        createSchemaIfNotExists();
        createSagaTableIfNotExists(SUBSCRIPTION_SAGAS);
        createSagaTableIfNotExists(SUBSCRIPTION_CLIENT_SAGAS);
        return this;
    }

    public DatabaseSetup createSchemaIfNotExists() {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("CREATE SCHEMA IF NOT EXISTS subsync");
            logger.atInfo().log("Schema creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating schema");
            throw new RuntimeException("Failed to create schema", e);
        }
        return this;
    }

    public DatabaseSetup createSagaTableIfNotExists(String table) {
        validateTableName(table);

        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement()) {

            String sql = String.format("""
                    CREATE TABLE IF NOT EXISTS subsync.%s (
                        correlation_id UUID PRIMARY KEY,
                        current_state VARCHAR(16) NOT NULL,
                        payload TEXT NOT NULL,
                        updated_at TIMESTAMP WITH TIME ZONE DEFAULT current_timestamp
                    )""", table);
            stmt.execute(sql);

            stmt.execute(String.format(
                    "CREATE INDEX IF NOT EXISTS %s_state_idx ON subsync.%s (current_state)", table, table));
            logger.atInfo().log("Saga table creation completed successfully: {}", table);

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating saga table: {}", table);
            throw new RuntimeException("Failed to create saga table", e);
        }
        return this;
    }

    static void validateTableName(String table) {
        if (table == null || table.trim().isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        if (!table.matches("^[A-Za-z_][A-Za-z0-9_]*$")) {
            throw new IllegalArgumentException("Table name is not a valid SQL identifier");
        }
    }
}
