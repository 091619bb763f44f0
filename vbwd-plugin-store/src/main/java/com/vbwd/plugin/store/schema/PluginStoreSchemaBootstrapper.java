package com.vbwd.plugin.store.schema;

import com.vbwd.plugin.api.PluginPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Loads and executes the plugin state schema script (table vbwd_plugin_config) from the classpath.
 * Idempotent; safe to call at bootstrap.
 */
public final class PluginStoreSchemaBootstrapper {

    public static final String SCHEMA_RESOURCE = "schema/vbwd-plugin-config.sql";
    private static final Logger log = LoggerFactory.getLogger(PluginStoreSchemaBootstrapper.class);
    private static final String LINE_COMMENT = "(?m)^\\s*--[^\n]*\n?";

    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    /**
     * Creates the plugin state table and index if they do not exist. Runs the script once per bootstrapper.
     *
     * @throws PluginPersistenceException if the script is missing or a statement fails
     */
    public void ensureSchema(ConnectionProvider connectionProvider) {
        Objects.requireNonNull(connectionProvider, "connectionProvider");
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Plugin store schema already initialized; skipping");
            return;
        }
        try {
            execute(connectionProvider, splitStatements(loadSchemaScript()));
        } catch (RuntimeException e) {
            schemaInitialized.set(false);
            throw e;
        }
    }

    private static void execute(ConnectionProvider connectionProvider, List<String> statements) {
        log.info("Plugin store schema: executing {} statement(s) from {}", statements.size(), SCHEMA_RESOURCE);
        try (Connection c = connectionProvider.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                String preview = stmt.length() > 60 ? stmt.substring(0, 60) + "..." : stmt;
                try {
                    st.execute(stmt);
                } catch (SQLException e) {
                    log.error("Plugin store schema: statement {}/{} failed. SQL: {} | Error: {} | SQLState: {}",
                            index, statements.size(), preview, e.getMessage(), e.getSQLState(), e);
                    throw new PluginPersistenceException(null,
                            "Plugin store schema failed at statement " + index + ": " + e.getMessage(), e);
                }
            }
            log.info("Plugin store schema: table vbwd_plugin_config is ready");
        } catch (SQLException e) {
            log.error("Plugin store schema: connection failed. error={} SQLState={}", e.getMessage(), e.getSQLState(), e);
            throw new PluginPersistenceException(null, "Plugin store schema execution failed: " + e.getMessage(), e);
        }
    }

    static List<String> splitStatements(String sql) {
        List<String> out = new ArrayList<>();
        for (String raw : sql.split(";")) {
            String stmt = raw.replaceAll(LINE_COMMENT, "").trim();
            if (!stmt.isEmpty()) out.add(stmt);
        }
        return out;
    }

    private static String loadSchemaScript() {
        try (InputStream in = PluginStoreSchemaBootstrapper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new PluginPersistenceException(null, "Plugin store schema resource not found: " + SCHEMA_RESOURCE, null);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new PluginPersistenceException(null, "Plugin store schema load failed: " + e.getMessage(), e);
        }
    }

    /** Abstraction for obtaining a connection (shared with the JDBC store). */
    @FunctionalInterface
    public interface ConnectionProvider {
        Connection getConnection() throws SQLException;
    }
}
