package com.vbwd.plugin.store;

import com.vbwd.plugin.api.PluginPersistenceException;
import com.vbwd.plugin.core.store.PersistedPluginConfig;
import com.vbwd.plugin.core.store.PersistedStatus;
import com.vbwd.plugin.store.schema.PluginStoreSchemaBootstrapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcPluginConfigStoreTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    private PluginStoreSchemaBootstrapper.ConnectionProvider connections;
    private MutableClock clock;
    private JdbcPluginConfigStore store;

    @BeforeEach
    void setUp() {
        String url = "jdbc:h2:mem:plugins-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        connections = () -> DriverManager.getConnection(url, "sa", "");
        clock = new MutableClock(T0);
        store = new JdbcPluginConfigStore(connections, clock, new PersistedPluginConfigCodec());
        store.ensureSchema();
    }

    @Test
    void ensureSchema_isIdempotent() {
        store.ensureSchema();
        new PluginStoreSchemaBootstrapper().ensureSchema(connections);

        assertTrue(store.loadAll().isEmpty());
    }

    @Test
    void save_insertsThenUpdatesSingleRow() throws Exception {
        store.save("mock_payment", PersistedStatus.ENABLED, Map.of("should_fail", true));
        clock.advance(Duration.ofHours(1));
        store.save("mock_payment", PersistedStatus.DISABLED, Map.of("should_fail", false));

        assertEquals(1, countRows());
        PersistedPluginConfig row = store.find("mock_payment").orElseThrow();
        assertEquals(PersistedStatus.DISABLED, row.status());
        assertEquals(false, row.config().get("should_fail"));
        assertEquals(T0, row.enabledAt());
        assertEquals(T0.plus(Duration.ofHours(1)), row.disabledAt());
    }

    @Test
    void loadEnabled_returnsOnlyEnabledRows() {
        store.save("analytics", PersistedStatus.ENABLED, Map.of("sample_rate", 10));
        store.save("reports", PersistedStatus.DISABLED, Map.of());
        store.save("core", PersistedStatus.ENABLED, null);

        List<PersistedPluginConfig> enabled = store.loadEnabled();

        assertEquals(List.of("analytics", "core"), enabled.stream().map(PersistedPluginConfig::pluginName).toList());
        assertEquals(10, enabled.get(0).config().get("sample_rate"));
        assertTrue(enabled.get(1).config().isEmpty());
        assertNull(enabled.get(1).disabledAt());
        assertEquals(3, store.loadAll().size());
    }

    @Test
    void delete_removesRow() {
        store.save("analytics", PersistedStatus.ENABLED, Map.of());

        assertTrue(store.delete("analytics"));
        assertFalse(store.delete("analytics"));
        assertTrue(store.loadAll().isEmpty());
    }

    @Test
    void unreadableConfigRowIsSkipped() throws Exception {
        store.save("good", PersistedStatus.ENABLED, Map.of());
        try (Connection c = connections.getConnection(); Statement st = c.createStatement()) {
            st.executeUpdate("INSERT INTO vbwd_plugin_config (plugin_name, status, config, updated_at) "
                    + "VALUES ('broken', 'enabled', '{oops', CURRENT_TIMESTAMP)");
        }

        assertEquals(List.of("good"), store.loadEnabled().stream().map(PersistedPluginConfig::pluginName).toList());
    }

    @Test
    void connectionFailure_surfacesAsPersistenceException() {
        JdbcPluginConfigStore unreachable = new JdbcPluginConfigStore(() -> {
            throw new SQLException("connection refused");
        });

        PluginPersistenceException e = assertThrows(PluginPersistenceException.class,
                () -> unreachable.save("analytics", PersistedStatus.ENABLED, Map.of()));
        assertEquals("analytics", e.getPluginName());
        assertThrows(PluginPersistenceException.class, unreachable::loadEnabled);
    }

    @Test
    void timestamps_areStoredAsUtcRegardlessOfDefaultZone() throws Exception {
        TimeZone previous = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("Pacific/Kiritimati"));
            store.save("mock_payment", PersistedStatus.ENABLED, Map.of());

            assertEquals(T0, store.find("mock_payment").orElseThrow().enabledAt());
            try (Connection c = connections.getConnection(); Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT CAST(enabled_at AS VARCHAR) FROM vbwd_plugin_config")) {
                rs.next();
                assertTrue(rs.getString(1).startsWith("2024-06-01 10:00:00"), rs.getString(1));
            }
            assertEquals("Pacific/Kiritimati", TimeZone.getDefault().getID());
        } finally {
            TimeZone.setDefault(previous);
        }
    }

    private int countRows() throws SQLException {
        try (Connection c = connections.getConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM vbwd_plugin_config")) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
