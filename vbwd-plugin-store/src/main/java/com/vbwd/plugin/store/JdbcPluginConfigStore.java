package com.vbwd.plugin.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.vbwd.plugin.api.PluginPersistenceException;
import com.vbwd.plugin.core.store.PersistedPluginConfig;
import com.vbwd.plugin.core.store.PersistedStatus;
import com.vbwd.plugin.core.store.PluginConfigStore;
import com.vbwd.plugin.store.schema.PluginStoreSchemaBootstrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;

/**
 * JDBC implementation of {@link PluginConfigStore}. Persists to table vbwd_plugin_config (one row per plugin,
 * config as JSON text). Saves run update-then-insert in one transaction so the row is never duplicated.
 * Timestamp columns hold UTC wall-clock values. Schema (CREATE TABLE IF NOT EXISTS) is executed once via
 * {@link #ensureSchema()}.
 */
public final class JdbcPluginConfigStore implements PluginConfigStore {

    static final String TABLE = "vbwd_plugin_config";
    private static final String COLUMNS = "plugin_name, status, config, enabled_at, disabled_at, updated_at";
    private static final Logger log = LoggerFactory.getLogger(JdbcPluginConfigStore.class);
    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private final PluginStoreSchemaBootstrapper.ConnectionProvider connectionProvider;
    private final PluginStoreSchemaBootstrapper schemaBootstrapper = new PluginStoreSchemaBootstrapper();
    private final PersistedPluginConfigCodec codec;
    private final Clock clock;

    public JdbcPluginConfigStore(PluginStoreSchemaBootstrapper.ConnectionProvider connectionProvider) {
        this(connectionProvider, Clock.systemUTC(), new PersistedPluginConfigCodec());
    }

    public JdbcPluginConfigStore(PluginStoreSchemaBootstrapper.ConnectionProvider connectionProvider, Clock clock,
                                 PersistedPluginConfigCodec codec) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /** Creates the table if it does not exist. Idempotent; safe to call at bootstrap. */
    public void ensureSchema() {
        schemaBootstrapper.ensureSchema(connectionProvider);
    }

    @Override
    public void save(String pluginName, PersistedStatus status, Map<String, Object> config) {
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(status, "status");
        try (Connection c = connectionProvider.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                Optional<PersistedPluginConfig> existing = select(c, pluginName);
                Instant now = clock.instant();
                PersistedPluginConfig row = existing.isPresent()
                        ? existing.get().updated(status, config, now)
                        : PersistedPluginConfig.created(pluginName, status, config, now);
                if (update(c, row) == 0) {
                    insert(c, row);
                }
                c.commit();
                log.debug("Saved plugin state {}={}", pluginName, status.getWireValue());
            } catch (SQLException | JsonProcessingException | RuntimeException e) {
                rollback(c);
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new PluginPersistenceException(pluginName, "Failed to save state of plugin '" + pluginName + "': " + e.getMessage(), e);
        }
    }

    @Override
    public List<PersistedPluginConfig> loadEnabled() {
        return query("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE status = ? ORDER BY plugin_name",
                PersistedStatus.ENABLED.getWireValue());
    }

    @Override
    public Optional<PersistedPluginConfig> find(String pluginName) {
        if (pluginName == null) return Optional.empty();
        try (Connection c = connectionProvider.getConnection()) {
            return select(c, pluginName);
        } catch (SQLException e) {
            throw new PluginPersistenceException(pluginName, "Failed to read state of plugin '" + pluginName + "': " + e.getMessage(), e);
        }
    }

    @Override
    public List<PersistedPluginConfig> loadAll() {
        return query("SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY plugin_name", null);
    }

    @Override
    public boolean delete(String pluginName) {
        if (pluginName == null) return false;
        try (Connection c = connectionProvider.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM " + TABLE + " WHERE plugin_name = ?")) {
            ps.setString(1, pluginName);
            boolean deleted = ps.executeUpdate() > 0;
            if (deleted) {
                log.info("Deleted persisted state of plugin {}", pluginName);
            }
            return deleted;
        } catch (SQLException e) {
            throw new PluginPersistenceException(pluginName, "Failed to delete state of plugin '" + pluginName + "': " + e.getMessage(), e);
        }
    }

    private List<PersistedPluginConfig> query(String sql, String statusParam) {
        List<PersistedPluginConfig> out = new ArrayList<>();
        try (Connection c = connectionProvider.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (statusParam != null) {
                ps.setString(1, statusParam);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    PersistedPluginConfig row = readRow(rs);
                    if (row != null) out.add(row);
                }
            }
        } catch (SQLException e) {
            throw new PluginPersistenceException(null, "Failed to load plugin state: " + e.getMessage(), e);
        }
        return out;
    }

    private Optional<PersistedPluginConfig> select(Connection c, String pluginName) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE plugin_name = ?")) {
            ps.setString(1, pluginName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(readRow(rs)) : Optional.empty();
            }
        }
    }

    private int update(Connection c, PersistedPluginConfig row) throws SQLException, JsonProcessingException {
        String sql = "UPDATE " + TABLE + " SET status = ?, config = ?, enabled_at = ?, disabled_at = ?, updated_at = ? WHERE plugin_name = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, row.status().getWireValue());
            ps.setString(2, codec.configToJson(row.config()));
            setInstant(ps, 3, row.enabledAt());
            setInstant(ps, 4, row.disabledAt());
            setInstant(ps, 5, row.updatedAt());
            ps.setString(6, row.pluginName());
            return ps.executeUpdate();
        }
    }

    private void insert(Connection c, PersistedPluginConfig row) throws SQLException, JsonProcessingException {
        String sql = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, row.pluginName());
            ps.setString(2, row.status().getWireValue());
            ps.setString(3, codec.configToJson(row.config()));
            setInstant(ps, 4, row.enabledAt());
            setInstant(ps, 5, row.disabledAt());
            setInstant(ps, 6, row.updatedAt());
            ps.executeUpdate();
        }
    }

    /** Maps the current row; a row with an unknown status or unreadable config is logged and yields null. */
    private PersistedPluginConfig readRow(ResultSet rs) throws SQLException {
        String name = rs.getString("plugin_name");
        try {
            return new PersistedPluginConfig(name,
                    PersistedStatus.fromWireValue(rs.getString("status")),
                    codec.configFromJson(rs.getString("config")),
                    getInstant(rs, "enabled_at"),
                    getInstant(rs, "disabled_at"),
                    getInstant(rs, "updated_at"));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping unreadable plugin state row {}: {}", name, e.getMessage());
            return null;
        }
    }

    private static void rollback(Connection c) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("Rollback of plugin state transaction failed: {}", e.getMessage());
        }
    }

    /** Binds the instant as a UTC wall-clock timestamp, independent of the JVM default zone. */
    private static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant == null) {
            ps.setNull(index, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(index, Timestamp.from(instant), utcCalendar());
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column, utcCalendar());
        return ts != null ? ts.toInstant() : null;
    }

    private static Calendar utcCalendar() {
        return Calendar.getInstance(UTC);
    }
}
