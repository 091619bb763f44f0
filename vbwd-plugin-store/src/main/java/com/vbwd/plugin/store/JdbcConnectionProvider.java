package com.vbwd.plugin.store;

import com.vbwd.config.VbwdConfig;
import com.vbwd.plugin.store.schema.PluginStoreSchemaBootstrapper;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/**
 * Opens PostgreSQL connections to the plugin state database from {@code VBWD_DB_*} settings. Each session
 * runs with {@code TimeZone=UTC} (pgjdbc {@code options} property), so timestamp columns never depend on
 * the JVM or server default zone.
 */
public final class JdbcConnectionProvider implements PluginStoreSchemaBootstrapper.ConnectionProvider {

    static final String SESSION_OPTIONS = "-c TimeZone=UTC";
    static final String APPLICATION_NAME = "vbwd-plugin-store";

    private final String url;
    private final Properties properties;

    public JdbcConnectionProvider(VbwdConfig config) {
        Objects.requireNonNull(config, "config");
        this.url = "jdbc:postgresql://" + config.getDbHost() + ":" + config.getDbPort() + "/" + config.getDbName();
        this.properties = connectionProperties(config);
    }

    public String getUrl() {
        return url;
    }

    /** Properties handed to the driver; a copy, so callers cannot change later connections. */
    Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url, getProperties());
    }

    private static Properties connectionProperties(VbwdConfig config) {
        Properties p = new Properties();
        p.setProperty("user", config.getDbUser());
        p.setProperty("password", config.getDbPassword() != null ? config.getDbPassword() : "");
        p.setProperty("options", SESSION_OPTIONS);
        p.setProperty("ApplicationName", APPLICATION_NAME);
        return p;
    }
}
