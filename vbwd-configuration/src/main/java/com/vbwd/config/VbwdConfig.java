package com.vbwd.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Plugin host configuration loaded from environment variables.
 * <p>
 * Plugins: VBWD_PLUGINS_DIR, VBWD_DEFAULT_PLUGINS, VBWD_PLUGIN_DISCOVERY_THREADS, VBWD_PLUGIN_ROUTE_PREFIX,
 * VBWD_PLUGIN_UI_PREFIX. Persistence: VBWD_PLUGIN_STORE, VBWD_PLUGIN_STATE_FILE, VBWD_PLUGIN_KEY_PREFIX.
 * DB: VBWD_DB_HOST, VBWD_DB_PORT, VBWD_DB_NAME, VBWD_DB_USER, VBWD_DB_PASSWORD. Cache: VBWD_CACHE_HOST, VBWD_CACHE_PORT.
 */
public final class VbwdConfig {

    static final String ENV_PLUGINS_DIR = "VBWD_PLUGINS_DIR";
    static final String ENV_PLUGIN_STORE = "VBWD_PLUGIN_STORE";
    static final String ENV_PLUGIN_STATE_FILE = "VBWD_PLUGIN_STATE_FILE";
    static final String ENV_PLUGIN_KEY_PREFIX = "VBWD_PLUGIN_KEY_PREFIX";
    static final String ENV_DEFAULT_PLUGINS = "VBWD_DEFAULT_PLUGINS";
    static final String ENV_PLUGIN_ROUTE_PREFIX = "VBWD_PLUGIN_ROUTE_PREFIX";
    static final String ENV_PLUGIN_UI_PREFIX = "VBWD_PLUGIN_UI_PREFIX";
    static final String ENV_PLUGIN_DISCOVERY_THREADS = "VBWD_PLUGIN_DISCOVERY_THREADS";
    static final String ENV_DB_HOST = "VBWD_DB_HOST";
    static final String ENV_DB_PORT = "VBWD_DB_PORT";
    static final String ENV_DB_NAME = "VBWD_DB_NAME";
    static final String ENV_DB_USER = "VBWD_DB_USER";
    static final String ENV_DB_PASSWORD = "VBWD_DB_PASSWORD";
    static final String ENV_CACHE_HOST = "VBWD_CACHE_HOST";
    static final String ENV_CACHE_PORT = "VBWD_CACHE_PORT";

    private static final String DEFAULT_PLUGINS_DIR = "plugins";
    private static final PluginStoreType DEFAULT_PLUGIN_STORE = PluginStoreType.FILE;
    private static final String DEFAULT_PLUGIN_STATE_FILE = "data/plugins.json";
    private static final String DEFAULT_PLUGIN_KEY_PREFIX = "vbwd:plugins";
    private static final String DEFAULT_ROUTE_PREFIX = "/api/v1/plugins";
    private static final String DEFAULT_UI_PREFIX = "/plugins";
    private static final int DEFAULT_DISCOVERY_THREADS = 1;
    private static final String DEFAULT_DB_NAME = "vbwd";
    private static final String DEFAULT_DB_USER = "vbwd";

    private final String pluginsDir;
    private final PluginStoreType pluginStore;
    private final String pluginStateFile;
    private final String pluginKeyPrefix;
    private final List<String> defaultPlugins;
    private final String routePrefix;
    private final String uiPrefix;
    private final int discoveryThreads;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final String cacheHost;
    private final int cachePort;

    private VbwdConfig(Builder b) {
        this.pluginsDir = b.pluginsDir;
        this.pluginStore = b.pluginStore;
        this.pluginStateFile = b.pluginStateFile;
        this.pluginKeyPrefix = b.pluginKeyPrefix;
        this.defaultPlugins = Collections.unmodifiableList(new ArrayList<>(b.defaultPlugins));
        this.routePrefix = trimTrailingSlash(b.routePrefix);
        this.uiPrefix = trimTrailingSlash(b.uiPrefix);
        this.discoveryThreads = Math.max(1, b.discoveryThreads);
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName != null ? b.dbName : DEFAULT_DB_NAME;
        this.dbUser = b.dbUser != null ? b.dbUser : DEFAULT_DB_USER;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
    }

    /** Directory scanned for plugin JARs. Default {@code plugins}. */
    public String getPluginsDir() {
        return pluginsDir;
    }

    /** Backend for persisted plugin state. Default {@link PluginStoreType#FILE}. */
    public PluginStoreType getPluginStore() {
        return pluginStore;
    }

    /** JSON state file for {@link PluginStoreType#FILE}. Default {@code data/plugins.json}. */
    public String getPluginStateFile() {
        return pluginStateFile;
    }

    /** Redis key prefix for {@link PluginStoreType#REDIS}. Default {@code vbwd:plugins}. */
    public String getPluginKeyPrefix() {
        return pluginKeyPrefix;
    }

    /**
     * Plugins the host enables on a first run (nothing restored from the store). Empty by default.
     */
    public List<String> getDefaultPlugins() {
        return defaultPlugins;
    }

    /** URL prefix under which plugin routes are mounted, without trailing slash. Default {@code /api/v1/plugins}. */
    public String getRoutePrefix() {
        return routePrefix;
    }

    /** Prefix under which plugin UI units are mounted. Default {@code /plugins}. */
    public String getUiPrefix() {
        return uiPrefix;
    }

    /** Threads used to scan plugin JARs; 1 scans on the bootstrap thread. */
    public int getDiscoveryThreads() {
        return discoveryThreads;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    public static VbwdConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Reads the same variables as {@link #fromEnvironment()} from the given lookup (null = unset).
     */
    public static VbwdConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .pluginsDir(getEnv(env, ENV_PLUGINS_DIR, DEFAULT_PLUGINS_DIR))
                .pluginStore(PluginStoreType.parse(env.apply(ENV_PLUGIN_STORE), DEFAULT_PLUGIN_STORE))
                .pluginStateFile(getEnv(env, ENV_PLUGIN_STATE_FILE, DEFAULT_PLUGIN_STATE_FILE))
                .pluginKeyPrefix(getEnv(env, ENV_PLUGIN_KEY_PREFIX, DEFAULT_PLUGIN_KEY_PREFIX))
                .defaultPlugins(parseCommaSeparated(env.apply(ENV_DEFAULT_PLUGINS)))
                .routePrefix(getEnv(env, ENV_PLUGIN_ROUTE_PREFIX, DEFAULT_ROUTE_PREFIX))
                .uiPrefix(getEnv(env, ENV_PLUGIN_UI_PREFIX, DEFAULT_UI_PREFIX))
                .discoveryThreads(parseInt(env.apply(ENV_PLUGIN_DISCOVERY_THREADS), DEFAULT_DISCOVERY_THREADS))
                .dbHost(getEnv(env, ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(env.apply(ENV_DB_PORT), 5432))
                .dbName(getEnv(env, ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(getEnv(env, ENV_DB_USER, DEFAULT_DB_USER))
                .dbPassword(getEnv(env, ENV_DB_PASSWORD, ""))
                .cacheHost(getEnv(env, ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(env.apply(ENV_CACHE_PORT), 6379))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static String trimTrailingSlash(String prefix) {
        if (prefix == null) return "";
        String p = prefix.trim();
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    public static final class Builder {
        private String pluginsDir = DEFAULT_PLUGINS_DIR;
        private PluginStoreType pluginStore = DEFAULT_PLUGIN_STORE;
        private String pluginStateFile = DEFAULT_PLUGIN_STATE_FILE;
        private String pluginKeyPrefix = DEFAULT_PLUGIN_KEY_PREFIX;
        private List<String> defaultPlugins = List.of();
        private String routePrefix = DEFAULT_ROUTE_PREFIX;
        private String uiPrefix = DEFAULT_UI_PREFIX;
        private int discoveryThreads = DEFAULT_DISCOVERY_THREADS;
        private String dbHost = "localhost";
        private int dbPort = 5432;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private String cacheHost = "localhost";
        private int cachePort = 6379;

        public Builder pluginsDir(String pluginsDir) {
            this.pluginsDir = pluginsDir != null ? pluginsDir : DEFAULT_PLUGINS_DIR;
            return this;
        }

        public Builder pluginStore(PluginStoreType pluginStore) {
            this.pluginStore = pluginStore != null ? pluginStore : DEFAULT_PLUGIN_STORE;
            return this;
        }

        public Builder pluginStateFile(String pluginStateFile) {
            this.pluginStateFile = pluginStateFile != null ? pluginStateFile : DEFAULT_PLUGIN_STATE_FILE;
            return this;
        }

        public Builder pluginKeyPrefix(String pluginKeyPrefix) {
            this.pluginKeyPrefix = pluginKeyPrefix != null ? pluginKeyPrefix : DEFAULT_PLUGIN_KEY_PREFIX;
            return this;
        }

        public Builder defaultPlugins(List<String> defaultPlugins) {
            this.defaultPlugins = Objects.requireNonNull(defaultPlugins, "defaultPlugins");
            return this;
        }

        public Builder routePrefix(String routePrefix) {
            this.routePrefix = routePrefix != null ? routePrefix : DEFAULT_ROUTE_PREFIX;
            return this;
        }

        public Builder uiPrefix(String uiPrefix) {
            this.uiPrefix = uiPrefix != null ? uiPrefix : DEFAULT_UI_PREFIX;
            return this;
        }

        public Builder discoveryThreads(int discoveryThreads) {
            this.discoveryThreads = discoveryThreads;
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public VbwdConfig build() {
            return new VbwdConfig(this);
        }
    }
}
