package com.vbwd.bootstrap;

import com.vbwd.config.VbwdConfig;
import com.vbwd.plugin.core.store.InMemoryPluginConfigStore;
import com.vbwd.plugin.core.store.NoOpPluginConfigStore;
import com.vbwd.plugin.core.store.PluginConfigStore;
import com.vbwd.plugin.store.JdbcConnectionProvider;
import com.vbwd.plugin.store.JdbcPluginConfigStore;
import com.vbwd.plugin.store.JsonFilePluginConfigStore;
import com.vbwd.plugin.store.RedisPluginConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Creates the plugin config store selected by {@code VBWD_PLUGIN_STORE}. A durable store that cannot be
 * created or reached is replaced by the no-op store; the host keeps running without persisted state.
 */
public final class PluginStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(PluginStoreFactory.class);

    private PluginStoreFactory() {
    }

    public static PluginConfigStore create(VbwdConfig config) {
        Objects.requireNonNull(config, "config");
        switch (config.getPluginStore()) {
            case NONE:
                log.info("Plugin store disabled (VBWD_PLUGIN_STORE=none); enable/disable will not survive restart");
                return NoOpPluginConfigStore.INSTANCE;
            case MEMORY:
                log.info("Plugin store: in-memory");
                return new InMemoryPluginConfigStore();
            case FILE:
                return createFileStore(config);
            case JDBC:
                return createJdbcStore(config);
            case REDIS:
                return createRedisStore(config);
            default:
                throw new IllegalStateException("Unhandled plugin store type: " + config.getPluginStore());
        }
    }

    private static PluginConfigStore createFileStore(VbwdConfig config) {
        try {
            JsonFilePluginConfigStore store = new JsonFilePluginConfigStore(Path.of(config.getPluginStateFile()));
            store.loadAll();
            log.info("Plugin store: JSON file {}", store.getFile().toAbsolutePath());
            return store;
        } catch (Exception e) {
            log.warn("Plugin store using no-op store: could not open state file {} ({}). Startup continues.",
                    config.getPluginStateFile(), e.getMessage());
            return NoOpPluginConfigStore.INSTANCE;
        }
    }

    private static PluginConfigStore createJdbcStore(VbwdConfig config) {
        try {
            JdbcConnectionProvider connections = new JdbcConnectionProvider(config);
            JdbcPluginConfigStore store = new JdbcPluginConfigStore(connections);
            store.ensureSchema();
            log.info("Plugin store: JDBC {}", connections.getUrl());
            return store;
        } catch (Exception e) {
            log.warn("Plugin store using no-op store: could not create or init JDBC store ({}). Startup continues.",
                    e.getMessage());
            return NoOpPluginConfigStore.INSTANCE;
        }
    }

    private static PluginConfigStore createRedisStore(VbwdConfig config) {
        RedisPluginConfigStore store = null;
        try {
            store = new RedisPluginConfigStore(config);
            store.ping();
            log.info("Plugin store: Redis {}:{} prefix={}", config.getCacheHost(), config.getCachePort(),
                    config.getPluginKeyPrefix());
            return store;
        } catch (Exception e) {
            log.warn("Plugin store using no-op store: could not reach Redis at {}:{} ({}). Startup continues.",
                    config.getCacheHost(), config.getCachePort(), e.getMessage());
            if (store != null) {
                store.close();
            }
            return NoOpPluginConfigStore.INSTANCE;
        }
    }
}
