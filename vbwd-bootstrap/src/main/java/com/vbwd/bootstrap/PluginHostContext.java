package com.vbwd.bootstrap;

import com.vbwd.config.VbwdConfig;
import com.vbwd.plugin.core.PluginManager;
import com.vbwd.plugin.core.store.PluginConfigStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Wrapper object returned from bootstrap. Holds the env-derived configuration, the wired plugin manager
 * and what startup did (plugins restored from the store, default plugins enabled).
 */
public final class PluginHostContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginHostContext.class);

    private final VbwdConfig config;
    private final PluginManager manager;
    private final PluginConfigStore store;
    private final MeterRegistry meterRegistry;
    private final ExecutorService discoveryExecutor;
    private final int restoredCount;
    private final List<String> enabledDefaults;
    private boolean closed;

    PluginHostContext(VbwdConfig config, PluginManager manager, PluginConfigStore store, MeterRegistry meterRegistry,
                      ExecutorService discoveryExecutor, int restoredCount, List<String> enabledDefaults) {
        this.config = Objects.requireNonNull(config, "config");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.store = Objects.requireNonNull(store, "store");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.discoveryExecutor = discoveryExecutor;
        this.restoredCount = restoredCount;
        this.enabledDefaults = enabledDefaults != null ? List.copyOf(enabledDefaults) : List.of();
    }

    /** Configuration built from environment (VBWD_PLUGINS_DIR, VBWD_PLUGIN_STORE, VBWD_DB_*, etc.). */
    public VbwdConfig getConfig() {
        return config;
    }

    public PluginManager getManager() {
        return manager;
    }

    /** Store actually in use; the no-op store when the configured one could not be created. */
    public PluginConfigStore getStore() {
        return store;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /** Number of plugins re-enabled from persisted state. */
    public int getRestoredCount() {
        return restoredCount;
    }

    /** Default plugins enabled because the store held no rows at all; empty otherwise. */
    public List<String> getEnabledDefaults() {
        return enabledDefaults;
    }

    /**
     * Disables every enabled plugin (without touching the store), closes plugin module classloaders, stops
     * the discovery pool and closes the store when it holds connections. Safe to call more than once.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        int stopped = manager.shutdown();
        manager.closeModuleLoaders();
        log.info("Plugin host stopped ({} plugin(s) disabled)", stopped);
        if (discoveryExecutor != null) {
            discoveryExecutor.shutdownNow();
        }
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                log.warn("Failed to close plugin store: {}", e.getMessage(), e);
            }
        }
        meterRegistry.close();
    }
}
