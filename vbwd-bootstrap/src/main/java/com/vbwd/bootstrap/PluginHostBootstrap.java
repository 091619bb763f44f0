package com.vbwd.bootstrap;

import com.vbwd.config.VbwdConfig;
import com.vbwd.plugin.api.CircularDependencyException;
import com.vbwd.plugin.api.PluginException;
import com.vbwd.plugin.api.PluginPersistenceException;
import com.vbwd.plugin.api.capability.CapabilityKind;
import com.vbwd.plugin.api.capability.CapabilityKinds;
import com.vbwd.plugin.core.PluginInstance;
import com.vbwd.plugin.core.PluginManager;
import com.vbwd.plugin.core.discovery.ServiceLoaderDiscoverySource;
import com.vbwd.plugin.core.store.PluginConfigStore;
import com.vbwd.plugin.metrics.PluginMetricsListener;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single bootstrap entry point for the plugin host. Builds the store, manager and metrics listener from
 * configuration, discovers plugins on the classpath and in {@code VBWD_PLUGINS_DIR}, restores persisted
 * enable decisions and, on a first start (the store holds no rows at all), enables {@code VBWD_DEFAULT_PLUGINS}.
 * A persisted disable therefore wins over the defaults on every later start.
 */
public final class PluginHostBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PluginHostBootstrap.class);

    private PluginHostBootstrap() {
    }

    /**
     * Loads configuration from environment and starts the host.
     *
     * @return context holding the manager and startup results
     */
    public static PluginHostContext initialize() {
        return initialize(VbwdConfig.fromEnvironment());
    }

    public static PluginHostContext initialize(VbwdConfig config) {
        Objects.requireNonNull(config, "config");
        log.info("Plugin host starting: pluginsDir={} store={} defaultPlugins={}",
                config.getPluginsDir(), config.getPluginStore(), config.getDefaultPlugins());

        PluginConfigStore store = PluginStoreFactory.create(config);
        ExecutorService discoveryExecutor = createDiscoveryExecutor(config.getDiscoveryThreads());
        PluginManager.Builder builder = PluginManager.builder()
                .store(store)
                .capabilityKinds(capabilityKinds(config));
        if (discoveryExecutor != null) {
            builder.discoveryExecutor(discoveryExecutor);
        }
        PluginManager manager = builder.build();

        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        PluginMetricsListener.register(meterRegistry, manager);

        int builtIn = manager.discover(new ServiceLoaderDiscoverySource());
        int external = manager.discover(Path.of(config.getPluginsDir()));
        log.info("Discovered {} classpath plugin(s) and {} plugin(s) from {}", builtIn, external, config.getPluginsDir());

        int restored = 0;
        boolean firstRun = false;
        try {
            restored = manager.loadPersistedState();
            firstRun = store.loadAll().isEmpty();
        } catch (PluginPersistenceException e) {
            log.error("Could not read persisted plugin state; no plugins restored and defaults not applied: {}",
                    e.getMessage(), e);
        }

        List<String> enabledDefaults = List.of();
        if (firstRun) {
            enabledDefaults = enableDefaults(manager, config.getDefaultPlugins());
        } else if (restored == 0) {
            log.info("Persisted plugin state exists; default plugins not applied");
        }
        if (manager.getEnabledPlugins().isEmpty()) {
            log.warn("No plugins enabled; check VBWD_DEFAULT_PLUGINS and VBWD_PLUGINS_DIR");
        }
        log.info("Plugin host started: {} registered, {} enabled", manager.getAllPlugins().size(),
                manager.getEnabledPlugins().size());
        return new PluginHostContext(config, manager, store, meterRegistry, discoveryExecutor,
                restored, enabledDefaults);
    }

    /** Route and UI kinds are mounted under the configured prefixes; translations are keyed by plugin name. */
    static List<CapabilityKind<?>> capabilityKinds(VbwdConfig config) {
        return List.of(
                CapabilityKinds.ROUTE.withMountPrefix(config.getRoutePrefix() + "/" + CapabilityKind.NAME_PLACEHOLDER),
                CapabilityKinds.TRANSLATION_BUNDLE,
                CapabilityKinds.UI_COMPONENT.withMountPrefix(config.getUiPrefix() + "/" + CapabilityKind.NAME_PLACEHOLDER));
    }

    /**
     * Enables the named plugins, dependencies first. Unknown names and plugins that fail to enable are
     * logged and skipped.
     *
     * @return names actually enabled, in enable order
     */
    static List<String> enableDefaults(PluginManager manager, List<String> defaults) {
        if (defaults.isEmpty()) {
            return List.of();
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (String name : defaults) {
            if (manager.isRegistered(name)) {
                wanted.add(name);
            } else {
                log.warn("Default plugin {} is not registered (skipping)", name);
            }
        }
        List<String> enabled = new ArrayList<>();
        for (String name : defaultEnableOrder(manager, wanted)) {
            PluginInstance instance = manager.getPlugin(name);
            if (instance == null || instance.isEnabled()) continue;
            try {
                manager.enable(name);
                enabled.add(name);
                log.info("Enabled default plugin {}", name);
            } catch (PluginException e) {
                log.warn("Default plugin {} could not be enabled (skipping): {}", name, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Default plugin {} failed to enable (skipping): {}", name, e.getMessage(), e);
            }
        }
        return enabled;
    }

    private static List<String> defaultEnableOrder(PluginManager manager, Set<String> wanted) {
        try {
            List<String> order = new ArrayList<>(manager.resolveOrder());
            order.retainAll(wanted);
            return order;
        } catch (CircularDependencyException e) {
            log.warn("Plugin dependencies form a cycle {}; enabling defaults in configured order", e.getCycle());
            return new ArrayList<>(wanted);
        }
    }

    private static ExecutorService createDiscoveryExecutor(int threads) {
        if (threads <= 1) {
            return null;
        }
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "vbwd-plugin-discovery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
