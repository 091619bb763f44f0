package com.vbwd.plugin.core;

import com.vbwd.plugin.api.CircularDependencyException;
import com.vbwd.plugin.api.DependencyNotEnabledException;
import com.vbwd.plugin.api.DependentPluginsEnabledException;
import com.vbwd.plugin.api.DuplicatePluginException;
import com.vbwd.plugin.api.Plugin;
import com.vbwd.plugin.api.PluginException;
import com.vbwd.plugin.api.PluginMetadata;
import com.vbwd.plugin.api.PluginNotFoundException;
import com.vbwd.plugin.api.PluginPersistenceException;
import com.vbwd.plugin.api.PluginStatus;
import com.vbwd.plugin.api.capability.Capability;
import com.vbwd.plugin.api.capability.CapabilityKind;
import com.vbwd.plugin.core.discovery.DiscoverySource;
import com.vbwd.plugin.core.discovery.JarDirectoryDiscoverySource;
import com.vbwd.plugin.core.discovery.PluginModuleClassLoader;
import com.vbwd.plugin.core.event.PluginEvent;
import com.vbwd.plugin.core.event.PluginEventDispatcher;
import com.vbwd.plugin.core.store.NoOpPluginConfigStore;
import com.vbwd.plugin.core.store.PersistedPluginConfig;
import com.vbwd.plugin.core.store.PersistedStatus;
import com.vbwd.plugin.core.store.PluginConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point of the plugin system and the only object the host talks to. Registers plugins, drives
 * their lifecycle, checks dependencies, persists enable/disable decisions, keeps the capability bundle of
 * enabled plugins current and dispatches lifecycle events.
 * <p>
 * Every mutating operation runs under one lock covering "read state, check legality, call the hook,
 * persist, mutate, rebuild capabilities", and either completes or leaves state unchanged. Hook and store
 * exceptions propagate to the caller. Events are dispatched after the lock is released.
 * <p>
 * Create one instance per host and pass it to whatever needs it; tests create a fresh manager per case.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final ReentrantLock lock = new ReentrantLock();
    /** name → instance, in registration order; guarded by {@link #lock}. */
    private final Map<String, PluginInstance> plugins = new LinkedHashMap<>();
    private final PluginConfigStore store;
    private final PluginEventDispatcher eventDispatcher;
    private final CapabilityCollector capabilityCollector;
    private final DependencyResolver resolver = new DependencyResolver();
    private final Clock clock;
    private final Executor discoveryExecutor;
    private long registrationSequence;
    private volatile CapabilityBundle capabilities = CapabilityBundle.EMPTY;

    /** In-memory manager with the built-in capability kinds and no persistence. */
    public PluginManager() {
        this(builder());
    }

    private PluginManager(Builder b) {
        this.store = b.store != null ? b.store : NoOpPluginConfigStore.INSTANCE;
        this.eventDispatcher = b.eventDispatcher != null ? b.eventDispatcher : new PluginEventDispatcher();
        this.capabilityCollector = b.capabilityCollector != null ? b.capabilityCollector : new CapabilityCollector();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.discoveryExecutor = b.discoveryExecutor != null ? b.discoveryExecutor : Runnable::run;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PluginEventDispatcher getEventDispatcher() {
        return eventDispatcher;
    }

    public PluginConfigStore getStore() {
        return store;
    }

    public CapabilityCollector getCapabilityCollector() {
        return capabilityCollector;
    }

    // ---------------------------------------------------------------- registration

    /**
     * Registers the plugin at {@link PluginStatus#DISCOVERED}.
     *
     * @return the registered instance
     * @throws DuplicatePluginException if a plugin with the same name is registered
     */
    public PluginInstance register(Plugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        PluginMetadata metadata = Objects.requireNonNull(plugin.getMetadata(), "plugin metadata");
        PluginInstance instance;
        lock.lock();
        try {
            instance = registerLocked(plugin, metadata);
        } finally {
            lock.unlock();
        }
        log.info("Registered plugin {} v{}", metadata.name(), metadata.version());
        dispatch(List.of(PluginEvent.of(PluginEvent.REGISTERED, metadata.name())));
        return instance;
    }

    private PluginInstance registerLocked(Plugin plugin, PluginMetadata metadata) {
        if (plugins.containsKey(metadata.name())) {
            throw new DuplicatePluginException(metadata.name());
        }
        PluginInstance instance = new PluginInstance(plugin, metadata, ++registrationSequence, clock.instant());
        plugins.put(metadata.name(), instance);
        return instance;
    }

    /** Same as {@link #initialize(String, Map)} with an empty config. */
    public void initialize(String name) {
        initialize(name, null);
    }

    /**
     * Runs the plugin's one-time setup and moves it from DISCOVERED to INITIALIZED.
     *
     * @param config configuration handed to {@link Plugin#onInitialize(Map)} and kept for enable; null = empty
     * @throws PluginNotFoundException        if the name is not registered
     * @throws com.vbwd.plugin.api.InvalidTransitionException if the plugin is not DISCOVERED
     */
    public void initialize(String name, Map<String, Object> config) {
        String pluginName = normalizeName(name);
        lock.lock();
        try {
            PluginInstance instance = require(pluginName);
            PluginLifecycle.requireTransition(pluginName, instance.getStatus(), PluginStatus.INITIALIZED);
            Map<String, Object> cfg = PluginInstance.immutableCopy(config);
            instance.getPlugin().onInitialize(cfg);
            instance.setConfig(cfg);
            instance.setStatus(PluginStatus.INITIALIZED, clock.instant());
        } finally {
            lock.unlock();
        }
        log.info("Initialized plugin {}", pluginName);
        dispatch(List.of(PluginEvent.of(PluginEvent.INITIALIZED, pluginName)));
    }

    // ---------------------------------------------------------------- enable / disable

    /**
     * Enables the plugin: checks it is INITIALIZED or DISABLED and that every dependency is ENABLED, runs
     * {@link Plugin#onEnable(Map)}, persists the decision, rebuilds capabilities and dispatches
     * {@value PluginEvent#ENABLED}. Enabling an ENABLED plugin is a no-op.
     *
     * @throws PluginNotFoundException       if the name is not registered
     * @throws com.vbwd.plugin.api.InvalidTransitionException if the plugin is DISCOVERED
     * @throws DependencyNotEnabledException if a dependency is missing or not enabled
     * @throws PluginPersistenceException    if the decision cannot be saved (the hook is compensated)
     */
    public void enable(String name) {
        String pluginName = normalizeName(name);
        List<PluginEvent> events = new ArrayList<>(1);
        lock.lock();
        try {
            enableLocked(require(pluginName), true, events);
        } finally {
            lock.unlock();
        }
        dispatch(events);
    }

    private void enableLocked(PluginInstance instance, boolean persist, List<PluginEvent> events) {
        String name = instance.getName();
        if (PluginLifecycle.isNoOp(instance.getStatus(), PluginStatus.ENABLED)) {
            log.debug("Plugin {} already enabled", name);
            return;
        }
        PluginLifecycle.requireTransition(name, instance.getStatus(), PluginStatus.ENABLED);
        for (String dep : instance.getMetadata().dependencies()) {
            PluginInstance depInstance = plugins.get(dep);
            if (depInstance == null || !depInstance.isEnabled()) {
                throw new DependencyNotEnabledException(name, dep);
            }
        }
        Plugin plugin = instance.getPlugin();
        plugin.onEnable(instance.getConfig());
        if (persist) {
            try {
                store.save(name, PersistedStatus.ENABLED, instance.getConfig());
            } catch (RuntimeException e) {
                PluginPersistenceException failure = persistenceFailure(name, "enable", e);
                try {
                    plugin.onDisable();
                } catch (RuntimeException compensation) {
                    failure.addSuppressed(compensation);
                }
                throw failure;
            }
        }
        instance.setStatus(PluginStatus.ENABLED, clock.instant());
        refreshCapabilities();
        log.info("Enabled plugin {} v{}", name, instance.getMetadata().version());
        events.add(PluginEvent.of(PluginEvent.ENABLED, name));
    }

    /**
     * Disables the plugin: checks it is ENABLED and that no enabled plugin depends on it, runs
     * {@link Plugin#onDisable()}, persists the decision, rebuilds capabilities and dispatches
     * {@value PluginEvent#DISABLED}. Disabling a DISABLED plugin is a no-op.
     *
     * @throws PluginNotFoundException          if the name is not registered
     * @throws com.vbwd.plugin.api.InvalidTransitionException if the plugin is not ENABLED or DISABLED
     * @throws DependentPluginsEnabledException if enabled plugins depend on it
     * @throws PluginPersistenceException       if the decision cannot be saved (the hook is compensated)
     */
    public void disable(String name) {
        String pluginName = normalizeName(name);
        List<PluginEvent> events = new ArrayList<>(1);
        lock.lock();
        try {
            PluginInstance instance = require(pluginName);
            if (PluginLifecycle.isNoOp(instance.getStatus(), PluginStatus.DISABLED)) {
                log.debug("Plugin {} already disabled", pluginName);
                return;
            }
            PluginLifecycle.requireTransition(pluginName, instance.getStatus(), PluginStatus.DISABLED);
            requireNoEnabledDependents(pluginName);
            Plugin plugin = instance.getPlugin();
            plugin.onDisable();
            try {
                store.save(pluginName, PersistedStatus.DISABLED, instance.getConfig());
            } catch (RuntimeException e) {
                PluginPersistenceException failure = persistenceFailure(pluginName, "disable", e);
                try {
                    plugin.onEnable(instance.getConfig());
                } catch (RuntimeException compensation) {
                    failure.addSuppressed(compensation);
                }
                throw failure;
            }
            instance.setStatus(PluginStatus.DISABLED, clock.instant());
            refreshCapabilities();
            log.info("Disabled plugin {}", pluginName);
            events.add(PluginEvent.of(PluginEvent.DISABLED, pluginName));
        } finally {
            lock.unlock();
        }
        dispatch(events);
    }

    /**
     * Removes the plugin from the registry; its name becomes available again. An ENABLED plugin is
     * disabled first (hook only; the persisted row is kept). Persisted state is removed only through
     * {@link PluginConfigStore#delete(String)}.
     *
     * @throws PluginNotFoundException          if the name is not registered
     * @throws DependentPluginsEnabledException if the plugin is enabled and enabled plugins depend on it
     */
    public void uninstall(String name) {
        String pluginName = normalizeName(name);
        lock.lock();
        try {
            PluginInstance instance = require(pluginName);
            PluginLifecycle.requireTransition(pluginName, instance.getStatus(), PluginStatus.UNINSTALLED);
            boolean wasEnabled = instance.isEnabled();
            if (wasEnabled) {
                requireNoEnabledDependents(pluginName);
                instance.getPlugin().onDisable();
            }
            plugins.remove(pluginName);
            instance.setStatus(PluginStatus.UNINSTALLED, clock.instant());
            if (wasEnabled) {
                refreshCapabilities();
            }
            releaseModuleLocked(instance.getPlugin());
        } finally {
            lock.unlock();
        }
        log.info("Uninstalled plugin {}", pluginName);
        dispatch(List.of(PluginEvent.of(PluginEvent.UNINSTALLED, pluginName)));
    }

    // ---------------------------------------------------------------- discovery and restore

    /**
     * Discovers plugin modules in the directory (see {@link JarDirectoryDiscoverySource}).
     *
     * @return number of newly registered plugins
     */
    public int discover(Path pluginsDir) {
        return discover(new JarDirectoryDiscoverySource(pluginsDir, discoveryExecutor));
    }

    /**
     * Registers every plugin produced by the source whose name is not registered yet and moves it to
     * INITIALIZED with an empty config. Plugins with an already registered name are skipped (re-discovery
     * is idempotent); a plugin whose metadata or setup throws is logged and skipped.
     *
     * @return number of newly registered plugins
     */
    public int discover(DiscoverySource source) {
        Objects.requireNonNull(source, "source");
        List<Plugin> found = source.loadPlugins();
        List<PluginEvent> events = new ArrayList<>();
        int added = 0;
        lock.lock();
        try {
            List<Plugin> skipped = new ArrayList<>();
            for (Plugin plugin : found) {
                if (registerDiscoveredLocked(plugin, events)) {
                    added++;
                } else if (plugin != null) {
                    skipped.add(plugin);
                }
            }
            for (Plugin plugin : skipped) {
                releaseModuleLocked(plugin);
            }
        } finally {
            lock.unlock();
        }
        log.info("Discovery registered {} new plugin(s) ({} found)", added, found.size());
        if (added > 0) {
            warnOnCycle();
        }
        dispatch(events);
        return added;
    }

    private boolean registerDiscoveredLocked(Plugin plugin, List<PluginEvent> events) {
        if (plugin == null) {
            return false;
        }
        PluginMetadata metadata;
        try {
            metadata = plugin.getMetadata();
        } catch (RuntimeException e) {
            log.warn("Discovered plugin {} has invalid metadata (skipping): {}", plugin.getClass().getName(), e.getMessage(), e);
            return false;
        }
        if (metadata == null) {
            log.warn("Discovered plugin {} returned no metadata (skipping)", plugin.getClass().getName());
            return false;
        }
        if (plugins.containsKey(metadata.name())) {
            log.debug("Plugin {} already registered; skipping re-discovered instance", metadata.name());
            return false;
        }
        try {
            plugin.onInitialize(Map.of());
        } catch (RuntimeException e) {
            log.warn("Discovered plugin {} failed to initialize (skipping): {}", metadata.name(), e.getMessage(), e);
            return false;
        }
        PluginInstance instance = registerLocked(plugin, metadata);
        instance.setStatus(PluginStatus.INITIALIZED, clock.instant());
        log.info("Discovered plugin {} v{}", metadata.name(), metadata.version());
        events.add(PluginEvent.of(PluginEvent.REGISTERED, metadata.name()));
        events.add(PluginEvent.of(PluginEvent.INITIALIZED, metadata.name()));
        return true;
    }

    /**
     * Restores enable decisions from the store. For each persisted enabled row whose plugin is registered
     * and INITIALIZED, merges the persisted config into the plugin's config and enables it (dependencies
     * first). Unknown plugins and failing enables are logged and skipped. Replayed enables are not saved
     * again.
     *
     * @return number of plugins enabled
     * @throws PluginPersistenceException if the store cannot be read
     */
    public int loadPersistedState() {
        List<PersistedPluginConfig> rows = store.loadEnabled();
        if (rows.isEmpty()) {
            log.info("No persisted plugin state to restore");
            return 0;
        }
        List<PluginEvent> events = new ArrayList<>();
        int restored = 0;
        lock.lock();
        try {
            Map<String, Integer> position = positions(loadOrderLocked());
            List<PersistedPluginConfig> ordered = new ArrayList<>(rows);
            ordered.sort(Comparator.comparingInt(r -> position.getOrDefault(r.pluginName(), Integer.MAX_VALUE)));
            for (PersistedPluginConfig row : ordered) {
                if (restoreLocked(row, events)) {
                    restored++;
                }
            }
        } finally {
            lock.unlock();
        }
        log.info("Restored {} of {} persisted enabled plugin(s)", restored, rows.size());
        dispatch(events);
        return restored;
    }

    private boolean restoreLocked(PersistedPluginConfig row, List<PluginEvent> events) {
        String name = row.pluginName();
        PluginInstance instance = plugins.get(name);
        if (instance == null) {
            log.warn("Persisted state references unknown plugin {} (skipping)", name);
            return false;
        }
        if (instance.isEnabled()) {
            log.debug("Plugin {} already enabled; persisted state ignored", name);
            return false;
        }
        if (instance.getStatus() != PluginStatus.INITIALIZED) {
            log.warn("Plugin {} is {} (expected INITIALIZED); persisted state ignored", name, instance.getStatus());
            return false;
        }
        Map<String, Object> previousConfig = instance.getConfig();
        instance.setConfig(PluginInstance.merge(previousConfig, row.config()));
        try {
            enableLocked(instance, false, events);
            return true;
        } catch (RuntimeException e) {
            instance.setConfig(previousConfig);
            log.warn("Failed to restore plugin {} (skipping): {}", name, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Disables every enabled plugin in reverse load order without touching the store, so the next start
     * restores the same set. Hook failures are logged and do not stop the remaining plugins.
     *
     * @return number of plugins disabled
     */
    public int shutdown() {
        List<PluginEvent> events = new ArrayList<>();
        int disabled = 0;
        lock.lock();
        try {
            List<PluginInstance> order = loadOrderLocked();
            for (int i = order.size() - 1; i >= 0; i--) {
                PluginInstance instance = order.get(i);
                if (!instance.isEnabled()) continue;
                try {
                    instance.getPlugin().onDisable();
                } catch (RuntimeException e) {
                    log.error("Plugin {} failed to disable during shutdown: {}", instance.getName(), e.getMessage(), e);
                }
                instance.setStatus(PluginStatus.DISABLED, clock.instant());
                events.add(PluginEvent.of(PluginEvent.DISABLED, instance.getName()));
                disabled++;
            }
            refreshCapabilities();
        } finally {
            lock.unlock();
        }
        log.info("Plugin manager shut down; {} plugin(s) disabled", disabled);
        dispatch(events);
        return disabled;
    }

    /**
     * Closes the module classloaders of all registered plugins loaded from a plugins directory. Call after
     * {@link #shutdown()} when the host exits; those plugins cannot be enabled again afterwards.
     *
     * @return number of module classloaders closed
     */
    public int closeModuleLoaders() {
        int closed = 0;
        lock.lock();
        try {
            for (PluginInstance instance : plugins.values()) {
                PluginModuleClassLoader loader = PluginModuleClassLoader.of(instance.getPlugin());
                if (loader != null && !loader.isClosed()) {
                    loader.release();
                    closed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (closed > 0) {
            log.info("Closed {} plugin module classloader(s)", closed);
        }
        return closed;
    }

    // ---------------------------------------------------------------- queries

    /** Registered instance for the name, or null. */
    public PluginInstance getPlugin(String name) {
        if (name == null) return null;
        lock.lock();
        try {
            return plugins.get(name.trim());
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(String name) {
        return getPlugin(name) != null;
    }

    /** All registered instances in registration order. */
    public List<PluginInstance> getAllPlugins() {
        lock.lock();
        try {
            return List.copyOf(plugins.values());
        } finally {
            lock.unlock();
        }
    }

    /** Enabled instances in registration order. */
    public List<PluginInstance> getEnabledPlugins() {
        lock.lock();
        try {
            List<PluginInstance> out = new ArrayList<>();
            for (PluginInstance instance : plugins.values()) {
                if (instance.isEnabled()) out.add(instance);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Orders the registered plugins so each comes after its dependencies. Computed from the current
     * registry on every call.
     *
     * @throws CircularDependencyException if the dependencies form a cycle
     */
    public List<String> resolveOrder() {
        lock.lock();
        try {
            return resolver.resolve(metadataLocked());
        } finally {
            lock.unlock();
        }
    }

    /** Capabilities of the named kind from enabled plugins; empty for unknown kinds. */
    public List<Capability<?>> getCapabilities(String kind) {
        return capabilities.get(kind);
    }

    /** Typed view of {@link #getCapabilities(String)}. */
    @SuppressWarnings("unchecked")
    public <T> List<Capability<T>> getCapabilities(CapabilityKind<T> kind) {
        Objects.requireNonNull(kind, "kind");
        List<?> list = capabilities.get(kind.getName());
        return (List<Capability<T>>) list;
    }

    /** Current capability snapshot. */
    public CapabilityBundle getCapabilityBundle() {
        return capabilities;
    }

    // ---------------------------------------------------------------- internals

    private PluginInstance require(String name) {
        PluginInstance instance = plugins.get(name);
        if (instance == null) {
            throw new PluginNotFoundException(name);
        }
        return instance;
    }

    private void requireNoEnabledDependents(String name) {
        List<String> dependents = new ArrayList<>();
        for (PluginInstance other : plugins.values()) {
            if (other.isEnabled() && other.getMetadata().dependsOn(name)) {
                dependents.add(other.getName());
            }
        }
        if (!dependents.isEmpty()) {
            throw new DependentPluginsEnabledException(name, dependents);
        }
    }

    /** Closes the plugin's module classloader once no registered plugin was defined by it. */
    private void releaseModuleLocked(Plugin plugin) {
        PluginModuleClassLoader loader = PluginModuleClassLoader.of(plugin);
        if (loader == null || loader.isClosed()) {
            return;
        }
        for (PluginInstance other : plugins.values()) {
            if (PluginModuleClassLoader.of(other.getPlugin()) == loader) {
                return;
            }
        }
        loader.release();
    }

    private void refreshCapabilities() {
        List<PluginInstance> enabled = new ArrayList<>();
        for (PluginInstance instance : loadOrderLocked()) {
            if (instance.isEnabled()) enabled.add(instance);
        }
        capabilities = capabilityCollector.collect(enabled);
    }

    /** Registered instances in dependency order; registration order when the graph has a cycle. */
    private List<PluginInstance> loadOrderLocked() {
        List<String> names;
        try {
            names = resolver.resolve(metadataLocked());
        } catch (CircularDependencyException e) {
            return new ArrayList<>(plugins.values());
        }
        List<PluginInstance> out = new ArrayList<>(names.size());
        for (String n : names) {
            out.add(plugins.get(n));
        }
        return out;
    }

    private List<PluginMetadata> metadataLocked() {
        List<PluginMetadata> out = new ArrayList<>(plugins.size());
        for (PluginInstance instance : plugins.values()) {
            out.add(instance.getMetadata());
        }
        return out;
    }

    private static Map<String, Integer> positions(Collection<PluginInstance> ordered) {
        Map<String, Integer> out = new HashMap<>();
        int i = 0;
        for (PluginInstance instance : ordered) {
            out.put(instance.getName(), i++);
        }
        return out;
    }

    private void warnOnCycle() {
        try {
            resolveOrder();
        } catch (CircularDependencyException e) {
            log.warn("Registered plugins have a dependency cycle; affected plugins cannot all be enabled: {}", e.getMessage());
        }
    }

    private void dispatch(List<PluginEvent> events) {
        for (PluginEvent event : events) {
            eventDispatcher.dispatch(event);
        }
    }

    private static PluginPersistenceException persistenceFailure(String name, String action, RuntimeException e) {
        if (e instanceof PluginPersistenceException ppe) {
            return ppe;
        }
        return new PluginPersistenceException(name, "Failed to persist " + action + " of plugin '" + name + "': " + e.getMessage(), e);
    }

    private static String normalizeName(String name) {
        Objects.requireNonNull(name, "name");
        return name.trim();
    }

    /**
     * Builder for {@link PluginManager}. Every setting is optional.
     */
    public static final class Builder {
        private PluginConfigStore store;
        private PluginEventDispatcher eventDispatcher;
        private CapabilityCollector capabilityCollector;
        private Clock clock;
        private Executor discoveryExecutor;

        private Builder() {
        }

        /** Durable store for enable/disable decisions; null = purely in-memory operation. */
        public Builder store(PluginConfigStore store) {
            this.store = store;
            return this;
        }

        public Builder eventDispatcher(PluginEventDispatcher eventDispatcher) {
            this.eventDispatcher = eventDispatcher;
            return this;
        }

        /** Capability kinds to collect; replaces the built-in kinds. */
        public Builder capabilityKinds(Collection<? extends CapabilityKind<?>> kinds) {
            this.capabilityCollector = new CapabilityCollector(kinds);
            return this;
        }

        public Builder capabilityCollector(CapabilityCollector capabilityCollector) {
            this.capabilityCollector = capabilityCollector;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Executor for scanning plugin modules in {@link PluginManager#discover(Path)}; default runs on the caller. */
        public Builder discoveryExecutor(Executor discoveryExecutor) {
            this.discoveryExecutor = discoveryExecutor;
            return this;
        }

        public PluginManager build() {
            return new PluginManager(this);
        }
    }
}
