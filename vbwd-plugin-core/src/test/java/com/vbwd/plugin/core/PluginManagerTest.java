package com.vbwd.plugin.core;

import com.vbwd.plugin.api.CircularDependencyException;
import com.vbwd.plugin.api.DependencyNotEnabledException;
import com.vbwd.plugin.api.DependentPluginsEnabledException;
import com.vbwd.plugin.api.DuplicatePluginException;
import com.vbwd.plugin.api.InvalidTransitionException;
import com.vbwd.plugin.api.PluginNotFoundException;
import com.vbwd.plugin.api.PluginPersistenceException;
import com.vbwd.plugin.api.PluginStatus;
import com.vbwd.plugin.api.capability.Capability;
import com.vbwd.plugin.api.capability.CapabilityKinds;
import com.vbwd.plugin.core.discovery.DiscoverySource;
import com.vbwd.plugin.core.event.PluginEvent;
import com.vbwd.plugin.core.store.InMemoryPluginConfigStore;
import com.vbwd.plugin.core.store.PersistedPluginConfig;
import com.vbwd.plugin.core.store.PersistedStatus;
import com.vbwd.plugin.core.store.PluginConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginManagerTest {

    private InMemoryPluginConfigStore store;
    private PluginManager manager;
    private List<String> events;

    @BeforeEach
    void setUp() {
        store = new InMemoryPluginConfigStore();
        manager = PluginManager.builder().store(store).build();
        events = new ArrayList<>();
        for (String name : List.of(PluginEvent.REGISTERED, PluginEvent.INITIALIZED, PluginEvent.ENABLED,
                PluginEvent.DISABLED, PluginEvent.UNINSTALLED)) {
            manager.getEventDispatcher().addListener(name, e -> events.add(e.getName() + ":" + e.getPluginName()));
        }
    }

    private RecordingPlugin registerAndInitialize(String name, String... deps) {
        RecordingPlugin plugin = new RecordingPlugin(name, deps);
        manager.register(plugin);
        manager.initialize(name);
        return plugin;
    }

    @Test
    void register_startsDiscoveredAndRejectsDuplicates() {
        manager.register(new RecordingPlugin("analytics"));

        assertEquals(PluginStatus.DISCOVERED, manager.getPlugin("analytics").getStatus());
        DuplicatePluginException e = assertThrows(DuplicatePluginException.class,
                () -> manager.register(new RecordingPlugin("analytics")));
        assertEquals("analytics", e.getPluginName());
        assertEquals(1, manager.getAllPlugins().size());
    }

    @Test
    void operationsOnUnknownName_throwNotFound() {
        assertThrows(PluginNotFoundException.class, () -> manager.initialize("ghost"));
        assertThrows(PluginNotFoundException.class, () -> manager.enable("ghost"));
        assertThrows(PluginNotFoundException.class, () -> manager.disable("ghost"));
        assertThrows(PluginNotFoundException.class, () -> manager.uninstall("ghost"));
        assertNull(manager.getPlugin("ghost"));
    }

    @Test
    void initialize_passesConfigAndMovesToInitialized() {
        RecordingPlugin plugin = new RecordingPlugin("analytics");
        manager.register(plugin);

        manager.initialize("analytics", Map.of("sample_rate", 5));

        PluginInstance instance = manager.getPlugin("analytics");
        assertEquals(PluginStatus.INITIALIZED, instance.getStatus());
        assertEquals(5, instance.getConfig().get("sample_rate"));
        assertEquals(5, plugin.getConfig("sample_rate"));
        assertThrows(InvalidTransitionException.class, () -> manager.initialize("analytics"));
    }

    @Test
    void initialize_hookFailureLeavesPluginDiscovered() {
        RecordingPlugin plugin = new RecordingPlugin("analytics");
        plugin.failOnInitialize = true;
        manager.register(plugin);

        assertThrows(IllegalStateException.class, () -> manager.initialize("analytics"));

        assertEquals(PluginStatus.DISCOVERED, manager.getPlugin("analytics").getStatus());
    }

    @Test
    void enable_fromDiscovered_isInvalidTransition() {
        manager.register(new RecordingPlugin("analytics"));

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class, () -> manager.enable("analytics"));
        assertEquals(PluginStatus.DISCOVERED, e.getFrom());
        assertEquals(PluginStatus.ENABLED, e.getTo());
    }

    @Test
    void enable_isIdempotent() {
        RecordingPlugin plugin = registerAndInitialize("analytics");

        manager.enable("analytics");
        manager.enable("analytics");

        assertEquals(1, plugin.count("enable"));
        assertEquals(1, events.stream().filter("plugin.enabled:analytics"::equals).count());
        assertTrue(manager.getPlugin("analytics").isEnabled());
    }

    @Test
    void dependencyChain_enableAndDisableOrder() {
        registerAndInitialize("core");
        registerAndInitialize("payments", "core");

        DependencyNotEnabledException notEnabled = assertThrows(DependencyNotEnabledException.class,
                () -> manager.enable("payments"));
        assertEquals("core", notEnabled.getDependency());
        assertEquals(PluginStatus.INITIALIZED, manager.getPlugin("payments").getStatus());

        manager.enable("core");
        manager.enable("payments");
        assertEquals(2, manager.getEnabledPlugins().size());

        DependentPluginsEnabledException dependents = assertThrows(DependentPluginsEnabledException.class,
                () -> manager.disable("core"));
        assertEquals(List.of("payments"), dependents.getDependents());
        assertTrue(manager.getPlugin("core").isEnabled());

        manager.disable("payments");
        manager.disable("core");
        assertEquals(PluginStatus.DISABLED, manager.getPlugin("core").getStatus());
        assertTrue(manager.getEnabledPlugins().isEmpty());
    }

    @Test
    void enable_missingDependencyIsReported() {
        registerAndInitialize("reports", "analytics");

        DependencyNotEnabledException e = assertThrows(DependencyNotEnabledException.class, () -> manager.enable("reports"));
        assertEquals("analytics", e.getDependency());
    }

    @Test
    void enable_hookFailureLeavesStateAndStoreUnchanged() {
        RecordingPlugin plugin = registerAndInitialize("analytics");
        plugin.failOnEnable = true;

        assertThrows(IllegalStateException.class, () -> manager.enable("analytics"));

        assertEquals(PluginStatus.INITIALIZED, manager.getPlugin("analytics").getStatus());
        assertTrue(store.find("analytics").isEmpty());
        assertTrue(manager.getCapabilities(CapabilityKinds.ROUTE_NAME).isEmpty());
        assertFalse(events.contains("plugin.enabled:analytics"));
    }

    @Test
    void disable_hookFailureKeepsPluginEnabled() {
        RecordingPlugin plugin = registerAndInitialize("analytics");
        manager.enable("analytics");
        plugin.failOnDisable = true;

        assertThrows(IllegalStateException.class, () -> manager.disable("analytics"));

        assertTrue(manager.getPlugin("analytics").isEnabled());
        assertTrue(store.find("analytics").orElseThrow().isEnabled());
    }

    @Test
    void disable_fromInitialized_isInvalidTransition() {
        registerAndInitialize("analytics");

        assertThrows(InvalidTransitionException.class, () -> manager.disable("analytics"));
    }

    @Test
    void enable_storeFailureCompensatesHook() {
        PluginManager failing = PluginManager.builder().store(new FailingStore()).build();
        RecordingPlugin plugin = new RecordingPlugin("analytics");
        failing.register(plugin);
        failing.initialize("analytics");

        PluginPersistenceException e = assertThrows(PluginPersistenceException.class, () -> failing.enable("analytics"));

        assertEquals("analytics", e.getPluginName());
        assertEquals(List.of("initialize", "enable", "disable"), plugin.calls);
        assertEquals(PluginStatus.INITIALIZED, failing.getPlugin("analytics").getStatus());
    }

    @Test
    void enableAndDisable_persistDecisions() {
        manager.register(new RecordingPlugin("analytics"));
        manager.initialize("analytics", Map.of("api_key", "k-1"));

        manager.enable("analytics");
        PersistedPluginConfig enabled = store.find("analytics").orElseThrow();
        assertEquals(PersistedStatus.ENABLED, enabled.status());
        assertEquals("k-1", enabled.config().get("api_key"));

        manager.disable("analytics");
        PersistedPluginConfig disabled = store.find("analytics").orElseThrow();
        assertEquals(PersistedStatus.DISABLED, disabled.status());
        assertEquals(1, store.loadAll().size());
    }

    @Test
    void loadPersistedState_restoresEnabledPluginsInDependencyOrder() {
        registerAndInitialize("core");
        registerAndInitialize("payments", "core");
        manager.enable("core");
        manager.enable("payments");
        store.save("retired", PersistedStatus.ENABLED, Map.of());
        store.save("payments", PersistedStatus.ENABLED, Map.of("currency", "EUR"));

        PluginManager restarted = PluginManager.builder().store(store).build();
        RecordingPlugin payments = new RecordingPlugin("payments", "core");
        RecordingPlugin core = new RecordingPlugin("core");
        restarted.register(payments);
        restarted.register(core);
        restarted.initialize("payments", Map.of("currency", "USD", "mode", "test"));
        restarted.initialize("core");

        int restored = restarted.loadPersistedState();

        assertEquals(2, restored);
        assertTrue(restarted.getPlugin("core").isEnabled());
        assertTrue(restarted.getPlugin("payments").isEnabled());
        assertEquals("EUR", restarted.getPlugin("payments").getConfig().get("currency"));
        assertEquals("test", restarted.getPlugin("payments").getConfig().get("mode"));
        assertEquals("EUR", payments.getConfig("currency"));
    }

    @Test
    void loadPersistedState_skipsPluginsThatFailToEnable() {
        store.save("analytics", PersistedStatus.ENABLED, Map.of());
        store.save("reports", PersistedStatus.ENABLED, Map.of());
        store.save("archived", PersistedStatus.DISABLED, Map.of());
        RecordingPlugin analytics = registerAndInitialize("analytics");
        analytics.failOnEnable = true;
        registerAndInitialize("reports");
        registerAndInitialize("archived");

        assertEquals(1, manager.loadPersistedState());

        assertEquals(PluginStatus.INITIALIZED, manager.getPlugin("analytics").getStatus());
        assertTrue(manager.getPlugin("reports").isEnabled());
        assertEquals(PluginStatus.INITIALIZED, manager.getPlugin("archived").getStatus());
    }

    @Test
    void uninstall_enabledPluginRunsDisableAndKeepsPersistedRow() {
        RecordingPlugin plugin = registerAndInitialize("analytics");
        manager.enable("analytics");

        manager.uninstall("analytics");

        assertNull(manager.getPlugin("analytics"));
        assertEquals(1, plugin.count("disable"));
        assertTrue(store.find("analytics").isPresent());
        assertTrue(events.contains("plugin.uninstalled:analytics"));

        manager.register(new RecordingPlugin("analytics"));
        assertEquals(PluginStatus.DISCOVERED, manager.getPlugin("analytics").getStatus());
    }

    @Test
    void uninstall_refusesWhileEnabledDependentsExist() {
        registerAndInitialize("core");
        registerAndInitialize("payments", "core");
        manager.enable("core");
        manager.enable("payments");

        assertThrows(DependentPluginsEnabledException.class, () -> manager.uninstall("core"));
        assertTrue(manager.isRegistered("core"));
    }

    @Test
    void events_areDispatchedWithPluginName() {
        registerAndInitialize("analytics");
        manager.enable("analytics");
        manager.disable("analytics");

        assertEquals(List.of("plugin.registered:analytics", "plugin.initialized:analytics",
                "plugin.enabled:analytics", "plugin.disabled:analytics"), events);
    }

    @Test
    void events_listenerSeesCommittedStateAndMayCallManager() {
        registerAndInitialize("analytics");
        List<PluginStatus> seen = new ArrayList<>();
        manager.getEventDispatcher().addListener(PluginEvent.ENABLED,
                e -> seen.add(manager.getPlugin(e.getPluginName()).getStatus()));

        manager.enable("analytics");

        assertEquals(List.of(PluginStatus.ENABLED), seen);
    }

    @Test
    void capabilities_followEnabledMembership() {
        RecordingPlugin analytics = new RecordingPlugin("analytics");
        analytics.routes = "analytics-routes";
        manager.register(analytics);
        manager.initialize("analytics");
        registerAndInitialize("silent");

        manager.enable("analytics");
        manager.enable("silent");

        List<Capability<Object>> routes = manager.getCapabilities(CapabilityKinds.ROUTE);
        assertEquals(1, routes.size());
        assertEquals("analytics", routes.get(0).ownerName());
        assertEquals("analytics-routes", routes.get(0).artifact());
        assertEquals("/api/v1/plugins/analytics", routes.get(0).mountPrefix());

        manager.disable("analytics");
        assertTrue(manager.getCapabilities(CapabilityKinds.ROUTE).isEmpty());
        assertTrue(manager.getCapabilities("no-such-kind").isEmpty());
    }

    @Test
    void resolveOrder_reportsCycle() {
        registerAndInitialize("x", "y");
        registerAndInitialize("y", "x");

        CircularDependencyException e = assertThrows(CircularDependencyException.class, () -> manager.resolveOrder());
        assertTrue(e.getCycle().containsAll(List.of("x", "y")));
        assertThrows(DependencyNotEnabledException.class, () -> manager.enable("x"));
    }

    @Test
    void discover_registersInitializedAndSkipsDuplicatesAndFailures() {
        RecordingPlugin broken = new RecordingPlugin("broken");
        broken.failOnInitialize = true;
        DiscoverySource source = DiscoverySource.of(new RecordingPlugin("analytics"), broken);

        assertEquals(1, manager.discover(source));
        assertEquals(0, manager.discover(DiscoverySource.of(new RecordingPlugin("analytics"))));

        assertEquals(PluginStatus.INITIALIZED, manager.getPlugin("analytics").getStatus());
        assertNull(manager.getPlugin("broken"));
    }

    @Test
    void shutdown_disablesInReverseOrderWithoutPersisting() {
        List<String> disabled = new ArrayList<>();
        registerAndInitialize("core");
        registerAndInitialize("payments", "core");
        manager.enable("core");
        manager.enable("payments");
        manager.getEventDispatcher().addListener(PluginEvent.DISABLED, e -> disabled.add(e.getPluginName()));

        assertEquals(2, manager.shutdown());

        assertEquals(List.of("payments", "core"), disabled);
        assertTrue(manager.getEnabledPlugins().isEmpty());
        assertTrue(store.find("core").orElseThrow().isEnabled());
        assertTrue(store.find("payments").orElseThrow().isEnabled());
    }

    @Test
    void concurrentEnable_runsHookOnce() throws Exception {
        RecordingPlugin plugin = registerAndInitialize("analytics");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    manager.enable("analytics");
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, plugin.count("enable"));
        assertSame(PluginStatus.ENABLED, manager.getPlugin("analytics").getStatus());
    }

    private static final class FailingStore implements PluginConfigStore {
        @Override
        public void save(String pluginName, PersistedStatus status, Map<String, Object> config) {
            throw new IllegalStateException("database unavailable");
        }

        @Override
        public List<PersistedPluginConfig> loadEnabled() {
            return List.of();
        }

        @Override
        public Optional<PersistedPluginConfig> find(String pluginName) {
            return Optional.empty();
        }

        @Override
        public List<PersistedPluginConfig> loadAll() {
            return List.of();
        }

        @Override
        public boolean delete(String pluginName) {
            return false;
        }
    }
}
