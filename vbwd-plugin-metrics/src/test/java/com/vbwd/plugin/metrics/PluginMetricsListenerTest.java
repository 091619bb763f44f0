package com.vbwd.plugin.metrics;

import com.vbwd.plugin.api.Plugin;
import com.vbwd.plugin.api.PluginMetadata;
import com.vbwd.plugin.core.PluginManager;
import com.vbwd.plugin.core.event.EventPriority;
import com.vbwd.plugin.core.event.PluginEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PluginMetricsListenerTest {

    @Test
    void recordsTransitionsAndEnabledGauge() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PluginManager manager = new PluginManager();
        PluginMetricsListener.register(registry, manager);
        Plugin analytics = () -> PluginMetadata.of("analytics", "1.0.0");

        manager.register(analytics);
        manager.initialize("analytics");
        manager.enable("analytics");

        assertEquals(1.0, registry.get(PluginMetricsListener.ENABLED_GAUGE).gauge().value());
        assertEquals(1.0, registry.get(PluginMetricsListener.TRANSITIONS)
                .tags("plugin", "analytics", "event", "plugin.enabled").counter().count());

        manager.disable("analytics");
        manager.enable("analytics");

        assertEquals(2.0, registry.get(PluginMetricsListener.TRANSITIONS)
                .tags("plugin", "analytics", "event", "plugin.enabled").counter().count());
        assertEquals(1.0, registry.get(PluginMetricsListener.TRANSITIONS)
                .tags("plugin", "analytics", "event", "plugin.disabled").counter().count());

        manager.shutdown();
        assertEquals(0.0, registry.get(PluginMetricsListener.ENABLED_GAUGE).gauge().value());
    }

    @Test
    void countsTransitionsEvenWhenHostListenerStopsPropagation() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PluginManager manager = new PluginManager();
        PluginMetricsListener.register(registry, manager);
        manager.getEventDispatcher().addListener(PluginEvent.ENABLED, PluginEvent::stopPropagation, EventPriority.LOWEST);

        manager.register(() -> PluginMetadata.of("analytics", "1.0.0"));
        manager.initialize("analytics");
        manager.enable("analytics");

        assertEquals(1.0, registry.get(PluginMetricsListener.TRANSITIONS)
                .tags("plugin", "analytics", "event", "plugin.enabled").counter().count());
    }
}
