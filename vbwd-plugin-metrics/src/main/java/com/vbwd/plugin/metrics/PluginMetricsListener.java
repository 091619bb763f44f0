package com.vbwd.plugin.metrics;

import com.vbwd.plugin.core.PluginManager;
import com.vbwd.plugin.core.event.EventPriority;
import com.vbwd.plugin.core.event.PluginEvent;
import com.vbwd.plugin.core.event.PluginEventDispatcher;
import com.vbwd.plugin.core.event.PluginEventListener;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Records plugin lifecycle metrics from manager events:
 * <ul>
 *   <li>{@value #TRANSITIONS} counter tagged {@code plugin} and {@code event}</li>
 *   <li>{@value #ENABLED_GAUGE} gauge of currently enabled plugins</li>
 * </ul>
 * Runs at {@link EventPriority#MONITOR}: after host listeners, and also when one of them stopped propagation.
 */
public final class PluginMetricsListener implements PluginEventListener {

    private static final Logger log = LoggerFactory.getLogger(PluginMetricsListener.class);

    public static final String TRANSITIONS = "vbwd.plugin.transitions";
    public static final String ENABLED_GAUGE = "vbwd.plugins.enabled";

    static final List<String> LIFECYCLE_EVENTS = List.of(PluginEvent.REGISTERED, PluginEvent.INITIALIZED,
            PluginEvent.ENABLED, PluginEvent.DISABLED, PluginEvent.UNINSTALLED);

    private final MeterRegistry registry;

    private PluginMetricsListener(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers the enabled gauge for the manager and subscribes a listener to its lifecycle events.
     */
    public static PluginMetricsListener register(MeterRegistry registry, PluginManager manager) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(manager, "manager");
        PluginMetricsListener listener = new PluginMetricsListener(registry);
        Gauge.builder(ENABLED_GAUGE, manager, m -> m.getEnabledPlugins().size())
                .description("Plugins currently enabled")
                .register(registry);
        PluginEventDispatcher dispatcher = manager.getEventDispatcher();
        for (String event : LIFECYCLE_EVENTS) {
            dispatcher.addListener(event, listener, EventPriority.MONITOR);
        }
        log.debug("Plugin metrics registered on {}", registry.getClass().getSimpleName());
        return listener;
    }

    @Override
    public void onEvent(PluginEvent event) {
        String plugin = event.getPluginName();
        registry.counter(TRANSITIONS,
                "plugin", plugin != null && !plugin.isBlank() ? plugin : "unknown",
                "event", event.getName()
        ).increment();
    }
}
