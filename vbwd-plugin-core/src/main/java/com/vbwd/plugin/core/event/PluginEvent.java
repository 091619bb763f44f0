package com.vbwd.plugin.core.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Notification dispatched by the plugin manager. {@link #getData()} always carries
 * {@value #KEY_PLUGIN_NAME} for lifecycle events.
 */
public final class PluginEvent {

    public static final String REGISTERED = "plugin.registered";
    public static final String INITIALIZED = "plugin.initialized";
    public static final String ENABLED = "plugin.enabled";
    public static final String DISABLED = "plugin.disabled";
    public static final String UNINSTALLED = "plugin.uninstalled";

    public static final String KEY_PLUGIN_NAME = "plugin_name";

    private final String name;
    private final Map<String, Object> data;
    private volatile boolean propagationStopped;

    public PluginEvent(String name, Map<String, Object> data) {
        this.name = Objects.requireNonNull(name, "name");
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    /** Lifecycle event for one plugin. */
    public static PluginEvent of(String name, String pluginName) {
        return new PluginEvent(name, Map.of(KEY_PLUGIN_NAME, pluginName));
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getData() {
        return data;
    }

    /** Plugin name carried by lifecycle events; null for custom events without one. */
    public String getPluginName() {
        Object v = data.get(KEY_PLUGIN_NAME);
        return v != null ? v.toString() : null;
    }

    /** Remaining listeners are skipped once a listener calls this. */
    public void stopPropagation() {
        propagationStopped = true;
    }

    public boolean isPropagationStopped() {
        return propagationStopped;
    }

    @Override
    public String toString() {
        return "PluginEvent{" + name + ", " + data + "}";
    }
}
