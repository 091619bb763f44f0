package com.vbwd.plugin.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Convenience base for plugins: keeps the configuration handed to the lifecycle hooks and exposes typed
 * lookups. Subclasses override {@link #onEnable(Map)} and {@link #onDisable()} as needed but should call
 * {@code super.onEnable(config)} so {@link #getConfig(String)} sees the enable-time configuration.
 * <p>
 * Abstract, so directory discovery never instantiates it.
 */
public abstract class AbstractPlugin implements Plugin {

    private volatile Map<String, Object> config = Map.of();

    @Override
    public void onInitialize(Map<String, Object> config) {
        this.config = copy(config);
    }

    @Override
    public void onEnable(Map<String, Object> config) {
        this.config = copy(config);
    }

    /** Returns the configuration value for the key, or null. */
    public Object getConfig(String key) {
        return config.get(key);
    }

    /** Returns the configuration value for the key, or {@code defaultValue} when absent. */
    public Object getConfig(String key, Object defaultValue) {
        Object v = config.get(key);
        return v != null ? v : defaultValue;
    }

    /** Boolean view of a config value: accepts Boolean, "true"/"false" and "1". */
    public boolean getConfigBoolean(String key, boolean defaultValue) {
        Object v = config.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Boolean b) return b;
        String s = v.toString().trim();
        return "true".equalsIgnoreCase(s) || "1".equals(s);
    }

    /** Snapshot of the current configuration. */
    public Map<String, Object> getConfigMap() {
        return config;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
