package com.vbwd.plugin.core;

import com.vbwd.plugin.api.Plugin;
import com.vbwd.plugin.api.PluginMetadata;
import com.vbwd.plugin.api.PluginStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A registered plugin as owned by {@link PluginManager}: the plugin object plus its lifecycle status and
 * configuration. Only the manager changes status and config; callers get a read-only view.
 */
public final class PluginInstance {

    private final Plugin plugin;
    private final PluginMetadata metadata;
    private final long registrationSequence;
    private volatile PluginStatus status;
    private volatile Map<String, Object> config;
    private volatile Instant statusChangedAt;

    PluginInstance(Plugin plugin, PluginMetadata metadata, long registrationSequence, Instant registeredAt) {
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.registrationSequence = registrationSequence;
        this.status = PluginStatus.DISCOVERED;
        this.config = Map.of();
        this.statusChangedAt = registeredAt;
    }

    public String getName() {
        return metadata.name();
    }

    public Plugin getPlugin() {
        return plugin;
    }

    /** Metadata captured at registration. */
    public PluginMetadata getMetadata() {
        return metadata;
    }

    public PluginStatus getStatus() {
        return status;
    }

    public boolean isEnabled() {
        return status == PluginStatus.ENABLED;
    }

    /** Current configuration; unmodifiable, never null. */
    public Map<String, Object> getConfig() {
        return config;
    }

    /** Time of the last status change (registration time while DISCOVERED). */
    public Instant getStatusChangedAt() {
        return statusChangedAt;
    }

    /** Monotonic registration order within the owning manager; breaks ordering ties. */
    public long getRegistrationSequence() {
        return registrationSequence;
    }

    void setStatus(PluginStatus status, Instant at) {
        this.status = status;
        this.statusChangedAt = at;
    }

    void setConfig(Map<String, Object> config) {
        this.config = immutableCopy(config);
    }

    static Map<String, Object> immutableCopy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (base != null) merged.putAll(base);
        if (overrides != null) merged.putAll(overrides);
        return immutableCopy(merged);
    }

    @Override
    public String toString() {
        return "PluginInstance{" + getName() + " v" + metadata.version() + ", " + status + "}";
    }
}
