package com.vbwd.plugin.core.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Durable enable/disable decision and last-known configuration of one plugin. One row per plugin name;
 * saves update the row in place.
 *
 * @param pluginName unique plugin name
 * @param status     last saved decision
 * @param config     opaque configuration blob (JSON-compatible values); never null
 * @param enabledAt  time of the last save with {@link PersistedStatus#ENABLED}; null if never enabled
 * @param disabledAt time of the last save with {@link PersistedStatus#DISABLED}; null if never disabled
 * @param updatedAt  time of the last save
 */
public record PersistedPluginConfig(String pluginName, PersistedStatus status, Map<String, Object> config,
                                    Instant enabledAt, Instant disabledAt, Instant updatedAt) {

    public PersistedPluginConfig {
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(status, "status");
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public boolean isEnabled() {
        return status == PersistedStatus.ENABLED;
    }

    /**
     * Returns the row as it looks after a save with the given status and config at {@code now}:
     * the matching timestamp is stamped, the other one is kept.
     */
    public PersistedPluginConfig updated(PersistedStatus newStatus, Map<String, Object> newConfig, Instant now) {
        return stamp(pluginName, newStatus, newConfig, enabledAt, disabledAt, now);
    }

    /** First save for a plugin name. */
    public static PersistedPluginConfig created(String pluginName, PersistedStatus status,
                                                Map<String, Object> config, Instant now) {
        return stamp(pluginName, status, config, null, null, now);
    }

    private static PersistedPluginConfig stamp(String name, PersistedStatus status, Map<String, Object> config,
                                               Instant enabledAt, Instant disabledAt, Instant now) {
        Objects.requireNonNull(status, "status");
        Instant en = status == PersistedStatus.ENABLED ? now : enabledAt;
        Instant dis = status == PersistedStatus.DISABLED ? now : disabledAt;
        return new PersistedPluginConfig(name, status, config, en, dis, now);
    }
}
