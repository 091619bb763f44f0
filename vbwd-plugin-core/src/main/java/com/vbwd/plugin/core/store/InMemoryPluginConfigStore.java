package com.vbwd.plugin.core.store;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local store. State survives manager re-creation within the JVM (useful for tests and
 * hot-reload), not restarts.
 */
public final class InMemoryPluginConfigStore implements PluginConfigStore {

    private final Map<String, PersistedPluginConfig> rows = new ConcurrentSkipListMap<>();
    private final Clock clock;

    public InMemoryPluginConfigStore() {
        this(Clock.systemUTC());
    }

    public InMemoryPluginConfigStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void save(String pluginName, PersistedStatus status, Map<String, Object> config) {
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(status, "status");
        rows.compute(pluginName, (name, existing) -> existing == null
                ? PersistedPluginConfig.created(name, status, config, clock.instant())
                : existing.updated(status, config, clock.instant()));
    }

    @Override
    public List<PersistedPluginConfig> loadEnabled() {
        List<PersistedPluginConfig> out = new ArrayList<>();
        for (PersistedPluginConfig row : rows.values()) {
            if (row.isEnabled()) out.add(row);
        }
        return out;
    }

    @Override
    public Optional<PersistedPluginConfig> find(String pluginName) {
        return pluginName == null ? Optional.empty() : Optional.ofNullable(rows.get(pluginName));
    }

    @Override
    public List<PersistedPluginConfig> loadAll() {
        return new ArrayList<>(rows.values());
    }

    @Override
    public boolean delete(String pluginName) {
        return pluginName != null && rows.remove(pluginName) != null;
    }
}
