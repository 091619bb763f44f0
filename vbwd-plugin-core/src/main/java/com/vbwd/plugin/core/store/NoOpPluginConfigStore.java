package com.vbwd.plugin.core.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store used when no durable backing is configured: saves nothing and reports that nothing was ever
 * enabled, so the manager runs purely in memory.
 */
public final class NoOpPluginConfigStore implements PluginConfigStore {

    public static final NoOpPluginConfigStore INSTANCE = new NoOpPluginConfigStore();

    @Override
    public void save(String pluginName, PersistedStatus status, Map<String, Object> config) {
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
