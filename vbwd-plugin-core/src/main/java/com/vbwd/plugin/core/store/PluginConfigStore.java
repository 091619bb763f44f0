package com.vbwd.plugin.core.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of which plugins are enabled and their last-known configuration. The plugin manager
 * only needs {@link #save} and {@link #loadEnabled}; the remaining operations serve administration.
 * Implementations throw {@link com.vbwd.plugin.api.PluginPersistenceException} on storage failure.
 */
public interface PluginConfigStore {

    /**
     * Inserts or updates the row for {@code pluginName}, stamping enabled_at or disabled_at by status.
     * Never creates a second row for the same name.
     */
    void save(String pluginName, PersistedStatus status, Map<String, Object> config);

    /** All rows currently marked enabled. */
    List<PersistedPluginConfig> loadEnabled();

    /** Row for the plugin, if any. */
    Optional<PersistedPluginConfig> find(String pluginName);

    /** All rows, ordered by plugin name. */
    List<PersistedPluginConfig> loadAll();

    /**
     * Deletes the row for the plugin (explicit administrative action).
     *
     * @return true if a row was deleted
     */
    boolean delete(String pluginName);
}
