package com.vbwd.config;

import java.util.Locale;

/**
 * Backend for persisted plugin state (VBWD_PLUGIN_STORE).
 */
public enum PluginStoreType {
    /** Nothing is persisted; every start begins from the default-enable policy. */
    NONE,
    /** Process-local; survives manager re-creation, not restarts. */
    MEMORY,
    /** JSON flat file (VBWD_PLUGIN_STATE_FILE). */
    FILE,
    /** Relational database table. */
    JDBC,
    /** Redis keys under VBWD_PLUGIN_KEY_PREFIX. */
    REDIS;

    /** Case-insensitive parse; null, blank or unknown values give {@code defaultValue}. */
    public static PluginStoreType parse(String value, PluginStoreType defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }
}
