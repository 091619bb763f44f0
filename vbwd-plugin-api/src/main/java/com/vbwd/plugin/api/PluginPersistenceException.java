package com.vbwd.plugin.api;

/**
 * Thrown when the plugin state store cannot read or write persisted plugin state.
 */
public final class PluginPersistenceException extends PluginException {

    public PluginPersistenceException(String pluginName, String message, Throwable cause) {
        super(pluginName, message, cause);
    }
}
