package com.vbwd.plugin.api;

/**
 * Thrown when a plugin is registered under a name that is already registered.
 */
public final class DuplicatePluginException extends PluginException {

    public DuplicatePluginException(String pluginName) {
        super(pluginName, "Plugin '" + pluginName + "' already registered");
    }
}
