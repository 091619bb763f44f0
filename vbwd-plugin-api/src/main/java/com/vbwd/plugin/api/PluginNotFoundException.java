package com.vbwd.plugin.api;

/**
 * Thrown when an operation names a plugin that is not registered.
 */
public final class PluginNotFoundException extends PluginException {

    public PluginNotFoundException(String pluginName) {
        super(pluginName, "Plugin '" + pluginName + "' not found");
    }
}
