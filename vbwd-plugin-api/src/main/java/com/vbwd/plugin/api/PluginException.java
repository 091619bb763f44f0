package com.vbwd.plugin.api;

/**
 * Base type of every error raised by the plugin manager. All subtypes are unchecked; operations that
 * throw them leave the registry unchanged.
 */
public class PluginException extends RuntimeException {

    private final String pluginName;

    public PluginException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public PluginException(String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
    }

    /** Plugin the error refers to; null when not specific to one plugin. */
    public String getPluginName() {
        return pluginName;
    }
}
