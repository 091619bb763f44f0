package com.vbwd.plugin.api;

/**
 * Thrown when a lifecycle operation is not legal from the plugin's current state.
 */
public final class InvalidTransitionException extends PluginException {

    private final PluginStatus from;
    private final PluginStatus to;

    public InvalidTransitionException(String pluginName, PluginStatus from, PluginStatus to) {
        super(pluginName, "Cannot move plugin '" + pluginName + "' from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public PluginStatus getFrom() {
        return from;
    }

    public PluginStatus getTo() {
        return to;
    }
}
