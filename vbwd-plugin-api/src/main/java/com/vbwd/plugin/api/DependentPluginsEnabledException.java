package com.vbwd.plugin.api;

import java.util.List;

/**
 * Thrown by disable or uninstall while other enabled plugins still depend on the plugin.
 */
public final class DependentPluginsEnabledException extends PluginException {

    private final List<String> dependents;

    public DependentPluginsEnabledException(String pluginName, List<String> dependents) {
        super(pluginName, "Cannot disable '" + pluginName + "': plugins " + dependents + " depend on it");
        this.dependents = List.copyOf(dependents);
    }

    public List<String> getDependents() {
        return dependents;
    }
}
