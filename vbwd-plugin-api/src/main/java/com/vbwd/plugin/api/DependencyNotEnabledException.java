package com.vbwd.plugin.api;

/**
 * Thrown by enable when a declared dependency is missing or not {@link PluginStatus#ENABLED}.
 */
public final class DependencyNotEnabledException extends PluginException {

    private final String dependency;

    public DependencyNotEnabledException(String pluginName, String dependency) {
        super(pluginName, "Dependency '" + dependency + "' of plugin '" + pluginName + "' not enabled");
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
