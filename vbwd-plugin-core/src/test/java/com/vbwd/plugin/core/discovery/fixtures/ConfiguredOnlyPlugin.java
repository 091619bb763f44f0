package com.vbwd.plugin.core.discovery.fixtures;

import com.vbwd.plugin.api.AbstractPlugin;
import com.vbwd.plugin.api.PluginMetadata;

/** No public no-arg constructor. */
public class ConfiguredOnlyPlugin extends AbstractPlugin {

    private final String name;

    public ConfiguredOnlyPlugin(String name) {
        this.name = name;
    }

    @Override
    public PluginMetadata getMetadata() {
        return PluginMetadata.of(name, "1.0.0");
    }
}
