package com.vbwd.plugin.core.discovery;

import com.vbwd.plugin.api.Plugin;

import java.util.List;

/**
 * Produces plugin instances for the manager to register. How instances are found (directory of JARs,
 * ServiceLoader, a fixed list) is the source's concern; failures of individual modules must be logged and
 * skipped, never thrown, so one broken module cannot stop the rest from loading.
 */
@FunctionalInterface
public interface DiscoverySource {

    /**
     * @return newly constructed plugins, in a deterministic order; never null
     */
    List<Plugin> loadPlugins();

    /** Source returning the given instances (e.g. plugins constructed by the host). */
    static DiscoverySource of(Plugin... plugins) {
        List<Plugin> list = List.of(plugins);
        return () -> list;
    }
}
