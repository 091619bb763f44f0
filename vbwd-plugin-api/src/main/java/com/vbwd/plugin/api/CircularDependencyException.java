package com.vbwd.plugin.api;

import java.util.List;

/**
 * Thrown when plugin dependencies form a cycle and no load order exists.
 */
public final class CircularDependencyException extends PluginException {

    private final List<String> cycle;

    /**
     * @param cycle the cycle path, first plugin repeated at the end (e.g. {@code [a, b, a]})
     */
    public CircularDependencyException(List<String> cycle) {
        super(cycle.isEmpty() ? null : cycle.get(0), "Circular plugin dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
