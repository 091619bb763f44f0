package com.vbwd.plugin.core;

import com.vbwd.plugin.api.InvalidTransitionException;
import com.vbwd.plugin.api.PluginStatus;

/**
 * Guards lifecycle moves with the transition table of {@link PluginStatus}.
 */
final class PluginLifecycle {

    private PluginLifecycle() {
    }

    /**
     * @throws InvalidTransitionException if {@code from → to} is not a legal transition
     */
    static void requireTransition(String pluginName, PluginStatus from, PluginStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new InvalidTransitionException(pluginName, from, to);
        }
    }

    /** True when an operation targeting {@code to} is already satisfied (idempotent enable/disable). */
    static boolean isNoOp(PluginStatus current, PluginStatus to) {
        return current == to && (to == PluginStatus.ENABLED || to == PluginStatus.DISABLED);
    }
}
