package com.vbwd.plugin.api;

/**
 * Lifecycle states of a registered plugin.
 * <pre>
 * DISCOVERED → INITIALIZED → ENABLED ⇄ DISABLED
 *      └────────────┴───────────┴─────────┴──→ UNINSTALLED (terminal)
 * </pre>
 */
public enum PluginStatus {

    /** Registered and contract validated; setup has not run. */
    DISCOVERED,
    /** One-time setup ran and config was accepted; capabilities are not live. */
    INITIALIZED,
    /** {@code onEnable} ran; capabilities are live. */
    ENABLED,
    /** {@code onDisable} ran; capabilities withdrawn. */
    DISABLED,
    /** Removed from the registry; the name may be registered again. */
    UNINSTALLED;

    /**
     * Whether moving from this state to {@code target} is a legal lifecycle transition.
     * Staying in the same state is not a transition and returns false.
     */
    public boolean canTransitionTo(PluginStatus target) {
        if (target == null || target == this) return false;
        switch (this) {
            case DISCOVERED:
                return target == INITIALIZED || target == UNINSTALLED;
            case INITIALIZED:
                return target == ENABLED || target == UNINSTALLED;
            case ENABLED:
                return target == DISABLED || target == UNINSTALLED;
            case DISABLED:
                return target == ENABLED || target == UNINSTALLED;
            default:
                return false;
        }
    }

    public boolean isTerminal() {
        return this == UNINSTALLED;
    }
}
