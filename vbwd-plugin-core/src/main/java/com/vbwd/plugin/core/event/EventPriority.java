package com.vbwd.plugin.core.event;

/**
 * Listener priority; listeners with a lower {@link #getOrder()} run first. {@link #MONITOR} listeners run
 * after all others and even when propagation was stopped; they observe the event and must not change it.
 */
public enum EventPriority {
    HIGHEST(1),
    HIGH(2),
    NORMAL(3),
    LOW(4),
    LOWEST(5),
    MONITOR(6);

    private final int order;

    EventPriority(int order) {
        this.order = order;
    }

    public int getOrder() {
        return order;
    }
}
