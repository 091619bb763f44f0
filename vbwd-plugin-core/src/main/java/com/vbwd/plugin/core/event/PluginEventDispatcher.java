package com.vbwd.plugin.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dispatches events to listeners registered by event name. Listeners run in {@link EventPriority} order,
 * then in registration order. A listener that throws is logged and the remaining listeners still run.
 */
public final class PluginEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PluginEventDispatcher.class);

    private static final Comparator<Registration> ORDER =
            Comparator.comparingInt((Registration r) -> r.priority.getOrder()).thenComparingLong(r -> r.sequence);

    private final Map<String, List<Registration>> listenersByEvent = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public void addListener(String eventName, PluginEventListener listener) {
        addListener(eventName, listener, EventPriority.NORMAL);
    }

    public void addListener(String eventName, PluginEventListener listener, EventPriority priority) {
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(listener, "listener");
        Registration r = new Registration(listener, priority != null ? priority : EventPriority.NORMAL,
                sequence.incrementAndGet());
        listenersByEvent.computeIfAbsent(eventName, k -> new CopyOnWriteArrayList<>()).add(r);
    }

    public void removeListener(String eventName, PluginEventListener listener) {
        List<Registration> list = listenersByEvent.get(eventName);
        if (list != null) {
            list.removeIf(r -> r.listener == listener);
        }
    }

    public boolean hasListeners(String eventName) {
        List<Registration> list = listenersByEvent.get(eventName);
        return list != null && !list.isEmpty();
    }

    /** Listeners for the event in dispatch order. */
    public List<PluginEventListener> getListeners(String eventName) {
        List<PluginEventListener> out = new ArrayList<>();
        for (Registration r : ordered(eventName)) {
            out.add(r.listener);
        }
        return out;
    }

    /**
     * Dispatches the event to its listeners and returns it (listeners may have stopped propagation).
     * Once propagation is stopped only {@link EventPriority#MONITOR} listeners still run.
     */
    public PluginEvent dispatch(PluginEvent event) {
        Objects.requireNonNull(event, "event");
        for (Registration r : ordered(event.getName())) {
            if (event.isPropagationStopped() && r.priority != EventPriority.MONITOR) {
                continue;
            }
            try {
                r.listener.onEvent(event);
            } catch (Exception e) {
                log.error("Event listener failed for {} (continuing with remaining listeners): {}",
                        event.getName(), e.getMessage(), e);
            }
        }
        return event;
    }

    private List<Registration> ordered(String eventName) {
        List<Registration> list = listenersByEvent.get(eventName);
        if (list == null || list.isEmpty()) return List.of();
        List<Registration> copy = new ArrayList<>(list);
        copy.sort(ORDER);
        return copy;
    }

    private record Registration(PluginEventListener listener, EventPriority priority, long sequence) {
    }
}
