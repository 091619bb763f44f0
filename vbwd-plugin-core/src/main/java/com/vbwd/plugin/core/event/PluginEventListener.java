package com.vbwd.plugin.core.event;

/**
 * Callback for {@link PluginEvent}s.
 */
@FunctionalInterface
public interface PluginEventListener {

    void onEvent(PluginEvent event);
}
