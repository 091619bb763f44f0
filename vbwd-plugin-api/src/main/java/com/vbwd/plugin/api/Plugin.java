package com.vbwd.plugin.api;

import java.util.Locale;
import java.util.Map;

/**
 * Contract implemented by every extension module. The host never talks to a plugin directly; the plugin
 * manager invokes the hooks below while driving the lifecycle and pulls capabilities from enabled plugins.
 * <p>
 * Capability methods are optional: each defaults to {@code null} ("no capability"), so a plugin that
 * offers no routes is not forced to implement routing. New capability kinds are added with new default
 * methods and never break existing implementations.
 * <p>
 * Implementations discovered from a plugins directory need a public no-arg constructor and may only
 * link against {@code com.vbwd.plugin.api}, the JDK, SLF4J and Jackson.
 */
public interface Plugin {

    /**
     * Immutable identity of this plugin. Must return the same value for the lifetime of the instance.
     */
    PluginMetadata getMetadata();

    /**
     * One-time setup, called when the plugin moves from {@link PluginStatus#DISCOVERED} to
     * {@link PluginStatus#INITIALIZED}. Throwing aborts the transition.
     *
     * @param config unmodifiable configuration; never null
     */
    default void onInitialize(Map<String, Object> config) {
    }

    /**
     * Called exactly once per transition into {@link PluginStatus#ENABLED}. Throwing aborts the transition.
     *
     * @param config unmodifiable configuration (initial config merged with persisted config); never null
     */
    default void onEnable(Map<String, Object> config) {
    }

    /**
     * Called exactly once per transition out of {@link PluginStatus#ENABLED}. Throwing aborts the transition.
     */
    default void onDisable() {
    }

    /** Request-routing handle to mount under the plugin's route prefix (framework specific), or null. */
    default Object getRoutableHandle() {
        return null;
    }

    /** Localized text bundles (locale → key → text), or null. */
    default Map<Locale, Map<String, String>> getTranslations() {
        return null;
    }

    /** UI-mountable unit (framework specific), or null. */
    default Object getUiComponent() {
        return null;
    }
}
