/**
 * Plugin host runtime: {@link com.vbwd.plugin.core.PluginManager} owns the registry and lifecycle,
 * {@link com.vbwd.plugin.core.DependencyResolver} computes load order and
 * {@link com.vbwd.plugin.core.CapabilityCollector} gathers routes, translations and UI units from
 * enabled plugins. Discovery sources live in {@code discovery}, lifecycle events in {@code event} and the
 * persistence contract in {@code store}.
 */
package com.vbwd.plugin.core;
