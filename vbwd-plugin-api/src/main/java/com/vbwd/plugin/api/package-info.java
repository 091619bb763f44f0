/**
 * Plugin contract shared by the host and every extension module.
 * <ul>
 *   <li>{@link com.vbwd.plugin.api.Plugin} – lifecycle hooks and optional capability methods</li>
 *   <li>{@link com.vbwd.plugin.api.AbstractPlugin} – base class keeping hook configuration</li>
 *   <li>{@link com.vbwd.plugin.api.PluginMetadata} – name, version, author, description, dependencies</li>
 *   <li>{@link com.vbwd.plugin.api.PluginStatus} – lifecycle states and legal transitions</li>
 *   <li>{@link com.vbwd.plugin.api.PluginException} and subtypes – manager errors</li>
 * </ul>
 * Community plugin JARs are loaded with a restricted parent classloader that exposes this package
 * (and the JDK, SLF4J, Jackson) only.
 */
package com.vbwd.plugin.api;
