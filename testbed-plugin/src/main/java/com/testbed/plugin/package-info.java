/**
 * Step method plugins and their registry.
 * <ul>
 *   <li>{@link com.testbed.plugin.Plugin} – one configured phase bound to a step through {@link com.testbed.plugin.StepContext}</li>
 *   <li>{@link com.testbed.plugin.PluginProvider} – SPI creating phases for one {@code (step, how)} method</li>
 *   <li>{@link com.testbed.plugin.PluginRegistry} – process-wide method registry; {@code delegate} resolves a record to a phase</li>
 *   <li>{@link com.testbed.plugin.PluginManager} – built-in providers plus community jars</li>
 * </ul>
 */
package com.testbed.plugin;
