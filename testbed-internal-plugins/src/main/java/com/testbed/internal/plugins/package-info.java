/**
 * Built-in step methods and the community plugin directory, combined into one
 * {@link com.testbed.plugin.PluginManager}.
 */
package com.testbed.internal.plugins;
