package com.testbed.plugin;

import com.testbed.config.StepData;

/**
 * SPI for step methods. Built-in providers are registered explicitly; community providers are
 * discovered via {@link java.util.ServiceLoader} (META-INF/services/com.testbed.plugin.PluginProvider)
 * from jars in the plugins directory. Every enabled provider is registered once at process start
 * in {@link PluginRegistry}.
 */
public interface PluginProvider {

    /** Step this method belongs to, e.g. {@code execute}. */
    String getStepName();

    /** Method name matched against the {@code how} of a step record, e.g. {@code tmt}. */
    String getMethodName();

    /** One-line description shown when listing methods. */
    String getDescription();

    /** Resolution order for prefix matches; lower wins. */
    default int getOrder() {
        return Method.DEFAULT_ORDER;
    }

    default Method getMethod() {
        return new Method(getStepName(), getMethodName(), getDescription(), getOrder());
    }

    /**
     * Creates a new phase bound to the step from one configuration record. Called once per
     * record when the step wakes up.
     *
     * @param step step the phase belongs to
     * @param data configuration record; {@code how} already resolved to this method
     * @return new plugin instance
     */
    Plugin<?> createPlugin(StepContext step, StepData data);

    /** Provider version for audit. */
    default String getVersion() {
        return "1.0";
    }

    /** Whether this provider should be registered. Override to skip optional methods. */
    default boolean isEnabled() {
        return true;
    }
}
