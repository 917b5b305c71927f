package com.testbed.bootstrap;

import com.testbed.config.TestbedConfig;
import com.testbed.plugin.Method;
import com.testbed.plugin.PluginRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Wrapper object returned from bootstrap. Holds the environment-derived configuration, the
 * populated method registry and the methods registered by this bootstrap.
 */
public final class BootstrapContext {

    private final TestbedConfig config;
    private final PluginRegistry registry;
    private final List<Method> registeredMethods;

    BootstrapContext(TestbedConfig config, PluginRegistry registry, List<Method> registeredMethods) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.registeredMethods = registeredMethods != null ? List.copyOf(registeredMethods) : List.of();
    }

    public TestbedConfig getConfig() {
        return config;
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    /** Methods registered during bootstrap, internal first. */
    public List<Method> getRegisteredMethods() {
        return registeredMethods;
    }
}
