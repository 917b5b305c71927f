package com.testbed.bootstrap;

import com.testbed.config.TestbedConfig;
import com.testbed.internal.plugins.InternalPlugins;
import com.testbed.plugin.Method;
import com.testbed.plugin.PluginManager;
import com.testbed.plugin.PluginProvider;
import com.testbed.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Process start-up: loads configuration and registers every enabled step method once in the
 * registry. A built-in method that cannot be registered is fatal; a community method is logged
 * and skipped.
 */
public final class TestbedBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TestbedBootstrap.class);

    private TestbedBootstrap() {
    }

    /** Bootstrap from environment variables into the process-wide registry. */
    public static BootstrapContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(TestbedConfig.fromEnvironment(), PluginRegistry.getInstance());
    }

    public static BootstrapContext initialize(TestbedConfig config, PluginRegistry registry) {
        log.info("Bootstrap: {}", config);
        PluginManager pluginManager = InternalPlugins.createPluginManager(config);
        List<Method> registered = new ArrayList<>();
        for (PluginProvider provider : pluginManager.getInternalProviders()) {
            if (!provider.isEnabled()) continue;
            registry.register(provider);
            registered.add(provider.getMethod());
            log.info("Registered method {}/{} (version={})",
                    provider.getStepName(), provider.getMethodName(), provider.getVersion());
        }
        for (PluginProvider provider : pluginManager.getCommunityProviders()) {
            try {
                if (!provider.isEnabled()) continue;
                registry.register(provider);
                registered.add(provider.getMethod());
                log.info("Registered community method {}/{} (version={}, jar={})",
                        provider.getStepName(), provider.getMethodName(), provider.getVersion(),
                        pluginManager.getSource(provider));
            } catch (Exception e) {
                log.error("Community method failed to register (skipping): provider={}, error={}",
                        provider.getClass().getName(), e.getMessage(), e);
            }
        }
        if (registered.isEmpty()) {
            log.warn("No step methods registered; check TESTBED_PLUGINS_DIR for community jars");
        }
        return new BootstrapContext(config, registry, registered);
    }
}
