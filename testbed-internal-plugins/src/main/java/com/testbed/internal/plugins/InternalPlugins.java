package com.testbed.internal.plugins;

import com.testbed.config.TestbedConfig;
import com.testbed.execute.internal.InternalExecutorProvider;
import com.testbed.plugin.PluginManager;
import com.testbed.report.display.DisplayReportProvider;
import com.testbed.report.junit.JUnitReportProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Plugin-side bootstrap: creates a {@link PluginManager} with the built-in step methods
 * registered and community methods loaded from the configured plugins directory. Callers
 * register the returned providers with {@link com.testbed.plugin.PluginRegistry}.
 */
public final class InternalPlugins {

    private static final Logger log = LoggerFactory.getLogger(InternalPlugins.class);

    private InternalPlugins() {
    }

    /**
     * Creates a PluginManager with the built-in methods (execute {@code tmt}, report
     * {@code display} and {@code junit}) and the community jars found in
     * {@link TestbedConfig#getPluginsDir()}. Only that directory is scanned for {@code *.jar} files.
     */
    public static PluginManager createPluginManager(TestbedConfig config) {
        PluginManager pluginManager = new PluginManager();

        pluginManager.registerInternal(new InternalExecutorProvider());
        pluginManager.registerInternal(new DisplayReportProvider());
        pluginManager.registerInternal(new JUnitReportProvider());

        Path pluginsDir = config.getPluginsDir();
        if (pluginsDir != null) {
            pluginManager.loadCommunityPlugins(pluginsDir);
        }

        log.info("Plugins: {} internal, {} community (dir={})",
                pluginManager.getInternalCount(), pluginManager.getCommunityCount(), pluginsDir);

        return pluginManager;
    }
}
