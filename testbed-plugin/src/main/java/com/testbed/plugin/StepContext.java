package com.testbed.plugin;

import com.testbed.config.TestbedConfig;

import java.nio.file.Path;

/**
 * Non-owning handle a plugin keeps to the step it is bound to. Steps implement this; plugins
 * never own or outlive their step.
 */
public interface StepContext {

    /** Step name, e.g. {@code execute} or {@code report}; plugins register under this name. */
    String getName();

    /** Step working directory, {@code <plan workdir>/<step name>}. */
    Path getWorkdir();

    /** Name of the owning plan, for messages. */
    String getPlanName();

    TestbedConfig getConfig();
}
