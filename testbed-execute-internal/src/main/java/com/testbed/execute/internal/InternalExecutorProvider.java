package com.testbed.execute.internal;

import com.testbed.config.StepData;
import com.testbed.plugin.Plugin;
import com.testbed.plugin.PluginProvider;
import com.testbed.plugin.StepContext;
import com.testbed.steps.execute.Execute;

/** Registers the internal executor as execute method {@code tmt}. */
public final class InternalExecutorProvider implements PluginProvider {

    @Override
    public String getStepName() {
        return Execute.STEP_NAME;
    }

    @Override
    public String getMethodName() {
        return InternalExecutor.METHOD;
    }

    @Override
    public String getDescription() {
        return "Use the internal executor to run tests sequentially on each guest.";
    }

    @Override
    public Plugin<?> createPlugin(StepContext step, StepData data) {
        return new InternalExecutor((Execute) step, data);
    }
}
