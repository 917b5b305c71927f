package com.testbed.report.junit;

import com.testbed.config.StepData;
import com.testbed.plugin.Plugin;
import com.testbed.plugin.PluginProvider;
import com.testbed.plugin.StepContext;
import com.testbed.steps.report.Report;

/** Registers {@link JUnitReport} as report method {@code junit}. */
public final class JUnitReportProvider implements PluginProvider {

    @Override
    public String getStepName() {
        return Report.STEP_NAME;
    }

    @Override
    public String getMethodName() {
        return JUnitReport.METHOD;
    }

    @Override
    public String getDescription() {
        return "Save test results in JUnit XML format.";
    }

    @Override
    public Plugin<?> createPlugin(StepContext step, StepData data) {
        return new JUnitReport((Report) step, data);
    }
}
