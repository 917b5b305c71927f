package com.testbed.report.display;

import com.testbed.config.StepData;
import com.testbed.plugin.Plugin;
import com.testbed.plugin.PluginProvider;
import com.testbed.plugin.StepContext;
import com.testbed.steps.report.Report;

/** Registers {@link DisplayReport} as report method {@code display}. */
public final class DisplayReportProvider implements PluginProvider {

    @Override
    public String getStepName() {
        return Report.STEP_NAME;
    }

    @Override
    public String getMethodName() {
        return DisplayReport.METHOD;
    }

    @Override
    public String getDescription() {
        return "Show test results on the terminal.";
    }

    @Override
    public Plugin<?> createPlugin(StepContext step, StepData data) {
        return new DisplayReport((Report) step, data);
    }
}
