package com.testbed.steps.report;

import com.testbed.config.StepData;
import com.testbed.plugin.Plugin;
import com.testbed.result.Result;

import java.nio.file.Path;
import java.util.List;

/** Base for report methods. Reports run once per plan and never touch guests. */
public abstract class ReportPlugin extends Plugin<Report> {

    protected ReportPlugin(Report step, StepData data) {
        super(step, data);
    }

    public abstract void go();

    /** Results of the plan's execute step. */
    protected List<Result> results() {
        return step.getPlan().getExecute().results();
    }

    /** Workdir of the execute step; result log paths are relative to it. */
    protected Path executeWorkdir() {
        return step.getPlan().getExecute().getWorkdir();
    }
}
