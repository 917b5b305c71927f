package com.testbed.steps.report;

import com.testbed.config.StepData;
import com.testbed.result.ResultSummary;
import com.testbed.steps.Plan;
import com.testbed.steps.Step;
import com.testbed.steps.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Presents the results collected by the execute step. Any number of report phases may run. */
public class Report extends Step<ReportPlugin> {

    private static final Logger log = LoggerFactory.getLogger(Report.class);

    public static final String STEP_NAME = "report";
    public static final String DEFAULT_HOW = "display";

    public Report(Plan plan, List<StepData> data) {
        super(plan, STEP_NAME, DEFAULT_HOW, data);
    }

    @Override
    public void wake() {
        super.wake();
        for (StepData record : getData()) {
            ReportPlugin phase = plan.getRegistry().delegate(this, record, ReportPlugin.class);
            phase.wake();
            addPhase(phase);
        }
        markTodoUnlessDone();
    }

    @Override
    public void go() {
        if (isDone()) {
            log.info("Report step already done | plan={} | status={}", getPlanName(), getStatus());
            summary();
            return;
        }
        for (ReportPlugin phase : phases()) {
            log.info("Report phase {} | plan={} | how={}", phase.getName(), getPlanName(), phase.getHow());
            phase.go();
        }
        summary();
        setStatus(StepStatus.DONE);
        save();
    }

    @Override
    public String summary() {
        String summary = ResultSummary.summary(plan.getExecute().results());
        log.info("summary: {} | plan={}", summary, getPlanName());
        return summary;
    }
}
