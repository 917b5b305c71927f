package com.testbed.report.display;

import com.testbed.config.StepData;
import com.testbed.result.Result;
import com.testbed.steps.report.Report;
import com.testbed.steps.report.ReportPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Logs one line per result, e.g. {@code pass /tests/smoke}. With {@code verbose} the log paths
 * and notes follow each line.
 */
public final class DisplayReport extends ReportPlugin {

    private static final Logger log = LoggerFactory.getLogger(DisplayReport.class);

    public static final String METHOD = "display";
    public static final String KEY_VERBOSE = "verbose";

    public DisplayReport(Report step, StepData data) {
        super(step, data);
    }

    @Override
    public void go() {
        for (String line : lines()) {
            log.info(line);
        }
    }

    /** Rendered report lines in result order. */
    public List<String> lines() {
        boolean verbose = getBoolean(KEY_VERBOSE, false);
        List<String> lines = new ArrayList<>();
        for (Result result : results()) {
            lines.add(result.getResult().value() + " " + result.getName());
            if (!verbose) continue;
            for (String path : result.getLog()) {
                lines.add("    " + executeWorkdir().resolve(path));
            }
            if (result.getNote() != null) {
                lines.add("    note: " + result.getNote());
            }
        }
        return lines;
    }
}
