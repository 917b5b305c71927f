package com.testbed.bootstrap;

import com.testbed.errors.TestbedException;
import com.testbed.result.Result;
import com.testbed.result.ResultOutcome;
import com.testbed.result.ResultSummary;
import com.testbed.steps.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Top-level runner: wakes and runs a plan and maps the outcome to a process exit code.
 */
public final class PlanRunner {

    private static final Logger log = LoggerFactory.getLogger(PlanRunner.class);

    /** All tests passed. */
    public static final int EXIT_PASSED = 0;
    /** At least one test failed, none errored. */
    public static final int EXIT_FAILED = 1;
    /** An error result or warning, or the run aborted with an exception. */
    public static final int EXIT_ERROR = 2;
    /** Nothing was executed. */
    public static final int EXIT_NO_RESULTS = 3;

    private PlanRunner() {
    }

    public static int run(Plan plan) {
        try {
            plan.wake();
            plan.go();
        } catch (TestbedException e) {
            log.error("Plan {} failed: {}", plan.getName(), e.getMessage(), e);
            return EXIT_ERROR;
        }
        int code = exitCode(plan.getExecute().results());
        log.info("Plan {} finished | exitCode={}", plan.getName(), code);
        return code;
    }

    public static int exitCode(List<Result> results) {
        if (results.isEmpty()) return EXIT_NO_RESULTS;
        Map<ResultOutcome, Integer> totals = ResultSummary.totals(results);
        if (totals.containsKey(ResultOutcome.ERROR) || totals.containsKey(ResultOutcome.WARN)) return EXIT_ERROR;
        if (totals.containsKey(ResultOutcome.FAIL)) return EXIT_FAILED;
        return EXIT_PASSED;
    }
}
