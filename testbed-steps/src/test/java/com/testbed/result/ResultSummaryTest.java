package com.testbed.result;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResultSummaryTest {

    private static Result r(String name, ResultOutcome outcome) {
        return Result.builder(name).result(outcome).build();
    }

    @Test
    void summary_listsOutcomesInFixedOrder() {
        List<Result> results = List.of(
                r("/a", ResultOutcome.ERROR),
                r("/b", ResultOutcome.PASS),
                r("/c", ResultOutcome.FAIL),
                r("/d", ResultOutcome.PASS));

        assertEquals("2 tests passed, 1 test failed and 1 error", ResultSummary.summary(results));
    }

    @Test
    void summary_emptyResults() {
        assertEquals("no results found", ResultSummary.summary(List.of()));
    }

    @Test
    void summary_singleOutcome() {
        assertEquals("1 test passed", ResultSummary.summary(List.of(r("/a", ResultOutcome.PASS))));
        assertEquals("2 warns", ResultSummary.summary(List.of(r("/a", ResultOutcome.WARN), r("/b", ResultOutcome.WARN))));
    }

    @Test
    void totals_countsPerOutcome() {
        Map<ResultOutcome, Integer> totals = ResultSummary.totals(List.of(
                r("/a", ResultOutcome.FAIL), r("/b", ResultOutcome.FAIL), r("/c", ResultOutcome.INFO)));

        assertEquals(Map.of(ResultOutcome.FAIL, 2, ResultOutcome.INFO, 1), totals);
    }
}
