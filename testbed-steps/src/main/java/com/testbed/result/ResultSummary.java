package com.testbed.result;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Human readable totals for a list of results. */
public final class ResultSummary {

    private ResultSummary() {
    }

    /** Count of results per outcome; outcomes that never occur are absent. */
    public static Map<ResultOutcome, Integer> totals(Collection<Result> results) {
        Map<ResultOutcome, Integer> totals = new EnumMap<>(ResultOutcome.class);
        for (Result r : results) {
            totals.merge(r.getResult(), 1, Integer::sum);
        }
        return totals;
    }

    /**
     * E.g. {@code 2 tests passed, 1 test failed and 1 error}; {@code no results found} when empty.
     */
    public static String summary(Collection<Result> results) {
        Map<ResultOutcome, Integer> totals = totals(results);
        List<String> parts = new ArrayList<>();
        Integer count;
        if ((count = totals.get(ResultOutcome.PASS)) != null) parts.add(listed(count, "test") + " passed");
        if ((count = totals.get(ResultOutcome.FAIL)) != null) parts.add(listed(count, "test") + " failed");
        if ((count = totals.get(ResultOutcome.INFO)) != null) parts.add(listed(count, "info"));
        if ((count = totals.get(ResultOutcome.WARN)) != null) parts.add(listed(count, "warn"));
        if ((count = totals.get(ResultOutcome.ERROR)) != null) parts.add(listed(count, "error"));
        return parts.isEmpty() ? "no results found" : listed(parts);
    }

    /** {@code 1 test}, {@code 3 tests}. */
    public static String listed(int count, String noun) {
        return count + " " + (count == 1 ? noun : noun + "s");
    }

    /** {@code a}, {@code a and b}, {@code a, b and c}. */
    public static String listed(List<String> items) {
        if (items.isEmpty()) return "";
        if (items.size() == 1) return items.get(0);
        return String.join(", ", items.subList(0, items.size() - 1)) + " and " + items.get(items.size() - 1);
    }
}
