package com.testbed.result;

import com.testbed.errors.SpecificationException;

import java.util.Locale;

/**
 * How a test's classified outcome is turned into its final result, from the test's
 * {@code result} metadata key.
 */
public enum ResultInterpretation {
    /** Keep the classified outcome. */
    RESPECT,
    /** Expected failure: pass and fail are swapped, other outcomes kept. */
    XFAIL,
    /** The test reports its own results; the classified outcome is kept. */
    CUSTOM,
    PASS,
    FAIL,
    INFO,
    WARN,
    ERROR;

    public static ResultInterpretation fromValue(String value) {
        if (value == null || value.isBlank()) return RESPECT;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SpecificationException("Invalid result interpretation '" + value + "'.");
        }
    }

    /**
     * Applies the interpretation. Every interpretation other than respect and custom records the
     * original outcome in the note.
     */
    public Result apply(Result result) {
        if (this == RESPECT || this == CUSTOM) {
            return result;
        }
        String original = "original result: " + result.getResult();
        String note = result.getNote() != null ? result.getNote() + ", " + original : original;
        ResultOutcome outcome;
        if (this == XFAIL) {
            outcome = switch (result.getResult()) {
                case PASS -> ResultOutcome.FAIL;
                case FAIL -> ResultOutcome.PASS;
                default -> result.getResult();
            };
        } else {
            outcome = ResultOutcome.valueOf(name());
        }
        return result.toBuilder().result(outcome).note(note).build();
    }
}
