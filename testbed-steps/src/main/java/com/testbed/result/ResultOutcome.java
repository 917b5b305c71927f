package com.testbed.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one test. {@link #ERROR} is used whenever an execution could not be classified.
 */
public enum ResultOutcome {
    PASS,
    FAIL,
    INFO,
    WARN,
    ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for anything but pass, fail, info, warn or error
     */
    @JsonCreator
    public static ResultOutcome fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Result outcome must not be null");
        }
        for (ResultOutcome o : values()) {
            if (o.value().equals(value.trim().toLowerCase(Locale.ROOT))) return o;
        }
        throw new IllegalArgumentException("Invalid result '" + value + "'");
    }

    @Override
    public String toString() {
        return value();
    }
}
