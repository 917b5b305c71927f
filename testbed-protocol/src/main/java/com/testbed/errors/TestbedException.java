package com.testbed.errors;

/**
 * Base of all errors raised by the step pipeline. Propagates to the top-level runner,
 * which reports it and exits with a non-zero status.
 */
public class TestbedException extends RuntimeException {

    public TestbedException(String message) {
        super(message);
    }

    public TestbedException(String message, Throwable cause) {
        super(message, cause);
    }
}
