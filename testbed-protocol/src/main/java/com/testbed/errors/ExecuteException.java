package com.testbed.errors;

/**
 * The execute step cannot proceed (e.g. no ready guest). Fatal to the current {@code go()};
 * step status is left unchanged so the run can be resumed later.
 */
public final class ExecuteException extends TestbedException {

    public ExecuteException(String message) {
        super(message);
    }

    public ExecuteException(String message, Throwable cause) {
        super(message, cause);
    }
}
