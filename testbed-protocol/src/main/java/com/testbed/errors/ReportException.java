package com.testbed.errors;

/** A report method could not produce its output. */
public final class ReportException extends TestbedException {

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
