package com.testbed.errors;

/**
 * Invalid plan configuration: more records than a single-instance step accepts, or a
 * {@code how} value no registered method resolves. Raised before any execution begins.
 */
public final class SpecificationException extends TestbedException {

    public SpecificationException(String message) {
        super(message);
    }
}
