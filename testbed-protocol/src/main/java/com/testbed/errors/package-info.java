/**
 * Error taxonomy. {@link com.testbed.errors.SpecificationException} and
 * {@link com.testbed.errors.ExecuteException} abort a step and reach the runner;
 * result-level problems (bad exit code, incomplete framework results, timeout) are never
 * thrown and are recorded as {@code error} results instead.
 */
package com.testbed.errors;
