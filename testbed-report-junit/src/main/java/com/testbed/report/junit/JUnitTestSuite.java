package com.testbed.report.junit;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.List;

/** {@code <testsuite>} root of the JUnit XML report; one suite per plan. */
@JacksonXmlRootElement(localName = "testsuite")
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
@JsonInclude(JsonInclude.Include.NON_NULL)
final class JUnitTestSuite {

    @JacksonXmlProperty(isAttribute = true)
    private final String name;

    @JacksonXmlProperty(isAttribute = true)
    private final int tests;

    @JacksonXmlProperty(isAttribute = true)
    private final int failures;

    @JacksonXmlProperty(isAttribute = true)
    private final int errors;

    @JacksonXmlProperty(isAttribute = true)
    private final int skipped;

    @JacksonXmlProperty(isAttribute = true)
    private final long time;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "testcase")
    private final List<JUnitTestCase> testcases;

    JUnitTestSuite(String name, List<JUnitTestCase> testcases) {
        this.name = name;
        this.testcases = List.copyOf(testcases);
        this.tests = testcases.size();
        this.failures = (int) testcases.stream().filter(c -> c.getFailure() != null).count();
        this.errors = (int) testcases.stream().filter(c -> c.getError() != null).count();
        this.skipped = (int) testcases.stream().filter(c -> c.getSkipped() != null).count();
        this.time = testcases.stream().mapToLong(JUnitTestCase::getTime).sum();
    }

    int getTests() {
        return tests;
    }

    int getFailures() {
        return failures;
    }

    int getErrors() {
        return errors;
    }

    int getSkipped() {
        return skipped;
    }
}
