package com.testbed.report.junit;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

/** {@code <testcase>} element: one result. */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
@JsonInclude(JsonInclude.Include.NON_NULL)
final class JUnitTestCase {

    @JacksonXmlProperty(isAttribute = true)
    private final String name;

    @JacksonXmlProperty(isAttribute = true)
    private final long time;

    @JacksonXmlProperty(localName = "failure")
    private Outcome failure;

    @JacksonXmlProperty(localName = "error")
    private Outcome error;

    @JacksonXmlProperty(localName = "skipped")
    private Outcome skipped;

    @JacksonXmlProperty(localName = "system-out")
    private String systemOut;

    JUnitTestCase(String name, long time) {
        this.name = name;
        this.time = time;
    }

    long getTime() {
        return time;
    }

    Outcome getFailure() {
        return failure;
    }

    Outcome getError() {
        return error;
    }

    Outcome getSkipped() {
        return skipped;
    }

    JUnitTestCase failure(String message, String text) {
        this.failure = new Outcome(message, text);
        return this;
    }

    JUnitTestCase error(String message, String text) {
        this.error = new Outcome(message, text);
        return this;
    }

    JUnitTestCase skipped(String message, String text) {
        this.skipped = new Outcome(message, text);
        return this;
    }

    JUnitTestCase systemOut(String systemOut) {
        this.systemOut = systemOut;
        return this;
    }

    /** {@code <failure>}, {@code <error>} or {@code <skipped>} with the outcome as message and the note as text. */
    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class Outcome {

        @JacksonXmlProperty(isAttribute = true)
        private final String message;

        @JacksonXmlText
        private final String text;

        Outcome(String message, String text) {
            this.message = message;
            this.text = text;
        }
    }
}
