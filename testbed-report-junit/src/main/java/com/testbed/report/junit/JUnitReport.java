package com.testbed.report.junit;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.testbed.config.StepData;
import com.testbed.errors.ReportException;
import com.testbed.result.Result;
import com.testbed.steps.report.Report;
import com.testbed.steps.report.ReportPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Writes the results as a JUnit XML {@code <testsuite>} to {@code junit.xml} in the report
 * workdir, or to the path given by the {@code file} option.
 */
public final class JUnitReport extends ReportPlugin {

    private static final Logger log = LoggerFactory.getLogger(JUnitReport.class);

    public static final String METHOD = "junit";
    public static final String KEY_FILE = "file";
    public static final String DEFAULT_FILE = "junit.xml";

    private static final XmlMapper MAPPER = XmlMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
            .build();

    /** Characters XML 1.0 cannot carry, such as the ESC of ANSI colour codes. */
    private static final Pattern NON_XML_CHARS =
            Pattern.compile("[^\\x09\\x0A\\x0D\\x20-\\uD7FF\\uE000-\\uFFFD\\x{10000}-\\x{10FFFF}]");

    public JUnitReport(Report step, StepData data) {
        super(step, data);
    }

    /** Destination file; relative paths resolve against the report workdir. */
    public Path getFile() {
        Object file = get(KEY_FILE);
        Path path = Path.of(file != null ? file.toString() : DEFAULT_FILE);
        return path.isAbsolute() ? path : step.getWorkdir().resolve(path);
    }

    @Override
    public void go() {
        Path file = getFile();
        JUnitTestSuite suite = suite(results());
        try {
            Path parent = file.getParent();
            if (parent != null) Files.createDirectories(parent);
            MAPPER.writeValue(file.toFile(), suite);
        } catch (IOException e) {
            throw new ReportException("Cannot write JUnit report to '" + file + "'", e);
        }
        log.info("JUnit report saved | file={} | tests={} | failures={} | errors={}",
                file, suite.getTests(), suite.getFailures(), suite.getErrors());
    }

    JUnitTestSuite suite(List<Result> results) {
        List<JUnitTestCase> cases = new ArrayList<>();
        for (Result result : results) {
            JUnitTestCase testCase = new JUnitTestCase(xmlText(result.getName()), seconds(result.getDuration()));
            String outcome = result.getResult().value();
            String note = xmlText(result.getNote());
            switch (result.getResult()) {
                case FAIL -> testCase.failure(outcome, note);
                case ERROR, WARN -> testCase.error(outcome, note);
                case INFO -> testCase.skipped(outcome, note);
                default -> {
                }
            }
            testCase.systemOut(xmlText(output(result)));
            cases.add(testCase);
        }
        return new JUnitTestSuite(step.getPlanName(), cases);
    }

    /** Content of the first log file, when it can be read. */
    private String output(Result result) {
        if (result.getLog().isEmpty()) return null;
        Path path = executeWorkdir().resolve(result.getLog().get(0));
        if (!Files.isRegularFile(path)) return null;
        try {
            return Files.readString(path);
        } catch (IOException e) {
            log.warn("Cannot read test output | test={} | file={}", result.getName(), path, e);
            return null;
        }
    }

    /** Drops the characters an XML 1.0 document cannot contain. */
    static String xmlText(String text) {
        return text == null ? null : NON_XML_CHARS.matcher(text).replaceAll("");
    }

    /** Seconds from {@code HH:MM:SS}; 0 when unknown. */
    static long seconds(String duration) {
        if (duration == null) return 0;
        String[] parts = duration.split(":");
        long seconds = 0;
        try {
            for (String part : parts) {
                seconds = seconds * 60 + Long.parseLong(part.trim());
            }
        } catch (NumberFormatException e) {
            log.debug("Unparsable duration '{}'", duration);
            return 0;
        }
        return seconds;
    }
}
