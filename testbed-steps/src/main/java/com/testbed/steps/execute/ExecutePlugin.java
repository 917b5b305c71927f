package com.testbed.steps.execute;

import com.testbed.config.StepData;
import com.testbed.discover.DiscoveredTest;
import com.testbed.errors.FileException;
import com.testbed.guest.CommandResult;
import com.testbed.guest.Guest;
import com.testbed.plugin.Plugin;
import com.testbed.result.Result;
import com.testbed.result.ResultInterpretation;
import com.testbed.result.ResultOutcome;
import com.testbed.steps.StepYaml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for execute methods. Provides test data layout, helper script installation and result
 * classification for the shell and beakerlib frameworks; subclasses run the tests.
 */
public abstract class ExecutePlugin extends Plugin<Execute> {

    private static final Logger log = LoggerFactory.getLogger(ExecutePlugin.class);

    public static final String DATA_DIRECTORY = "data";
    public static final String OUTPUT_LOG = "output.txt";
    public static final String JOURNAL_LOG = "journal.txt";
    public static final String BEAKERLIB_RESULTS = "TestResults";
    public static final String METADATA_FILE = "metadata.yaml";
    public static final String SCRIPTS_DIRECTORY = "scripts";

    public static final String DEFAULT_FRAMEWORK = "shell";
    public static final String FRAMEWORK_BEAKERLIB = "beakerlib";

    public static final String KEY_EXIT_FIRST = "exit-first";

    static final String DURATION_DOCS = "https://tmt.readthedocs.io/en/stable/spec/tests.html#duration";

    private static final List<String> SCRIPT_PUSH_OPTIONS = List.of("-p", "--chmod=755");
    private static final Pattern BEAKERLIB_RESULT = Pattern.compile("TESTRESULT_RESULT_STRING=(.*)");
    private static final Pattern BEAKERLIB_STATE = Pattern.compile("TESTRESULT_STATE=\"?(\\w+)\"?");

    protected ExecutePlugin(Execute step, StepData data) {
        super(step, data);
    }

    /** Helper scripts installed on every guest. None by default. */
    public List<Script> getScripts() {
        return List.of();
    }

    /** Runs the tests on the given guest. Subclasses call this first. */
    public void go(Guest guest) {
        log.info("Run tests | phase={} | guest={} | exit-first={}", getName(), guest.getName(), isExitFirst());
    }

    /** Results of the tests executed by the last {@link #go(Guest)}. */
    public abstract List<Result> results();

    /** {@code exit-first} option, falling back to the configured default. */
    public boolean isExitFirst() {
        return getBoolean(KEY_EXIT_FIRST, step.getConfig().isExitFirst());
    }

    public List<DiscoveredTest> discover() {
        return step.getPlan().getDiscover().tests();
    }

    /** Test data directory, {@code <workdir>/data/<test name>} with the leading slash dropped. */
    public Path dataPath(DiscoveredTest test) {
        return dataPath(test, null, true, false);
    }

    /**
     * Path to a test's data directory or to a file in it.
     *
     * @param filename file in the data directory; null for the directory itself
     * @param full     absolute path when true, otherwise relative to the step workdir
     * @param create   create the directory and its {@code data} subdirectory
     */
    public Path dataPath(DiscoveredTest test, String filename, boolean full, boolean create) {
        Path relative = Path.of(DATA_DIRECTORY, test.getName().replaceFirst("^/+", ""));
        Path directory = step.getWorkdir().resolve(relative);
        if (create) {
            Path data = directory.resolve(DATA_DIRECTORY);
            try {
                Files.createDirectories(data);
            } catch (IOException e) {
                throw new FileException(data, "create", e);
            }
        }
        if (filename == null) {
            return full ? directory : relative;
        }
        return full ? directory.resolve(filename) : relative.resolve(filename);
    }

    /** Discovers the tests and writes each test's {@code metadata.yaml}. */
    public List<DiscoveredTest> prepareTests() {
        List<DiscoveredTest> tests = discover();
        for (DiscoveredTest test : tests) {
            Path metadata = dataPath(test, METADATA_FILE, true, true);
            StepYaml.write(metadata, StepYaml.dump(test.getMetadata()), false);
            log.debug("Test metadata | test={} | file={}", test.getName(), metadata);
        }
        return tests;
    }

    /** Pushes every helper script to its path and aliases on the guest. */
    public void prepareScripts(Guest guest) {
        List<Script> scripts = getScripts();
        if (scripts.isEmpty()) {
            throw new IllegalStateException("No helper scripts defined for " + getHow());
        }
        for (Script script : scripts) {
            Path source = scriptSource(script);
            List<String> destinations = new ArrayList<>();
            destinations.add(script.path());
            destinations.addAll(script.aliases());
            for (String destination : destinations) {
                log.debug("Install script {} | guest={} | destination={}", script.sourceName(), guest.getName(), destination);
                guest.push(source, destination, SCRIPT_PUSH_OPTIONS);
            }
        }
    }

    /** Local file for a script: the configured scripts directory or a copy extracted from the classpath. */
    protected Path scriptSource(Script script) {
        Path scriptsDir = step.getConfig().getScriptsDir();
        if (scriptsDir != null) {
            Path source = scriptsDir.resolve(script.sourceName());
            if (!Files.isRegularFile(source)) {
                throw new FileException("Script '" + source + "' not found.");
            }
            return source;
        }
        Path target = step.getWorkdir().resolve(SCRIPTS_DIRECTORY).resolve(script.sourceName());
        if (Files.isRegularFile(target)) return target;
        String resource = SCRIPTS_DIRECTORY + "/" + script.sourceName();
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileException("Script resource '" + resource + "' not found for " + getClass().getName() + ".");
            }
            Files.createDirectories(target.getParent());
            Files.copy(in, target);
            target.toFile().setExecutable(true, false);
        } catch (IOException e) {
            throw new FileException(target, "extract", e);
        }
        return target;
    }

    /** Classifies a shell test by its return code: 0 pass, 1 fail, anything else error. */
    public Result checkShell(DiscoveredTest test) {
        Integer code = test.getReturncode();
        ResultOutcome outcome;
        String note = null;
        if (code != null && code == 0) {
            outcome = ResultOutcome.PASS;
        } else if (code != null && code == 1) {
            outcome = ResultOutcome.FAIL;
        } else {
            outcome = ResultOutcome.ERROR;
            if (code != null && code == CommandResult.PROCESS_TIMEOUT) {
                note = "timeout";
                timeoutHint(test);
            }
        }
        log.info("Result {} | test={} | returncode={}", outcome, test.getName(), code);
        return interpret(test, result(test, outcome, note, List.of(logPath(test, OUTPUT_LOG))));
    }

    /** Classifies a beakerlib test from the {@code TestResults} file it left in its data directory. */
    public Result checkBeakerlib(DiscoveredTest test) {
        List<String> logs = new ArrayList<>();
        for (String name : List.of(OUTPUT_LOG, JOURNAL_LOG)) {
            if (Files.exists(dataPath(test, name, true, false))) {
                logs.add(logPath(test, name));
            }
        }
        Path resultsFile = dataPath(test, BEAKERLIB_RESULTS, true, false);
        String content;
        try {
            content = StepYaml.read(resultsFile);
        } catch (FileException e) {
            log.info("Result error | test={} | unable to read {}", test.getName(), resultsFile);
            return interpret(test, result(test, ResultOutcome.ERROR, "beakerlib: TestResults FileError", logs));
        }
        Matcher resultMatch = BEAKERLIB_RESULT.matcher(content);
        Matcher stateMatch = BEAKERLIB_STATE.matcher(content);
        if (!resultMatch.find() || !stateMatch.find()) {
            log.info("Result error | test={} | no result or state found in {}", test.getName(), resultsFile);
            return interpret(test, result(test, ResultOutcome.ERROR, "beakerlib: Result/State missing", logs));
        }
        String resultString = resultMatch.group(1).trim().toLowerCase(Locale.ROOT);
        String state = stateMatch.group(1);
        Integer code = test.getReturncode();
        ResultOutcome outcome;
        String note = null;
        if (code != null && code == CommandResult.PROCESS_TIMEOUT) {
            outcome = ResultOutcome.ERROR;
            note = "timeout";
            timeoutHint(test);
        } else if (!"complete".equals(state)) {
            outcome = ResultOutcome.ERROR;
            note = "beakerlib: State '" + state + "'";
        } else {
            try {
                outcome = ResultOutcome.fromValue(resultString);
            } catch (IllegalArgumentException e) {
                outcome = ResultOutcome.ERROR;
                note = "beakerlib: Result '" + resultString + "'";
            }
        }
        log.info("Result {} | test={} | state={}", outcome, test.getName(), state);
        return interpret(test, result(test, outcome, note, logs));
    }

    /** Appends the duration hint to the test's output log. */
    public void timeoutHint(DiscoveredTest test) {
        String duration = test.getDuration() != null ? test.getDuration() : step.getConfig().getDefaultDuration();
        String hint = "\nMaximum test time '" + duration + "' exceeded.\n"
                + "Adjust the test 'duration' attribute if necessary.\n"
                + DURATION_DOCS + "\n";
        log.info("Test {} timed out | duration={} | docs={}", test.getName(), duration, DURATION_DOCS);
        StepYaml.write(dataPath(test, OUTPUT_LOG, true, false), hint, true);
    }

    /** Elapsed time as {@code HH:MM:SS}. */
    public static String testDuration(Instant start, Instant end) {
        long seconds = Math.max(0, Duration.between(start, end).getSeconds());
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    private String logPath(DiscoveredTest test, String filename) {
        return dataPath(test, filename, false, false).toString();
    }

    private static Result result(DiscoveredTest test, ResultOutcome outcome, String note, List<String> logs) {
        return Result.builder(test.getName())
                .result(outcome)
                .log(logs)
                .duration(test.getRealDuration())
                .note(note)
                .build();
    }

    private static Result interpret(DiscoveredTest test, Result result) {
        return ResultInterpretation.fromValue(test.getResult()).apply(result);
    }
}
