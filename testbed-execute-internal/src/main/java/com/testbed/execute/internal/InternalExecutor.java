package com.testbed.execute.internal;

import com.testbed.config.StepData;
import com.testbed.discover.DiscoveredTest;
import com.testbed.guest.CommandResult;
import com.testbed.guest.Guest;
import com.testbed.result.Result;
import com.testbed.result.ResultOutcome;
import com.testbed.steps.Plan;
import com.testbed.steps.StepYaml;
import com.testbed.steps.execute.Execute;
import com.testbed.steps.execute.ExecutePlugin;
import com.testbed.steps.execute.Script;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default execute method: installs the helper scripts, pushes the plan workdir and runs the
 * tests one by one on the guest, classifying each by its framework.
 */
public final class InternalExecutor extends ExecutePlugin {

    private static final Logger log = LoggerFactory.getLogger(InternalExecutor.class);

    public static final String METHOD = "tmt";

    public static final String ENV_TEST_DATA = "TESTBED_TEST_DATA";
    public static final String ENV_PLAN_DATA = "TESTBED_PLAN_DATA";
    public static final String ENV_TREE = "TESTBED_TREE";
    public static final String ENV_TEST_NAME = "TESTBED_TEST_NAME";
    public static final String ENV_BEAKERLIB_DIR = "BEAKERLIB_DIR";

    static final List<Script> SCRIPTS = List.of(
            new Script("/usr/local/bin/testbed-report-result",
                    List.of("/usr/bin/rstrnt-report-result", "/usr/bin/rhts-report-result"),
                    List.of(ENV_TEST_DATA)),
            new Script("/usr/local/bin/testbed-file-submit",
                    List.of("/usr/bin/rstrnt-report-log", "/usr/bin/rhts-submit-log", "/usr/bin/rhts_submit_log"),
                    List.of(ENV_TEST_DATA)));

    private final List<Result> results = new ArrayList<>();

    public InternalExecutor(Execute step, StepData data) {
        super(step, data);
    }

    @Override
    public List<Script> getScripts() {
        return SCRIPTS;
    }

    @Override
    public void go(Guest guest) {
        super.go(guest);
        results.clear();
        prepareScripts(guest);
        List<DiscoveredTest> tests = prepareTests();
        guest.push(step.getPlan().getWorkdir());
        boolean exitFirst = isExitFirst();
        for (DiscoveredTest test : tests) {
            executeTest(test, guest);
            Result result = check(test);
            results.add(result);
            if (exitFirst && (result.getResult() == ResultOutcome.FAIL || result.getResult() == ResultOutcome.ERROR)) {
                log.info("Stopping after first failure | test={} | guest={}", test.getName(), guest.getName());
                break;
            }
        }
    }

    @Override
    public List<Result> results() {
        return List.copyOf(results);
    }

    /** Runs one test on the guest and records its return code, real duration and output. */
    void executeTest(DiscoveredTest test, Guest guest) {
        Path directory = dataPath(test, null, true, true);
        Path output = dataPath(test, OUTPUT_LOG, true, false);
        if (test.getTest() == null || test.getTest().isBlank()) {
            log.warn("No test command defined | test={}", test.getName());
            StepYaml.write(output, "No test command defined.\n", false);
            return;
        }
        String duration = test.getDuration() != null ? test.getDuration() : step.getConfig().getDefaultDuration();
        Duration timeout = DurationParser.parse(duration);
        String command = command(test);
        log.info("Run test {} | guest={} | timeout={}", test.getName(), guest.getName(), duration);
        log.debug("Test command | test={} | command={}", test.getName(), command);

        Instant start = Instant.now();
        CommandResult result = guest.run(command, environment(test), timeout);
        Instant end = Instant.now();
        guest.pull(directory);

        test.setReturncode(result.exitCode());
        test.setRealDuration(testDuration(start, end));
        StepYaml.write(output, result.stdout() + result.stderr(), false);
        log.debug("Test finished | test={} | returncode={} | duration={}",
                test.getName(), result.exitCode(), test.getRealDuration());
    }

    /** Test environment merged with the variables describing where test data lives. */
    Map<String, String> environment(DiscoveredTest test) {
        Plan plan = step.getPlan();
        Map<String, String> env = new LinkedHashMap<>(test.getEnvironment());
        env.put(ENV_TEST_DATA, dataPath(test, DATA_DIRECTORY, true, false).toString());
        env.put(ENV_PLAN_DATA, plan.getWorkdir().resolve(DATA_DIRECTORY).toString());
        if (plan.getTree() != null) {
            env.put(ENV_TREE, plan.getTree().toString());
        }
        env.put(ENV_BEAKERLIB_DIR, dataPath(test).toString());
        env.put(ENV_TEST_NAME, test.getName());
        return env;
    }

    private String command(DiscoveredTest test) {
        Path tree = step.getPlan().getTree();
        if (tree == null) return test.getTest();
        Path directory = test.getPath() != null ? tree.resolve(test.getPath().replaceFirst("^/+", "")) : tree;
        return "cd " + quote(directory.toString()) + " && " + test.getTest();
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    /** Classifies by the test's framework, falling back to the step default. */
    Result check(DiscoveredTest test) {
        String framework = test.getFramework() != null ? test.getFramework() : step.getFramework();
        if (FRAMEWORK_BEAKERLIB.equals(framework)) {
            return checkBeakerlib(test);
        }
        return checkShell(test);
    }

    @Override
    public List<String> requires() {
        if (FRAMEWORK_BEAKERLIB.equals(step.getFramework())) {
            return List.of(FRAMEWORK_BEAKERLIB);
        }
        for (DiscoveredTest test : discover()) {
            if (FRAMEWORK_BEAKERLIB.equals(test.getFramework())) return List.of(FRAMEWORK_BEAKERLIB);
        }
        return List.of();
    }
}
