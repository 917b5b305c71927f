package com.testbed.execute.internal;

import com.testbed.config.StepData;
import com.testbed.config.TestbedConfig;
import com.testbed.discover.DiscoveredTest;
import com.testbed.guest.CommandResult;
import com.testbed.guest.Guest;
import com.testbed.plugin.PluginRegistry;
import com.testbed.result.Result;
import com.testbed.result.ResultOutcome;
import com.testbed.steps.Plan;
import com.testbed.steps.execute.Execute;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InternalExecutorTest {

    @TempDir
    Path workdir;

    @Mock
    Guest guest;

    private PluginRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
        registry.register(new InternalExecutorProvider());
        when(guest.getName()).thenReturn("default-0");
        when(guest.isReady()).thenReturn(true);
        when(guest.run(anyString(), anyMap(), any())).thenAnswer(invocation -> {
            String command = invocation.getArgument(0);
            Map<String, String> env = invocation.getArgument(1);
            if (command.contains("beakerlib")) {
                writeTestResults(Path.of(env.get("BEAKERLIB_DIR")), "PASS", "complete");
                return new CommandResult(0, "beakerlib output\n", "");
            }
            if (command.contains("sleep")) return CommandResult.of(CommandResult.PROCESS_TIMEOUT);
            if (command.contains("false")) return new CommandResult(1, "", "failed\n");
            return new CommandResult(0, "ok\n", "");
        });
    }

    private static void writeTestResults(Path directory, String result, String state) {
        try {
            Files.writeString(directory.resolve("TestResults"),
                    "TESTRESULT_RESULT_STRING=" + result + "\nTESTRESULT_STATE=" + state + "\n");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Plan plan(StepData execute, DiscoveredTest... tests) {
        return Plan.builder("/plans/internal")
                .workdir(workdir)
                .tree(Path.of("/srv/tree"))
                .registry(registry)
                .config(TestbedConfig.builder().workdirRoot(workdir).build())
                .discover(() -> List.of(tests))
                .provision(() -> List.of(guest))
                .execute(execute)
                .build();
    }

    @Test
    void go_runsTestsAndClassifies() throws Exception {
        Plan plan = plan(StepData.of("tmt"),
                DiscoveredTest.builder("/tests/ok").test("./ok.sh").path("/tests/ok").build(),
                DiscoveredTest.builder("/tests/broken").test("false").build(),
                DiscoveredTest.builder("/tests/slow").test("sleep 600").duration("1m").build());
        Execute execute = plan.getExecute();
        execute.wake();

        execute.go();

        List<Result> results = execute.results();
        assertEquals(3, results.size());
        assertEquals(ResultOutcome.PASS, results.get(0).getResult());
        assertEquals(ResultOutcome.FAIL, results.get(1).getResult());
        assertEquals(ResultOutcome.ERROR, results.get(2).getResult());
        assertEquals("timeout", results.get(2).getNote());
        assertEquals("failed\n", Files.readString(workdir.resolve("execute/data/tests/broken/output.txt")));
        assertTrue(Files.readString(workdir.resolve("execute/data/tests/slow/output.txt"))
                .contains("Maximum test time '1m' exceeded."));
        assertEquals("3 tests executed", execute.summary());
    }

    @Test
    void go_passesEnvironmentTimeoutAndWorkingDirectory() {
        Plan plan = plan(StepData.of("tmt"), DiscoveredTest.builder("/tests/ok")
                .test("./ok.sh")
                .path("/tests/ok")
                .environment(Map.of("FOO", "bar"))
                .build());
        plan.getExecute().wake();

        plan.getExecute().go();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> env = ArgumentCaptor.forClass(Map.class);
        verify(guest).run(eq("cd '/srv/tree/tests/ok' && ./ok.sh"), env.capture(), eq(Duration.ofMinutes(5)));
        Path data = workdir.resolve("execute/data/tests/ok");
        assertEquals("bar", env.getValue().get("FOO"));
        assertEquals(data.resolve("data").toString(), env.getValue().get("TESTBED_TEST_DATA"));
        assertEquals(data.toString(), env.getValue().get("BEAKERLIB_DIR"));
        assertEquals(workdir.resolve("data").toString(), env.getValue().get("TESTBED_PLAN_DATA"));
        assertEquals("/srv/tree", env.getValue().get("TESTBED_TREE"));
        assertEquals("/tests/ok", env.getValue().get("TESTBED_TEST_NAME"));
        verify(guest).pull(data);
        verify(guest).push(workdir);
    }

    @Test
    void go_installsHelperScripts() {
        Plan plan = plan(StepData.of("tmt"), DiscoveredTest.builder("/tests/ok").test("./ok.sh").build());
        plan.getExecute().wake();

        plan.getExecute().go();

        Path scripts = workdir.resolve("execute/scripts");
        assertTrue(Files.isRegularFile(scripts.resolve("testbed-report-result")));
        assertTrue(Files.isRegularFile(scripts.resolve("testbed-file-submit")));
        verify(guest).push(eq(scripts.resolve("testbed-report-result")), eq("/usr/bin/rstrnt-report-result"), anyList());
        // Two scripts, seven install locations in total
        verify(guest, times(7)).push(any(Path.class), anyString(), eq(List.of("-p", "--chmod=755")));
    }

    @Test
    void go_beakerlibFrameworkReadsTestResults() {
        Plan plan = plan(StepData.of("beakerlib"),
                DiscoveredTest.builder("/tests/beakerlib").test("./beakerlib.sh").build());
        Execute execute = plan.getExecute();
        execute.wake();

        execute.go();

        Result result = execute.results().get(0);
        assertEquals("beakerlib", execute.getFramework());
        assertEquals(ResultOutcome.PASS, result.getResult());
        assertEquals(List.of("data/tests/beakerlib/output.txt"), result.getLog());
    }

    @Test
    void go_exitFirstStopsAfterFailure() {
        Plan plan = plan(StepData.of("tmt", Map.of("exit-first", true)),
                DiscoveredTest.builder("/tests/broken").test("false").build(),
                DiscoveredTest.builder("/tests/ok").test("./ok.sh").build());
        plan.getExecute().wake();

        plan.getExecute().go();

        assertEquals(1, plan.getExecute().results().size());
        verify(guest, times(1)).run(anyString(), anyMap(), any());
    }

    @Test
    void requires_beakerlibWhenFrameworkIsBeakerlib() {
        Plan shell = plan(StepData.of("tmt"), DiscoveredTest.builder("/tests/ok").test("./ok.sh").build());
        shell.getExecute().wake();
        assertTrue(shell.getExecute().requires().isEmpty());

        Plan beakerlib = Plan.builder("/plans/beakerlib")
                .workdir(workdir.resolve("other"))
                .registry(registry)
                .config(TestbedConfig.builder().workdirRoot(workdir).build())
                .execute(StepData.of("beakerlib"))
                .build();
        beakerlib.getExecute().wake();
        assertEquals(List.of("beakerlib"), List.copyOf(beakerlib.getExecute().requires()));
    }
}
