package com.testbed.report.display;

import com.testbed.config.StepData;
import com.testbed.config.TestbedConfig;
import com.testbed.guest.Guest;
import com.testbed.plugin.Plugin;
import com.testbed.plugin.PluginProvider;
import com.testbed.plugin.PluginRegistry;
import com.testbed.plugin.StepContext;
import com.testbed.result.Result;
import com.testbed.result.ResultOutcome;
import com.testbed.steps.Plan;
import com.testbed.steps.execute.Execute;
import com.testbed.steps.execute.ExecutePlugin;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DisplayReportTest {

    private static final List<Result> RESULTS = List.of(
            Result.builder("/tests/a").result(ResultOutcome.PASS).addLog("data/tests/a/output.txt").build(),
            Result.builder("/tests/b").result(ResultOutcome.ERROR).addLog("data/tests/b/output.txt").note("timeout").build());

    @TempDir
    Path workdir;

    private Plan run(StepData report) {
        PluginRegistry registry = new PluginRegistry();
        registry.register(new CannedExecutorProvider());
        registry.register(new DisplayReportProvider());
        Guest guest = mock(Guest.class);
        when(guest.getName()).thenReturn("g1");
        when(guest.isReady()).thenReturn(true);
        Plan plan = Plan.builder("/plans/display")
                .workdir(workdir)
                .registry(registry)
                .config(TestbedConfig.builder().workdirRoot(workdir).build())
                .provision(() -> List.of(guest))
                .report(report)
                .build();
        plan.wake();
        plan.go();
        return plan;
    }

    @Test
    void lines_onePerResult() {
        Plan plan = run(StepData.of("display"));

        DisplayReport display = plan.getReport().phases(DisplayReport.class).get(0);

        assertEquals(List.of("pass /tests/a", "error /tests/b"), display.lines());
        assertEquals("1 test passed and 1 error", plan.getReport().summary());
    }

    @Test
    void lines_verboseAddsLogsAndNotes() {
        Plan plan = run(StepData.of("display", Map.of("verbose", true)));

        DisplayReport display = plan.getReport().phases(DisplayReport.class).get(0);

        Path execute = workdir.resolve("execute");
        assertEquals(List.of(
                "pass /tests/a",
                "    " + execute.resolve("data/tests/a/output.txt"),
                "error /tests/b",
                "    " + execute.resolve("data/tests/b/output.txt"),
                "    note: timeout"), display.lines());
    }

    @Test
    void missingHow_defaultsToDisplay() {
        Plan plan = run(StepData.fromMap(Map.of("name", "terminal")));

        assertEquals(1, plan.getReport().phases(DisplayReport.class).size());
        assertEquals("terminal", plan.getReport().phases().get(0).getName());
    }

    /** Execute method returning fixed results. */
    static final class CannedExecutorProvider implements PluginProvider {

        @Override
        public String getStepName() {
            return Execute.STEP_NAME;
        }

        @Override
        public String getMethodName() {
            return Execute.DEFAULT_HOW;
        }

        @Override
        public String getDescription() {
            return "Canned results";
        }

        @Override
        public Plugin<?> createPlugin(StepContext step, StepData data) {
            return new ExecutePlugin((Execute) step, data) {
                @Override
                public List<Result> results() {
                    return RESULTS;
                }
            };
        }
    }
}
