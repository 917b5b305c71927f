package com.testbed.steps.execute;

import com.testbed.config.StepData;
import com.testbed.errors.ExecuteException;
import com.testbed.errors.SpecificationException;
import com.testbed.guest.Guest;
import com.testbed.result.Result;
import com.testbed.result.ResultStore;
import com.testbed.result.ResultSummary;
import com.testbed.steps.Plan;
import com.testbed.steps.Step;
import com.testbed.steps.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Runs the discovered tests on every ready guest and collects their results.
 * <p>
 * Exactly one configuration record is allowed. The results are stored in
 * {@code <workdir>/results.yaml} next to {@code step.yaml}.
 */
public class Execute extends Step<ExecutePlugin> {

    private static final Logger log = LoggerFactory.getLogger(Execute.class);

    public static final String STEP_NAME = "execute";
    public static final String DEFAULT_HOW = "tmt";

    static final String KEY_FRAMEWORK = "framework";

    private final List<Result> results = new ArrayList<>();
    private String framework = ExecutePlugin.DEFAULT_FRAMEWORK;

    public Execute(Plan plan, List<StepData> data) {
        super(plan, STEP_NAME, DEFAULT_HOW, data);
        // Resumable plans are remapped in wake(), once we know nothing was saved before
        if (!plan.isPartOfRun()) {
            mapLegacyMethods();
        }
    }

    private void mapLegacyMethods() {
        LegacyMethodMapper.Mapping mapping = LegacyMethodMapper.map(getData(), framework);
        if (!mapping.isLegacy()) return;
        for (String warning : mapping.warnings()) {
            log.warn("{} | plan={}", warning, getPlanName());
        }
        setData(mapping.data());
        framework = mapping.framework();
    }

    /** Default test framework for tests that do not name one: {@code shell} or {@code beakerlib}. */
    public String getFramework() {
        return framework;
    }

    @Override
    public void wake() {
        super.wake();
        if (getData().size() > 1) {
            throw new SpecificationException("Multiple execute steps defined in '" + getPlanName() + "'.");
        }
        if (!isLoaded()) {
            mapLegacyMethods();
        }
        ExecutePlugin phase = plan.getRegistry().delegate(this, getData().get(0), ExecutePlugin.class);
        phase.wake();
        addPhase(phase);
        markTodoUnlessDone();
    }

    @Override
    public void go() {
        if (isDone()) {
            log.info("Execute step already done | plan={} | status={}", getPlanName(), getStatus());
            summary();
            return;
        }
        List<Guest> guests = new ArrayList<>();
        for (Guest guest : plan.getProvision().guests()) {
            if (guest.isReady()) guests.add(guest);
        }
        if (guests.isEmpty()) {
            throw new ExecuteException("No guests available for execution.");
        }
        results.clear();
        for (Guest guest : guests) {
            for (ExecutePlugin phase : phases()) {
                if (!phase.enabledOnGuest(guest)) {
                    log.debug("Phase {} disabled on guest {}", phase.getName(), guest.getName());
                    continue;
                }
                log.info("Execute phase {} | plan={} | guest={}", phase.getName(), getPlanName(), guest.getName());
                phase.go(guest);
                for (Result result : phase.results()) {
                    results.add(result.getGuest() != null ? result : result.toBuilder().guest(guest.getName()).build());
                }
            }
        }
        summary();
        setStatus(StepStatus.DONE);
        save();
    }

    @Override
    public String summary() {
        String summary = ResultSummary.listed(results.size(), "test") + " executed";
        log.info("summary: {} | plan={}", summary, getPlanName());
        return summary;
    }

    /** Results of all executed tests, in execution order. */
    public List<Result> results() {
        return Collections.unmodifiableList(results);
    }

    @Override
    public void load() {
        super.load();
        if (!ResultStore.exists(getWorkdir())) {
            log.debug("Test results not found. | plan={} | workdir={}", getPlanName(), getWorkdir());
            return;
        }
        List<Result> loaded = ResultStore.load(getWorkdir());
        results.clear();
        results.addAll(loaded);
    }

    @Override
    public void save() {
        super.save();
        ResultStore.save(getWorkdir(), results);
    }

    @Override
    protected void loadState(Map<String, Object> content) {
        Object saved = content.get(KEY_FRAMEWORK);
        if (saved != null) {
            framework = saved.toString();
        }
    }

    @Override
    protected void saveState(Map<String, Object> content) {
        content.put(KEY_FRAMEWORK, framework);
    }
}
