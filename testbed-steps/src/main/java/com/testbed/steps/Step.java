package com.testbed.steps;

import com.testbed.config.StepData;
import com.testbed.config.TestbedConfig;
import com.testbed.errors.FileException;
import com.testbed.plugin.Plugin;
import com.testbed.plugin.StepContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One stage of a plan. Holds the stage's configuration records, status and the phases
 * (plugin instances) built from those records.
 * <p>
 * Lifecycle: constructed with the plan, {@link #wake()} restores persisted state and builds the
 * phases, {@link #go()} runs them. State is kept in {@code <plan workdir>/<step>/step.yaml} so a
 * later process resumes where an earlier one stopped.
 *
 * @param <P> phase type
 */
public abstract class Step<P extends Plugin<?>> implements StepContext {

    private static final Logger log = LoggerFactory.getLogger(Step.class);

    public static final String STEP_FILE = "step.yaml";

    static final String KEY_STATUS = "status";
    static final String KEY_DATA = "data";

    protected final Plan plan;
    private final String name;
    private final String defaultHow;
    private final Path workdir;
    private List<StepData> data;
    private StepStatus status;
    private boolean loaded;
    private final List<P> phases = new ArrayList<>();

    protected Step(Plan plan, String name, String defaultHow, List<StepData> data) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.name = Objects.requireNonNull(name, "name");
        this.defaultHow = Objects.requireNonNull(defaultHow, "defaultHow");
        this.workdir = plan.getWorkdir().resolve(name);
        this.data = normalize(data);
    }

    /** Empty config becomes one default record; missing how and name are filled in. */
    private List<StepData> normalize(List<StepData> records) {
        List<StepData> result = new ArrayList<>();
        if (records == null || records.isEmpty()) {
            result.add(StepData.of(defaultHow));
        } else {
            result.addAll(records);
        }
        for (int i = 0; i < result.size(); i++) {
            StepData d = result.get(i);
            if (d.getHow() == null) d = d.withHow(defaultHow);
            if (d.getName() == null) d = d.withName("default-" + i);
            result.set(i, d);
        }
        return result;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Path getWorkdir() {
        return workdir;
    }

    @Override
    public String getPlanName() {
        return plan.getName();
    }

    @Override
    public TestbedConfig getConfig() {
        return plan.getConfig();
    }

    public Plan getPlan() {
        return plan;
    }

    /** Default method used for records without {@code how}. */
    public String getDefaultHow() {
        return defaultHow;
    }

    public List<StepData> getData() {
        return Collections.unmodifiableList(data);
    }

    protected void setData(List<StepData> data) {
        this.data = normalize(data);
    }

    /** Current status; null until the step was woken up or loaded. */
    public StepStatus getStatus() {
        return status;
    }

    protected void setStatus(StepStatus status) {
        if (status != this.status) {
            log.debug("{} status: {} | plan={}", name, status, getPlanName());
        }
        this.status = status;
    }

    public boolean isDone() {
        return status == StepStatus.DONE;
    }

    /** Whether the last {@link #load()} found persisted state. */
    protected boolean isLoaded() {
        return loaded;
    }

    public List<P> phases() {
        return Collections.unmodifiableList(phases);
    }

    public <T extends Plugin<?>> List<T> phases(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (P phase : phases) {
            if (type.isInstance(phase)) result.add(type.cast(phase));
        }
        return result;
    }

    public void addPhase(P phase) {
        phases.add(Objects.requireNonNull(phase, "phase"));
    }

    /** Restores persisted state and drops previously built phases. Subclasses rebuild them. */
    public void wake() {
        load();
        phases.clear();
    }

    /** Moves to {@code todo} and persists, unless the step finished in an earlier run. */
    protected void markTodoUnlessDone() {
        if (isDone()) {
            log.info("Step '{}' already done before | plan={}", name, getPlanName());
        } else {
            setStatus(StepStatus.TODO);
            save();
        }
    }

    public abstract void go();

    /** Logs and returns the step summary. */
    public abstract String summary();

    /** Package names required on guests by all phases, without duplicates, in phase order. */
    public Set<String> requires() {
        Set<String> requires = new LinkedHashSet<>();
        for (P phase : phases) {
            requires.addAll(phase.requires());
        }
        return requires;
    }

    /** Logs the configuration of every phase. */
    public void show() {
        log.info("{} | plan={}", name, getPlanName());
        for (P phase : phases) {
            phase.show();
        }
    }

    /** Loads status, data and step specific state from {@code step.yaml}, if present. */
    public void load() {
        Path file = workdir.resolve(STEP_FILE);
        loaded = Files.isRegularFile(file);
        if (!loaded) {
            log.debug("No saved state for step '{}' | file={}", name, file);
            return;
        }
        Map<String, Object> content = StepYaml.loadMap(file);
        try {
            Object savedStatus = content.get(KEY_STATUS);
            status = savedStatus != null ? StepStatus.fromValue(savedStatus.toString()) : null;
            Object savedData = content.get(KEY_DATA);
            if (savedData instanceof List<?> records && !records.isEmpty()) {
                List<StepData> restored = new ArrayList<>();
                for (Object record : records) {
                    if (record instanceof Map<?, ?> map) {
                        Map<String, Object> values = new LinkedHashMap<>();
                        map.forEach((k, v) -> values.put(String.valueOf(k), v));
                        restored.add(StepData.fromMap(values));
                    }
                }
                data = normalize(restored);
            }
        } catch (IllegalArgumentException e) {
            throw new FileException("Invalid step state in '" + file + "': " + e.getMessage(), file, e);
        }
        loadState(content);
        log.debug("Loaded step '{}' | status={} | records={}", name, status, data.size());
    }

    /** Persists status, data and step specific state to {@code step.yaml}. */
    public void save() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(KEY_STATUS, status != null ? status.value() : null);
        List<Map<String, Object>> records = new ArrayList<>();
        for (StepData d : data) {
            records.add(d.toMap());
        }
        content.put(KEY_DATA, records);
        saveState(content);
        StepYaml.write(workdir.resolve(STEP_FILE), StepYaml.dump(content), false);
    }

    /** Hook for subclass state stored next to status and data. */
    protected void loadState(Map<String, Object> content) {
    }

    protected void saveState(Map<String, Object> content) {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getPlanName() + "/" + name + ", status=" + status + "}";
    }
}
