package com.testbed.plugin;

import com.testbed.config.StepData;
import com.testbed.guest.Guest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One configured strategy instance (a phase) bound to a step. Created by a
 * {@link PluginProvider} from one {@link StepData} record; the record's {@code how}
 * selected the provider and its remaining keys are this instance's options.
 *
 * @param <S> step type the plugin works with
 */
public abstract class Plugin<S extends StepContext> {

    private static final Logger log = LoggerFactory.getLogger(Plugin.class);

    /** Option restricting the phase to guests with the given names or roles. */
    public static final String KEY_WHERE = "where";

    protected final S step;
    private final StepData data;

    protected Plugin(S step, StepData data) {
        this.step = Objects.requireNonNull(step, "step");
        this.data = Objects.requireNonNull(data, "data");
    }

    public S getStep() {
        return step;
    }

    public StepData getData() {
        return data;
    }

    public String getHow() {
        return data.getHow();
    }

    /** Phase name; falls back to {@code how} when the record has no name. */
    public String getName() {
        String name = data.getName();
        return name != null ? name : getHow();
    }

    public Object get(String key) {
        return data.get(key);
    }

    public Object get(String key, Object defaultValue) {
        return data.get(key, defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return data.getBoolean(key, defaultValue);
    }

    /** Prepares the phase after the step was woken up. Default only logs. */
    public void wake() {
        log.debug("Wake up phase {} | step={} | how={}", getName(), step.getName(), getHow());
    }

    /**
     * Packages that must be installed on guests before this phase runs. Consumed by the
     * prepare step. Default none.
     */
    public List<String> requires() {
        return List.of();
    }

    /**
     * Whether this phase runs on the given guest. Without a {@code where} option the phase
     * runs everywhere; otherwise the guest name or role must be listed.
     */
    public boolean enabledOnGuest(Guest guest) {
        List<String> where = data.getStringList(KEY_WHERE);
        if (where.isEmpty()) return true;
        return where.contains(guest.getName()) || (guest.getRole() != null && where.contains(guest.getRole()));
    }

    /** Logs the phase configuration. */
    public void show() {
        log.info("{} | how={}", getName(), getHow());
        for (Map.Entry<String, Object> e : data.toMap().entrySet()) {
            if (StepData.KEY_HOW.equals(e.getKey()) || StepData.KEY_NAME.equals(e.getKey())) continue;
            log.info("{} | {}={}", getName(), e.getKey(), e.getValue());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + step.getName() + "/" + getName() + "}";
    }
}
