package com.testbed.result;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one test execution: test name, outcome, captured log paths (relative to the
 * execute step workdir), wall-clock duration, an optional note such as {@code timeout} and the
 * name of the guest the test ran on.
 */
public final class Result {

    static final String KEY_RESULT = "result";
    static final String KEY_LOG = "log";
    static final String KEY_DURATION = "duration";
    static final String KEY_NOTE = "note";
    static final String KEY_GUEST = "guest";

    private final String name;
    private final ResultOutcome result;
    private final List<String> log;
    private final String duration;
    private final String note;
    private final String guest;

    private Result(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.result = Objects.requireNonNull(b.result, "result");
        this.log = List.copyOf(b.log);
        this.duration = b.duration;
        this.note = b.note;
        this.guest = b.guest;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        return new Builder(name).result(result).log(log).duration(duration).note(note).guest(guest);
    }

    public String getName() {
        return name;
    }

    public ResultOutcome getResult() {
        return result;
    }

    public List<String> getLog() {
        return log;
    }

    /** {@code HH:MM:SS}; null when the test never ran. */
    public String getDuration() {
        return duration;
    }

    public String getNote() {
        return note;
    }

    /** Guest the test ran on; null when unknown. */
    public String getGuest() {
        return guest;
    }

    /**
     * Record stored under the test name in {@code results.yaml}:
     * {@code result}, {@code log}, {@code duration} and, when set, {@code note} and {@code guest}.
     */
    public Map<String, Object> export() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(KEY_RESULT, result.value());
        data.put(KEY_LOG, new ArrayList<>(log));
        data.put(KEY_DURATION, duration);
        if (note != null) {
            data.put(KEY_NOTE, note);
        }
        if (guest != null) {
            data.put(KEY_GUEST, guest);
        }
        return data;
    }

    /**
     * Rebuilds a result from its exported record. {@code log} may be a single string or a list.
     *
     * @throws IllegalArgumentException if the outcome is missing or invalid
     */
    public static Result fromExport(String name, Map<String, Object> data) {
        Object outcome = data.get(KEY_RESULT);
        Builder b = builder(name).result(ResultOutcome.fromValue(outcome != null ? outcome.toString() : null));
        Object log = data.get(KEY_LOG);
        if (log instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) b.addLog(item.toString());
            }
        } else if (log != null) {
            b.addLog(log.toString());
        }
        Object duration = data.get(KEY_DURATION);
        Object note = data.get(KEY_NOTE);
        Object guest = data.get(KEY_GUEST);
        return b.duration(duration != null ? duration.toString() : null)
                .note(note != null ? note.toString() : null)
                .guest(guest != null ? guest.toString() : null)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Result other = (Result) o;
        return name.equals(other.name)
                && result == other.result
                && log.equals(other.log)
                && Objects.equals(duration, other.duration)
                && Objects.equals(note, other.note)
                && Objects.equals(guest, other.guest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, result, log, duration, note, guest);
    }

    @Override
    public String toString() {
        return "Result{" + result + " " + name + (note != null ? " (" + note + ")" : "") + "}";
    }

    public static final class Builder {
        private final String name;
        private ResultOutcome result = ResultOutcome.ERROR;
        private final List<String> log = new ArrayList<>();
        private String duration;
        private String note;
        private String guest;

        private Builder(String name) {
            this.name = name;
        }

        public Builder result(ResultOutcome result) {
            this.result = result;
            return this;
        }

        public Builder log(List<String> log) {
            this.log.clear();
            if (log != null) this.log.addAll(log);
            return this;
        }

        public Builder addLog(String path) {
            this.log.add(Objects.requireNonNull(path, "path"));
            return this;
        }

        public Builder duration(String duration) {
            this.duration = duration;
            return this;
        }

        public Builder note(String note) {
            this.note = note;
            return this;
        }

        public Builder guest(String guest) {
            this.guest = guest;
            return this;
        }

        public Result build() {
            return new Result(this);
        }
    }
}
