package com.testbed.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One phase configuration record of a step, e.g. {@code {how: tmt, exit-first: true}}.
 * Serialized as a flat mapping; {@code how} selects the plugin method and {@code name}
 * identifies the phase within its step. All other keys are plugin options.
 * <p>
 * Immutable: {@link #withHow(String)} and {@link #withName(String)} return modified copies.
 */
public final class StepData {

    public static final String KEY_HOW = "how";
    public static final String KEY_NAME = "name";

    private final Map<String, Object> values;

    private StepData(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @JsonCreator
    public static StepData fromMap(Map<String, Object> values) {
        return new StepData(values != null ? values : Map.of());
    }

    /** Record with only {@code how} set. */
    public static StepData of(String how) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(KEY_HOW, how);
        return new StepData(m);
    }

    /** Record with {@code how} and the given options. */
    public static StepData of(String how, Map<String, Object> options) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(KEY_HOW, how);
        if (options != null) {
            options.forEach((k, v) -> {
                if (!KEY_HOW.equals(k)) m.put(k, v);
            });
        }
        return new StepData(m);
    }

    /** Method name, or null when the record does not set one. */
    public String getHow() {
        Object how = values.get(KEY_HOW);
        return how != null ? how.toString() : null;
    }

    /** Phase name, or null when the record does not set one. */
    public String getName() {
        Object name = values.get(KEY_NAME);
        return name != null ? name.toString() : null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Object get(String key, Object defaultValue) {
        Object v = values.get(key);
        return v != null ? v : defaultValue;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /** Boolean option; accepts booleans and the strings true/false/1/0. */
    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = values.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Boolean b) return b;
        return TestbedConfig.parseBoolean(v.toString(), defaultValue);
    }

    /** Option that may be given as a single string or a list of strings. Never null. */
    public List<String> getStringList(String key) {
        Object v = values.get(key);
        if (v == null) return List.of();
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) out.add(item.toString());
            }
            return List.copyOf(out);
        }
        return List.of(v.toString());
    }

    public StepData withHow(String how) {
        return with(KEY_HOW, how);
    }

    public StepData withName(String name) {
        return with(KEY_NAME, name);
    }

    public StepData with(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>(values);
        m.put(Objects.requireNonNull(key, "key"), value);
        return new StepData(m);
    }

    /** Read-only view of all keys, {@code how} and {@code name} included. */
    @JsonValue
    public Map<String, Object> toMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((StepData) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
