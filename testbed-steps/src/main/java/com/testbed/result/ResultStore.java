package com.testbed.result;

import com.fasterxml.jackson.core.type.TypeReference;
import com.testbed.errors.FileException;
import com.testbed.steps.StepYaml;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code results.yaml}: a mapping from test name to its exported {@link Result} record, in
 * execution order.
 * <p>
 * A test that ran more than once (on several guests or in several phases) keeps its name as the
 * key for the first run. Later runs are keyed {@code name@guest}, with a {@code #n} suffix when
 * that is taken too, and carry the real test name in a {@code name} field.
 */
public final class ResultStore {

    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    public static final String RESULTS_FILE = "results.yaml";

    static final String KEY_NAME = "name";

    private static final TypeReference<LinkedHashMap<String, Map<String, Object>>> RESULTS_TYPE =
            new TypeReference<>() {};

    private ResultStore() {
    }

    public static String toYaml(List<Result> results) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (Result r : results) {
            Map<String, Object> record = r.export();
            String key = r.getName();
            if (data.containsKey(key)) {
                key = repeatedKey(data, r);
                record.put(KEY_NAME, r.getName());
                log.debug("Repeated result stored under a guest key | test={} | key={}", r.getName(), key);
            }
            data.put(key, record);
        }
        return StepYaml.dump(data);
    }

    private static String repeatedKey(Map<String, Object> taken, Result result) {
        String base = result.getGuest() != null ? result.getName() + "@" + result.getGuest() : result.getName();
        String key = base;
        for (int n = 2; taken.containsKey(key); n++) {
            key = base + "#" + n;
        }
        return key;
    }

    /**
     * @throws IllegalArgumentException if the document is not a mapping of result records or an
     *                                  outcome is missing or invalid
     */
    public static List<Result> fromYaml(String yaml) {
        Map<String, Map<String, Object>> data = StepYaml.convert(StepYaml.loadMap(yaml), RESULTS_TYPE);
        List<Result> results = new ArrayList<>(data.size());
        for (Map.Entry<String, Map<String, Object>> e : data.entrySet()) {
            Map<String, Object> record = e.getValue() != null ? e.getValue() : Map.of();
            Object name = record.get(KEY_NAME);
            results.add(Result.fromExport(name != null ? name.toString() : e.getKey(), record));
        }
        return results;
    }

    public static void save(Path workdir, List<Result> results) {
        StepYaml.write(workdir.resolve(RESULTS_FILE), toYaml(results), false);
    }

    public static boolean exists(Path workdir) {
        return Files.isRegularFile(workdir.resolve(RESULTS_FILE));
    }

    /**
     * @throws FileException when the file is missing, unreadable or not a valid results file
     */
    public static List<Result> load(Path workdir) {
        Path file = workdir.resolve(RESULTS_FILE);
        if (!Files.isRegularFile(file)) {
            throw new FileException("Results file '" + file + "' not found.");
        }
        String yaml = StepYaml.read(file);
        try {
            return fromYaml(yaml);
        } catch (IllegalArgumentException e) {
            throw new FileException("Invalid results file '" + file + "': " + e.getMessage(), file, e);
        }
    }
}
