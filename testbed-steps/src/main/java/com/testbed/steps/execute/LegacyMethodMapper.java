package com.testbed.steps.execute;

import com.testbed.config.StepData;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the deprecated execute methods {@code shell}, {@code beakerlib}, {@code shell.tmt} and
 * {@code beakerlib.tmt} to {@code how: tmt} plus a default test framework.
 */
public final class LegacyMethodMapper {

    private static final Pattern LEGACY_METHOD = Pattern.compile("^(shell|beakerlib)(\\.tmt)?$");

    private LegacyMethodMapper() {
    }

    /**
     * @param data             records as configured
     * @param defaultFramework framework to keep when nothing is remapped
     * @return the (possibly rewritten) records, framework and deprecation warnings
     */
    public static Mapping map(List<StepData> data, String defaultFramework) {
        if (data.isEmpty() || data.get(0).getHow() == null) {
            return new Mapping(data, defaultFramework, List.of());
        }
        StepData first = data.get(0);
        Matcher m = LEGACY_METHOD.matcher(first.getHow());
        if (!m.matches()) {
            return new Mapping(data, defaultFramework, List.of());
        }
        String framework = m.group(1);
        List<String> warnings = List.of(
                "The '" + first.getHow() + "' execute method has been deprecated.",
                "Use 'how: " + Execute.DEFAULT_HOW + "' in the execute step instead.",
                "Set 'framework: " + framework + "' in test metadata.",
                "Support for old methods will be dropped in a future release.");
        List<StepData> mapped = new ArrayList<>(data);
        mapped.set(0, first.withHow(Execute.DEFAULT_HOW));
        return new Mapping(List.copyOf(mapped), framework, warnings);
    }

    /**
     * Outcome of {@link #map(List, String)}.
     *
     * @param data      execute records to use
     * @param framework default test framework
     * @param warnings  deprecation warnings; empty when nothing was remapped
     */
    public record Mapping(List<StepData> data, String framework, List<String> warnings) {

        public boolean isLegacy() {
            return !warnings.isEmpty();
        }
    }
}
