package com.testbed.steps.execute;

import java.util.List;
import java.util.Objects;

/**
 * Helper script installed on guests before tests run.
 *
 * @param path             install location on the guest; the file name also names the source
 * @param aliases          additional install locations (compatibility names)
 * @param relatedVariables environment variables the script reads
 */
public record Script(String path, List<String> aliases, List<String> relatedVariables) {

    public Script {
        Objects.requireNonNull(path, "path");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        relatedVariables = relatedVariables != null ? List.copyOf(relatedVariables) : List.of();
    }

    /** File name of the script source, e.g. {@code testbed-report-result}. */
    public String sourceName() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
