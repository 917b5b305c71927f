package com.testbed.guest;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A provisioned environment that receives files and runs commands. Transports (ssh, containers,
 * local processes) live outside this repository; implementations report transport failures as
 * {@link com.testbed.errors.GuestException}.
 * <p>
 * Implementations are used from a single thread; the execute step visits guests sequentially.
 */
public interface Guest {

    /** Guest name, unique within a plan. */
    String getName();

    /** Optional role used by phase {@code where} filters; null when the guest has none. */
    default String getRole() {
        return null;
    }

    /** Whether the guest is provisioned and may take part in a {@code go()} pass. */
    boolean isReady();

    /**
     * Copies a local file or directory to the guest.
     *
     * @param source      local path
     * @param destination path on the guest
     * @param options     transport options, e.g. {@code -p}, {@code --chmod=755}
     */
    void push(Path source, String destination, List<String> options);

    /** Copies {@code directory} (same path on both sides) to the guest. */
    default void push(Path directory) {
        push(directory, directory.toString(), List.of());
    }

    /**
     * Copies a file or directory from the guest back to the local side.
     *
     * @param source      path on the guest
     * @param destination local path
     * @param options     transport options
     */
    void pull(String source, Path destination, List<String> options);

    /** Copies {@code directory} (same path on both sides) back from the guest. */
    default void pull(Path directory) {
        pull(directory.toString(), directory, List.of());
    }

    /**
     * Runs a shell command on the guest.
     *
     * @param command     shell command line
     * @param environment extra environment variables
     * @param timeout     maximum run time; null = no limit. A command killed by the timeout
     *                    returns exit code {@link CommandResult#PROCESS_TIMEOUT}
     * @return exit code and captured output
     */
    CommandResult run(String command, Map<String, String> environment, Duration timeout);

    /** Runs a command without extra environment or timeout and returns its exit code. */
    default int run(String command) {
        return run(command, Map.of(), null).exitCode();
    }
}
