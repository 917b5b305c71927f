package com.testbed.guest;

/**
 * Outcome of a command run on a guest. {@code exitCode} {@value #PROCESS_TIMEOUT} means the
 * guest killed the command after its timeout.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    /** Exit code reported for a command killed by its timeout. */
    public static final int PROCESS_TIMEOUT = 124;

    public CommandResult {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    public static CommandResult of(int exitCode) {
        return new CommandResult(exitCode, "", "");
    }

    public boolean timedOut() {
        return exitCode == PROCESS_TIMEOUT;
    }
}
