package com.testbed.errors;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reading or writing a workdir file failed. The caller is expected to halt the step run.
 */
public final class FileException extends TestbedException {

    private final Path path;

    public FileException(Path path, String action, IOException cause) {
        super(String.format("Failed to %s '%s': %s", action, path, cause.getMessage()), cause);
        this.path = path;
    }

    /** A workdir file was read but its content is not valid. */
    public FileException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public FileException(String message) {
        super(message);
        this.path = null;
    }

    /** File the failed operation targeted; null when not tied to a single file. */
    public Path getPath() {
        return path;
    }
}
