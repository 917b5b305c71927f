package com.testbed.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Process-wide settings loaded from environment variables.
 * <p>
 * Workdir: TESTBED_WORKDIR_ROOT. Community plugin jars: TESTBED_PLUGINS_DIR.
 * Helper script sources: TESTBED_SCRIPTS_DIR (unset = scripts bundled on the classpath).
 * Execution defaults: TESTBED_EXIT_FIRST, TESTBED_DEFAULT_DURATION.
 */
public final class TestbedConfig {

    private static final String ENV_WORKDIR_ROOT = "TESTBED_WORKDIR_ROOT";
    private static final String ENV_PLUGINS_DIR = "TESTBED_PLUGINS_DIR";
    private static final String ENV_SCRIPTS_DIR = "TESTBED_SCRIPTS_DIR";
    private static final String ENV_EXIT_FIRST = "TESTBED_EXIT_FIRST";
    private static final String ENV_DEFAULT_DURATION = "TESTBED_DEFAULT_DURATION";

    private static final String DEFAULT_WORKDIR_ROOT = "/var/tmp/testbed";
    private static final String DEFAULT_PLUGINS_DIR = "/opt/testbed/plugins";
    /** Test duration used when the test metadata does not set one. */
    public static final String DEFAULT_DURATION = "5m";

    private final Path workdirRoot;
    private final Path pluginsDir;
    private final Path scriptsDir;
    private final boolean exitFirst;
    private final String defaultDuration;

    private TestbedConfig(Builder b) {
        this.workdirRoot = b.workdirRoot;
        this.pluginsDir = b.pluginsDir;
        this.scriptsDir = b.scriptsDir;
        this.exitFirst = b.exitFirst;
        this.defaultDuration = b.defaultDuration;
    }

    /** Root directory under which each run gets its own workdir. Default {@value #DEFAULT_WORKDIR_ROOT}. */
    public Path getWorkdirRoot() {
        return workdirRoot;
    }

    /** Directory scanned for community plugin jars. Default {@value #DEFAULT_PLUGINS_DIR}. */
    public Path getPluginsDir() {
        return pluginsDir;
    }

    /** Directory holding helper script sources, or null to use the scripts bundled on the classpath. */
    public Path getScriptsDir() {
        return scriptsDir;
    }

    /** Default for the per-phase {@code exit-first} option. */
    public boolean isExitFirst() {
        return exitFirst;
    }

    /** Maximum test time applied when a test does not set {@code duration}. */
    public String getDefaultDuration() {
        return defaultDuration;
    }

    public static TestbedConfig fromEnvironment() {
        String scripts = System.getenv(ENV_SCRIPTS_DIR);
        return builder()
                .workdirRoot(Paths.get(getEnv(ENV_WORKDIR_ROOT, DEFAULT_WORKDIR_ROOT)))
                .pluginsDir(Paths.get(getEnv(ENV_PLUGINS_DIR, DEFAULT_PLUGINS_DIR)))
                .scriptsDir(scripts != null && !scripts.isBlank() ? Paths.get(scripts.trim()) : null)
                .exitFirst(parseBoolean(System.getenv(ENV_EXIT_FIRST), false))
                .defaultDuration(getEnv(ENV_DEFAULT_DURATION, DEFAULT_DURATION))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "TestbedConfig{workdirRoot=" + workdirRoot + ", pluginsDir=" + pluginsDir
                + ", scriptsDir=" + scriptsDir + ", exitFirst=" + exitFirst
                + ", defaultDuration=" + defaultDuration + "}";
    }

    public static final class Builder {
        private Path workdirRoot = Paths.get(DEFAULT_WORKDIR_ROOT);
        private Path pluginsDir = Paths.get(DEFAULT_PLUGINS_DIR);
        private Path scriptsDir;
        private boolean exitFirst;
        private String defaultDuration = DEFAULT_DURATION;

        public Builder workdirRoot(Path workdirRoot) {
            this.workdirRoot = Objects.requireNonNull(workdirRoot, "workdirRoot");
            return this;
        }

        public Builder pluginsDir(Path pluginsDir) {
            this.pluginsDir = pluginsDir;
            return this;
        }

        public Builder scriptsDir(Path scriptsDir) {
            this.scriptsDir = scriptsDir;
            return this;
        }

        public Builder exitFirst(boolean exitFirst) {
            this.exitFirst = exitFirst;
            return this;
        }

        public Builder defaultDuration(String defaultDuration) {
            this.defaultDuration = defaultDuration != null && !defaultDuration.isBlank()
                    ? defaultDuration.trim() : DEFAULT_DURATION;
            return this;
        }

        public TestbedConfig build() {
            return new TestbedConfig(this);
        }
    }
}
