package com.testbed.steps;

import com.testbed.config.StepData;
import com.testbed.config.TestbedConfig;
import com.testbed.discover.Discover;
import com.testbed.guest.Provision;
import com.testbed.plugin.PluginRegistry;
import com.testbed.steps.execute.Execute;
import com.testbed.steps.report.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named plan: owns its execute and report steps and gives them access to the discovered tests,
 * the provisioned guests and the method registry.
 */
public final class Plan {

    private static final Logger log = LoggerFactory.getLogger(Plan.class);

    private final String name;
    private final Path workdir;
    private final Path tree;
    private final TestbedConfig config;
    private final Discover discover;
    private final Provision provision;
    private final PluginRegistry registry;
    private final boolean partOfRun;
    private final Execute execute;
    private final Report report;

    private Plan(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.config = b.config != null ? b.config : TestbedConfig.fromEnvironment();
        this.workdir = b.workdir != null
                ? b.workdir
                : config.getWorkdirRoot().resolve(name.replaceFirst("^/+", ""));
        this.tree = b.tree;
        this.discover = b.discover != null ? b.discover : List::of;
        this.provision = b.provision != null ? b.provision : List::of;
        this.registry = b.registry != null ? b.registry : PluginRegistry.getInstance();
        this.partOfRun = b.partOfRun;
        this.execute = new Execute(this, b.execute);
        this.report = new Report(this, b.report);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Path getWorkdir() {
        return workdir;
    }

    /** Root of the metadata tree the tests come from; null when unknown. */
    public Path getTree() {
        return tree;
    }

    public TestbedConfig getConfig() {
        return config;
    }

    public Discover getDiscover() {
        return discover;
    }

    public Provision getProvision() {
        return provision;
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    /** Whether the plan belongs to a run whose state may be resumed from the workdir. */
    public boolean isPartOfRun() {
        return partOfRun;
    }

    public Execute getExecute() {
        return execute;
    }

    public Report getReport() {
        return report;
    }

    public void wake() {
        log.info("Wake up plan {} | workdir={}", name, workdir);
        execute.wake();
        report.wake();
    }

    /** Runs the execute step, then the report step. */
    public void go() {
        log.info("Run plan {}", name);
        execute.go();
        report.go();
    }

    public void show() {
        execute.show();
        report.show();
    }

    @Override
    public String toString() {
        return "Plan{" + name + "}";
    }

    public static final class Builder {
        private final String name;
        private Path workdir;
        private Path tree;
        private TestbedConfig config;
        private Discover discover;
        private Provision provision;
        private PluginRegistry registry;
        private boolean partOfRun;
        private final List<StepData> execute = new ArrayList<>();
        private final List<StepData> report = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder workdir(Path workdir) {
            this.workdir = workdir;
            return this;
        }

        public Builder tree(Path tree) {
            this.tree = tree;
            return this;
        }

        public Builder config(TestbedConfig config) {
            this.config = config;
            return this;
        }

        public Builder discover(Discover discover) {
            this.discover = discover;
            return this;
        }

        public Builder provision(Provision provision) {
            this.provision = provision;
            return this;
        }

        public Builder registry(PluginRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder partOfRun(boolean partOfRun) {
            this.partOfRun = partOfRun;
            return this;
        }

        public Builder execute(StepData data) {
            this.execute.add(data);
            return this;
        }

        public Builder execute(List<StepData> data) {
            this.execute.addAll(data);
            return this;
        }

        public Builder report(StepData data) {
            this.report.add(data);
            return this;
        }

        public Builder report(List<StepData> data) {
            this.report.addAll(data);
            return this;
        }

        public Plan build() {
            return new Plan(this);
        }
    }
}
