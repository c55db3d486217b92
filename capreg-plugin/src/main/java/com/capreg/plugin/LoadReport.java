package com.capreg.plugin;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of a load: one {@link ModuleOutcome} per module (file or built-in hook), in scan order.
 * Failures never abort the scan under {@link LoadPolicy#BEST_EFFORT}; they are collected here.
 */
public final class LoadReport {

    private final Path root;
    private final List<ModuleOutcome> outcomes;

    LoadReport(Path root, List<ModuleOutcome> outcomes) {
        this.root = root;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    static LoadReport empty(Path root) {
        return new LoadReport(root, List.of());
    }

    /** Scanned directory; null for built-in activation. */
    public Path getRoot() {
        return root;
    }

    public List<ModuleOutcome> getOutcomes() {
        return outcomes;
    }

    /** All failures across modules, in scan order. */
    public List<PluginException> getFailures() {
        return outcomes.stream().flatMap(o -> o.getFailures().stream()).collect(Collectors.toList());
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(o -> !o.isSuccess());
    }

    public int getModuleCount() {
        return outcomes.size();
    }

    public int getSucceededCount() {
        return (int) outcomes.stream().filter(ModuleOutcome::isSuccess).count();
    }

    public int getFailedCount() {
        return getModuleCount() - getSucceededCount();
    }

    /** True when at least one module was scanned and none succeeded. */
    public boolean allFailed() {
        return !outcomes.isEmpty() && getSucceededCount() == 0;
    }

    @Override
    public String toString() {
        return "LoadReport{root=" + root + ", modules=" + getModuleCount() + ", succeeded=" + getSucceededCount()
                + ", failed=" + getFailedCount() + "}";
    }

    /** Result for one module: hooks that ran successfully and failures, if any. */
    public static final class ModuleOutcome {
        private final String module;
        private final List<String> hooks;
        private final List<PluginException> failures;

        ModuleOutcome(String module, List<String> hooks, List<PluginException> failures) {
            this.module = Objects.requireNonNull(module, "module");
            this.hooks = hooks != null ? List.copyOf(hooks) : List.of();
            this.failures = failures != null ? List.copyOf(failures) : List.of();
        }

        static ModuleOutcome failed(String module, PluginException failure) {
            return new ModuleOutcome(module, List.of(), List.of(failure));
        }

        /** Module file path or {@code builtin:<hook>}. */
        public String getModule() {
            return module;
        }

        /** Names of hooks that completed without error. */
        public List<String> getHooks() {
            return hooks;
        }

        public List<PluginException> getFailures() {
            return failures;
        }

        public boolean isSuccess() {
            return failures.isEmpty();
        }
    }
}
