package com.capreg.plugin;

import com.capreg.registry.Catalog;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers plugin modules and feeds them into a {@link Catalog} through their {@link RegistrationHook}s.
 * <p>
 * Per module file (matching the configured extension under the scanned root):
 * <ol>
 *   <li>open it as a JAR; failure → {@link PluginLoadException}</li>
 *   <li>require the {@value #HOOK_SERVICE_ENTRY} entry; missing → {@link PluginContractException}</li>
 *   <li>instantiate the listed hooks through a {@link URLClassLoader} whose parent is a
 *       {@link RestrictedPluginClassLoader}; a provider that is missing, not a {@link RegistrationHook} or not
 *       instantiable → {@link PluginContractException}</li>
 *   <li>call each hook with the catalog; a thrown exception → {@link PluginRegistrationException}</li>
 * </ol>
 * Failures are recorded per module and the scan continues; the {@link LoadPolicy} decides whether the load
 * as a whole fails. Built-in hooks (compile-time, part of the host) are added with
 * {@link #registerBuiltin(RegistrationHook)} and run by {@link #activateBuiltins()}.
 * <p>
 * Module classloaders are kept open so hook classes stay usable, at most one per module file: loading the same
 * file again closes the loader of the previous activation. {@link #close()} releases all of them.
 */
public final class PluginLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    /** Service file a module must contain to expose registration hooks. */
    public static final String HOOK_SERVICE_ENTRY = "META-INF/services/com.capreg.plugin.RegistrationHook";

    public static final String METRIC_MODULES = "capreg.plugin.modules";
    private static final String BUILTIN_PREFIX = "builtin:";

    private final Catalog catalog;
    private final LoadPolicy policy;
    private final String extension;
    private final boolean recursive;
    private final MeterRegistry meterRegistry;
    private final List<RegistrationHook> builtinHooks = new CopyOnWriteArrayList<>();
    private final Map<String, URLClassLoader> moduleLoaders = new ConcurrentHashMap<>();

    private PluginLoader(Builder b) {
        this.catalog = b.catalog;
        this.policy = b.policy;
        this.extension = b.extension;
        this.recursive = b.recursive;
        this.meterRegistry = b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry();
    }

    /** Loader with defaults: best-effort policy, {@code .jar} modules, recursive scan. */
    public PluginLoader(Catalog catalog) {
        this(builder(catalog));
    }

    public static Builder builder(Catalog catalog) {
        return new Builder(catalog);
    }

    public LoadPolicy getPolicy() {
        return policy;
    }

    /** Registry holding the {@value #METRIC_MODULES} counters. */
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /** Adds a built-in hook (compiled into the host). Run by {@link #activateBuiltins()}. */
    public void registerBuiltin(RegistrationHook hook) {
        if (hook != null) {
            builtinHooks.add(hook);
        }
    }

    public List<RegistrationHook> getBuiltinHooks() {
        return List.copyOf(builtinHooks);
    }

    /**
     * Runs every built-in hook against the catalog. Each hook is its own module in the report; the policy
     * applies the same way as for {@link #loadAll(Path)}.
     *
     * @return report with one outcome per built-in hook
     * @throws PluginLoadingFailedException if the policy deems the activation failed
     */
    public LoadReport activateBuiltins() {
        List<LoadReport.ModuleOutcome> outcomes = new ArrayList<>();
        for (RegistrationHook hook : builtinHooks) {
            String module = BUILTIN_PREFIX + hook.getName();
            LoadReport.ModuleOutcome outcome = invokeHooks(module, List.of(hook));
            record(outcomes, outcome, null);
        }
        return finish(null, outcomes);
    }

    /**
     * Scans {@code pluginDir} for module files and activates each one. A missing or non-directory root
     * yields an empty report.
     *
     * @param pluginDir directory to scan
     * @return per-module outcomes, including recorded failures
     * @throws PluginLoadingFailedException when every scanned module failed ({@link LoadPolicy#BEST_EFFORT})
     *                                      or on the first failure ({@link LoadPolicy#FAIL_FAST})
     */
    public LoadReport loadAll(Path pluginDir) {
        Objects.requireNonNull(pluginDir, "pluginDir");
        if (!Files.exists(pluginDir)) {
            log.debug("Plugin directory does not exist: {}", pluginDir);
            return LoadReport.empty(pluginDir);
        }
        if (!Files.isDirectory(pluginDir)) {
            log.warn("Plugin path is not a directory: {}", pluginDir);
            return LoadReport.empty(pluginDir);
        }
        List<LoadReport.ModuleOutcome> outcomes = new ArrayList<>();
        List<Path> modules;
        try {
            modules = findModules(pluginDir);
        } catch (IOException e) {
            log.error("Failed to list plugin directory {}: {}", pluginDir, e.getMessage(), e);
            PluginLoadException failure = new PluginLoadException(pluginDir.toString(), "cannot list directory", e);
            record(outcomes, LoadReport.ModuleOutcome.failed(pluginDir.toString(), failure), pluginDir);
            return finish(pluginDir, outcomes);
        }
        log.info("Found {} plugin module(s) in {}", modules.size(), pluginDir);
        for (Path module : modules) {
            record(outcomes, activate(module), pluginDir);
        }
        return finish(pluginDir, outcomes);
    }

    /**
     * Activates a single module file.
     *
     * @throws PluginLoadingFailedException if the module failed
     */
    public LoadReport loadPlugin(Path module) {
        Objects.requireNonNull(module, "module");
        List<LoadReport.ModuleOutcome> outcomes = new ArrayList<>();
        LoadReport.ModuleOutcome outcome = hasExtension(module)
                ? activate(module)
                : LoadReport.ModuleOutcome.failed(module.toString(),
                new PluginLoadException(module.toString(), "not a plugin module (expected *" + extension + ")", null));
        record(outcomes, outcome, module.getParent());
        return finish(module.getParent(), outcomes);
    }

    private List<Path> findModules(Path root) throws IOException {
        try (Stream<Path> paths = recursive ? Files.walk(root) : Files.list(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(this::hasExtension)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean hasExtension(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(extension);
    }

    /** Opens, validates and invokes one module. Never throws; failures are returned in the outcome. */
    private LoadReport.ModuleOutcome activate(Path path) {
        String module = path.toString();
        try (JarFile jar = new JarFile(path.toFile())) {
            if (jar.getJarEntry(HOOK_SERVICE_ENTRY) == null) {
                return LoadReport.ModuleOutcome.failed(module, new PluginContractException(module,
                        "no registration hook (missing " + HOOK_SERVICE_ENTRY + ")"));
            }
        } catch (IOException | SecurityException e) {
            return LoadReport.ModuleOutcome.failed(module, new PluginLoadException(module, "cannot open module: " + e.getMessage(), e));
        }

        URLClassLoader loader;
        try {
            URL url = path.toUri().toURL();
            loader = new URLClassLoader(new URL[]{url}, new RestrictedPluginClassLoader());
        } catch (MalformedURLException e) {
            return LoadReport.ModuleOutcome.failed(module, new PluginLoadException(module, "invalid module path", e));
        }

        List<RegistrationHook> hooks = new ArrayList<>();
        try {
            for (RegistrationHook hook : ServiceLoader.load(RegistrationHook.class, loader)) {
                hooks.add(hook);
            }
        } catch (ServiceConfigurationError | LinkageError e) {
            closeQuietly(loader, module);
            return LoadReport.ModuleOutcome.failed(module, new PluginContractException(module,
                    "registration hook does not match contract: " + e.getMessage(), e));
        }
        if (hooks.isEmpty()) {
            closeQuietly(loader, module);
            return LoadReport.ModuleOutcome.failed(module, new PluginContractException(module,
                    "no registration hook declared in " + HOOK_SERVICE_ENTRY));
        }
        URLClassLoader previous = moduleLoaders.put(module, loader);
        if (previous != null) {
            // reload of the same file; registered entries are copies and do not pin the old loader
            closeQuietly(previous, module);
        }
        return invokeHooks(module, hooks);
    }

    private LoadReport.ModuleOutcome invokeHooks(String module, List<RegistrationHook> hooks) {
        List<String> ran = new ArrayList<>();
        List<PluginException> failures = new ArrayList<>();
        for (RegistrationHook hook : hooks) {
            String name = hookName(hook);
            try {
                hook.register(catalog);
                ran.add(name);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                failures.add(new PluginRegistrationException(module, name, e));
            }
        }
        return new LoadReport.ModuleOutcome(module, ran, failures);
    }

    private static String hookName(RegistrationHook hook) {
        try {
            String n = hook.getName();
            return (n == null || n.isBlank()) ? hook.getClass().getName() : n;
        } catch (RuntimeException e) {
            return hook.getClass().getName();
        }
    }

    /** Appends the outcome, logs it, counts it, and stops the load under FAIL_FAST. */
    private void record(List<LoadReport.ModuleOutcome> outcomes, LoadReport.ModuleOutcome outcome, Path root) {
        outcomes.add(outcome);
        if (outcome.isSuccess()) {
            meterRegistry.counter(METRIC_MODULES, "outcome", "loaded").increment();
            log.info("Loaded plugin module {} (hooks={})", outcome.getModule(), outcome.getHooks());
            return;
        }
        for (PluginException failure : outcome.getFailures()) {
            meterRegistry.counter(METRIC_MODULES, "outcome", failure.getKind()).increment();
            log.error("Plugin module {} failed ({}): {}", outcome.getModule(), failure.getKind(),
                    failure.getMessage(), failure.getCause());
        }
        if (policy == LoadPolicy.FAIL_FAST) {
            LoadReport partial = new LoadReport(root, outcomes);
            throw new PluginLoadingFailedException("Plugin loading stopped at first failure: " + outcome.getModule(), partial);
        }
    }

    private LoadReport finish(Path root, List<LoadReport.ModuleOutcome> outcomes) {
        LoadReport report = new LoadReport(root, outcomes);
        if (report.getModuleCount() > 0) {
            log.info("Plugin load finished: {} module(s), {} succeeded, {} failed{}",
                    report.getModuleCount(), report.getSucceededCount(), report.getFailedCount(),
                    root != null ? " (dir=" + root + ")" : "");
        }
        if (report.allFailed()) {
            throw new PluginLoadingFailedException("All " + report.getModuleCount() + " plugin module(s) failed to load", report);
        }
        return report;
    }

    private static void closeQuietly(URLClassLoader loader, String module) {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Failed to close classloader for module {}: {}", module, e.getMessage());
        }
    }

    /** Closes all module classloaders. Hooks from closed modules must not be used afterwards. */
    @Override
    public void close() {
        moduleLoaders.forEach((module, loader) -> closeQuietly(loader, module));
        moduleLoaders.clear();
    }

    /** Number of module classloaders currently held open. */
    int openModuleCount() {
        return moduleLoaders.size();
    }

    public static final class Builder {
        private final Catalog catalog;
        private LoadPolicy policy = LoadPolicy.BEST_EFFORT;
        private String extension = ".jar";
        private boolean recursive = true;
        private MeterRegistry meterRegistry;

        private Builder(Catalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
        }

        public Builder policy(LoadPolicy policy) {
            this.policy = policy != null ? policy : LoadPolicy.BEST_EFFORT;
            return this;
        }

        /** Module file extension, matched case-insensitively; a leading dot is added if missing. */
        public Builder extension(String extension) {
            if (extension != null && !extension.isBlank()) {
                String e = extension.trim().toLowerCase(Locale.ROOT);
                this.extension = e.startsWith(".") ? e : "." + e;
            }
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public PluginLoader build() {
            return new PluginLoader(this);
        }
    }
}
