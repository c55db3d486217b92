package com.capreg.plugin;

import com.capreg.plugin.fixtures.BrokenInvariantHook;
import com.capreg.plugin.fixtures.DockerApiHook;
import com.capreg.plugin.fixtures.FailingHook;
import com.capreg.plugin.fixtures.GitApiHook;
import com.capreg.plugin.fixtures.NotAHook;
import com.capreg.registry.Entry;
import com.capreg.registry.InMemoryCatalog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginLoaderTest {

    @TempDir
    Path pluginDir;

    private InMemoryCatalog catalog;
    private SimpleMeterRegistry meters;
    private PluginLoader loader;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryCatalog();
        meters = new SimpleMeterRegistry();
        loader = PluginLoader.builder(catalog).meterRegistry(meters).build();
    }

    @AfterEach
    void tearDown() {
        loader.close();
    }

    private Set<String> catalogIds() {
        return catalog.list().stream().map(Entry::getId).collect(Collectors.toSet());
    }

    private double count(String outcome) {
        return meters.counter(PluginLoader.METRIC_MODULES, "outcome", outcome).count();
    }

    @Test
    void loadAll_validModuleLandsAndMissingHookIsRecorded() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "git.jar", GitApiHook.class.getName());
        Path noHook = TestModules.moduleWithoutHook(pluginDir, "no-hook.jar");

        LoadReport report = loader.loadAll(pluginDir);

        assertEquals("Git API", catalog.get("git").orElseThrow().getName());
        assertEquals(2, report.getModuleCount());
        assertEquals(1, report.getSucceededCount());
        assertTrue(report.hasFailures());
        assertEquals(1, report.getFailures().size());
        PluginException failure = report.getFailures().get(0);
        assertInstanceOf(PluginContractException.class, failure);
        assertEquals(noHook.toString(), failure.getModule());
    }

    @Test
    void loadAll_remainingModulesLandWhenSomeFailValidation() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "a-git.jar", GitApiHook.class.getName());
        TestModules.moduleWithoutHook(pluginDir, "b-no-hook.jar");
        TestModules.moduleWithHooks(pluginDir, "c-wrong-signature.jar", NotAHook.class.getName());
        TestModules.moduleWithHooks(pluginDir, "d-docker.jar", DockerApiHook.class.getName());

        LoadReport report = loader.loadAll(pluginDir);

        assertEquals(Set.of("git", "docker"), catalogIds());
        assertEquals(4, report.getModuleCount());
        assertEquals(2, report.getFailedCount());
        assertTrue(report.getFailures().stream().allMatch(f -> f instanceof PluginContractException));
        assertEquals(2.0, count("loaded"));
        assertEquals(2.0, count("contract_error"));
    }

    @Test
    void loadAll_corruptModuleIsLoadErrorAndScanContinues() throws Exception {
        TestModules.corruptModule(pluginDir, "broken.jar");
        TestModules.moduleWithHooks(pluginDir, "git.jar", GitApiHook.class.getName());

        LoadReport report = loader.loadAll(pluginDir);

        assertEquals(Set.of("git"), catalogIds());
        assertInstanceOf(PluginLoadException.class, report.getFailures().get(0));
        assertEquals(1.0, count("load_error"));
    }

    @Test
    void loadAll_missingProviderClassIsContractError() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "ghost.jar", "com.capreg.plugin.fixtures.DoesNotExist");
        TestModules.moduleWithHooks(pluginDir, "empty-services.jar");
        TestModules.moduleWithHooks(pluginDir, "git.jar", GitApiHook.class.getName());

        LoadReport report = loader.loadAll(pluginDir);

        assertEquals(2, report.getFailedCount());
        assertTrue(report.getFailures().stream().allMatch(f -> f instanceof PluginContractException));
        assertEquals(Set.of("git"), catalogIds());
    }

    @Test
    void loadAll_failingHookIsRegistrationErrorAndKeepsEarlierRegistrations() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "failing.jar", FailingHook.class.getName());
        TestModules.moduleWithHooks(pluginDir, "git.jar", GitApiHook.class.getName());

        LoadReport report = loader.loadAll(pluginDir);

        PluginRegistrationException failure = assertInstanceOf(PluginRegistrationException.class, report.getFailures().get(0));
        assertEquals(FailingHook.class.getName(), failure.getHookName());
        assertEquals("upstream unavailable", failure.getCause().getMessage());
        assertEquals(Set.of("partial", "git"), catalogIds());
    }

    @Test
    void loadAll_moduleWithSeveralHooksRunsEachOne() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "bundle.jar", GitApiHook.class.getName(), DockerApiHook.class.getName());

        LoadReport report = loader.loadAll(pluginDir);

        assertFalse(report.hasFailures());
        assertEquals(List.of(GitApiHook.class.getName(), "docker"), report.getOutcomes().get(0).getHooks());
        assertEquals(Set.of("git", "docker"), catalogIds());
    }

    @Test
    void loadAll_throwsWhenEveryModuleFails() throws Exception {
        TestModules.moduleWithoutHook(pluginDir, "one.jar");
        TestModules.corruptModule(pluginDir, "two.jar");

        PluginLoadingFailedException ex = assertThrows(PluginLoadingFailedException.class, () -> loader.loadAll(pluginDir));

        assertEquals(2, ex.getReport().getFailedCount());
        assertTrue(ex.getReport().allFailed());
        assertTrue(catalog.list().isEmpty());
    }

    @Test
    void loadAll_failFastStopsAtFirstFailure() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "a-git.jar", GitApiHook.class.getName());
        TestModules.moduleWithoutHook(pluginDir, "b-no-hook.jar");
        TestModules.moduleWithHooks(pluginDir, "c-docker.jar", DockerApiHook.class.getName());
        PluginLoader failFast = PluginLoader.builder(catalog).policy(LoadPolicy.FAIL_FAST).build();

        try {
            PluginLoadingFailedException ex = assertThrows(PluginLoadingFailedException.class, () -> failFast.loadAll(pluginDir));

            assertEquals(2, ex.getReport().getModuleCount());
            assertInstanceOf(PluginContractException.class, ex.getCause());
            assertEquals(Set.of("git"), catalogIds());
        } finally {
            failFast.close();
        }
    }

    @Test
    void loadAll_missingDirectoryOrFileRootIsEmptyReport() throws Exception {
        LoadReport missing = loader.loadAll(pluginDir.resolve("absent"));
        assertEquals(0, missing.getModuleCount());

        Path file = Files.writeString(pluginDir.resolve("not-a-dir.txt"), "x");
        assertEquals(0, loader.loadAll(file).getModuleCount());
    }

    @Test
    void loadAll_emptyDirectoryIsNotAFailure() {
        LoadReport report = loader.loadAll(pluginDir);

        assertEquals(0, report.getModuleCount());
        assertFalse(report.allFailed());
    }

    @Test
    void loadAll_ignoresOtherExtensionsAndHonoursRecursion() throws Exception {
        Files.writeString(pluginDir.resolve("notes.txt"), "ignored");
        TestModules.moduleWithHooks(pluginDir.resolve("nested"), "git.jar", GitApiHook.class.getName());

        PluginLoader flat = PluginLoader.builder(catalog).recursive(false).build();
        try {
            assertEquals(0, flat.loadAll(pluginDir).getModuleCount());
        } finally {
            flat.close();
        }
        assertTrue(catalog.list().isEmpty());

        assertEquals(1, loader.loadAll(pluginDir).getModuleCount());
        assertEquals(Set.of("git"), catalogIds());
    }

    @Test
    void loadAll_customExtension() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "git.plugin", GitApiHook.class.getName());
        TestModules.moduleWithHooks(pluginDir, "docker.jar", DockerApiHook.class.getName());
        PluginLoader custom = PluginLoader.builder(catalog).extension("plugin").build();

        try {
            assertEquals(1, custom.loadAll(pluginDir).getModuleCount());
        } finally {
            custom.close();
        }
        assertEquals(Set.of("git"), catalogIds());
    }

    @Test
    void loadPlugin_singleModule() throws Exception {
        Path git = TestModules.moduleWithHooks(pluginDir, "git.jar", GitApiHook.class.getName());
        Path txt = Files.writeString(pluginDir.resolve("git.txt"), "x");

        assertEquals(1, loader.loadPlugin(git).getSucceededCount());
        assertTrue(catalog.get("git").isPresent());

        PluginLoadingFailedException ex = assertThrows(PluginLoadingFailedException.class, () -> loader.loadPlugin(txt));
        assertInstanceOf(PluginLoadException.class, ex.getReport().getFailures().get(0));
    }

    @Test
    void activateBuiltins_runsCompileTimeHooks() {
        loader.registerBuiltin(new GitApiHook());
        loader.registerBuiltin(c -> c.register(Entry.builder().id("api").type("API").name("Generic API").build()));
        loader.registerBuiltin(new FailingHook());

        LoadReport report = loader.activateBuiltins();

        assertEquals(3, report.getModuleCount());
        assertEquals(1, report.getFailedCount());
        assertTrue(report.getOutcomes().get(0).getModule().startsWith("builtin:"));
        assertEquals(Set.of("git", "api", "partial"), catalogIds());
    }

    @Test
    void reloadingSameModuleUpsertsInsteadOfDuplicating() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "git.jar", GitApiHook.class.getName());

        loader.loadAll(pluginDir);
        loader.loadAll(pluginDir);

        assertEquals(1, catalog.size());
        assertEquals(2, catalog.get("git").orElseThrow().getVersion());
    }

    @Test
    void loadPolicy_fromName() {
        assertEquals(LoadPolicy.BEST_EFFORT, LoadPolicy.fromName(null));
        assertEquals(LoadPolicy.FAIL_FAST, LoadPolicy.fromName("fail-fast"));
        assertEquals(LoadPolicy.BEST_EFFORT, LoadPolicy.fromName(" best_effort "));
        assertThrows(IllegalArgumentException.class, () -> LoadPolicy.fromName("maybe"));
    }

    @Test
    void loadAll_hookThrowingErrorIsRegistrationErrorAndScanContinues() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "a-bad.jar", BrokenInvariantHook.class.getName());
        TestModules.moduleWithHooks(pluginDir, "b-git.jar", GitApiHook.class.getName());

        LoadReport report = loader.loadAll(pluginDir);

        assertEquals(1, report.getFailedCount());
        PluginRegistrationException failure = assertInstanceOf(PluginRegistrationException.class, report.getFailures().get(0));
        assertInstanceOf(AssertionError.class, failure.getCause());
        assertTrue(catalog.get("git").isPresent());
        assertEquals(1.0, count("registration_error"));
    }

    @Test
    void loadAll_reloadReplacesModuleClassLoader() throws Exception {
        TestModules.moduleWithHooks(pluginDir, "git.jar", GitApiHook.class.getName());
        TestModules.moduleWithHooks(pluginDir, "docker.jar", DockerApiHook.class.getName());

        loader.loadAll(pluginDir);
        loader.loadAll(pluginDir);
        loader.loadAll(pluginDir);

        assertEquals(2, loader.openModuleCount());
        loader.close();
        assertEquals(0, loader.openModuleCount());
    }
}
