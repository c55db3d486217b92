package com.capreg.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapregConfigTest {

    @Test
    void fromEnvironment_usesDefaultsWhenUnset() {
        CapregConfig config = CapregConfig.fromEnvironment(Map.of());

        assertEquals(Paths.get("plugins"), config.getPluginsDir());
        assertEquals(".jar", config.getPluginExtension());
        assertEquals(CapregConfig.POLICY_BEST_EFFORT, config.getPluginLoadPolicy());
        assertTrue(config.isPluginsRecursive());
        assertTrue(config.isBuiltinsEnabled());
        assertEquals(CapregConfig.StorageKind.CATALOG, config.getStorage());
    }

    @Test
    void fromEnvironment_readsAllVariables() {
        CapregConfig config = CapregConfig.fromEnvironment(Map.of(
                "CAPREG_PLUGINS_DIR", " /opt/capreg/plugins ",
                "CAPREG_PLUGIN_EXTENSION", "zip",
                "CAPREG_PLUGIN_LOAD_POLICY", "fail-fast",
                "CAPREG_PLUGINS_RECURSIVE", "false",
                "CAPREG_BUILTINS_ENABLED", "0",
                "CAPREG_STORAGE", "memory"));

        assertEquals(Paths.get("/opt/capreg/plugins"), config.getPluginsDir());
        assertEquals(".zip", config.getPluginExtension());
        assertEquals(CapregConfig.POLICY_FAIL_FAST, config.getPluginLoadPolicy());
        assertFalse(config.isPluginsRecursive());
        assertFalse(config.isBuiltinsEnabled());
        assertEquals(CapregConfig.StorageKind.MEMORY, config.getStorage());
    }

    @Test
    void fromEnvironment_unparseableValuesFallBackToDefaults() {
        CapregConfig config = CapregConfig.fromEnvironment(Map.of(
                "CAPREG_PLUGIN_LOAD_POLICY", "sometimes",
                "CAPREG_STORAGE", "postgres",
                "CAPREG_BUILTINS_ENABLED", "  "));

        assertEquals(CapregConfig.POLICY_BEST_EFFORT, config.getPluginLoadPolicy());
        assertEquals(CapregConfig.StorageKind.CATALOG, config.getStorage());
        assertTrue(config.isBuiltinsEnabled());
    }

    @Test
    void fromEnvironment_unparseableBooleansKeepDefaults() {
        CapregConfig config = CapregConfig.fromEnvironment(Map.of(
                "CAPREG_PLUGINS_RECURSIVE", "garbage",
                "CAPREG_BUILTINS_ENABLED", "yes"));

        assertTrue(config.isPluginsRecursive());
        assertTrue(config.isBuiltinsEnabled());
    }

    @Test
    void fromEnvironment_booleansAreCaseInsensitive() {
        CapregConfig config = CapregConfig.fromEnvironment(Map.of(
                "CAPREG_PLUGINS_RECURSIVE", "FALSE",
                "CAPREG_BUILTINS_ENABLED", " True "));

        assertFalse(config.isPluginsRecursive());
        assertTrue(config.isBuiltinsEnabled());
    }
}
