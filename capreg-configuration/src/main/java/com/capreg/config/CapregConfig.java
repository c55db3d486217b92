package com.capreg.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration loaded from environment variables for the capability registry.
 * <p>
 * Plugins: CAPREG_PLUGINS_DIR, CAPREG_PLUGIN_EXTENSION, CAPREG_PLUGIN_LOAD_POLICY, CAPREG_PLUGINS_RECURSIVE,
 * CAPREG_BUILTINS_ENABLED. Storage: CAPREG_STORAGE ({@code catalog} or {@code memory}).
 * Unset, blank or unparseable values fall back to defaults.
 */
public final class CapregConfig {

    private static final Logger log = LoggerFactory.getLogger(CapregConfig.class);

    private static final String ENV_PLUGINS_DIR = "CAPREG_PLUGINS_DIR";
    private static final String ENV_PLUGIN_EXTENSION = "CAPREG_PLUGIN_EXTENSION";
    private static final String ENV_PLUGIN_LOAD_POLICY = "CAPREG_PLUGIN_LOAD_POLICY";
    private static final String ENV_PLUGINS_RECURSIVE = "CAPREG_PLUGINS_RECURSIVE";
    private static final String ENV_BUILTINS_ENABLED = "CAPREG_BUILTINS_ENABLED";
    private static final String ENV_STORAGE = "CAPREG_STORAGE";

    public static final String POLICY_BEST_EFFORT = "BEST_EFFORT";
    public static final String POLICY_FAIL_FAST = "FAIL_FAST";
    private static final Set<String> POLICIES = Set.of(POLICY_BEST_EFFORT, POLICY_FAIL_FAST);

    private static final String DEFAULT_PLUGINS_DIR = "plugins";
    private static final String DEFAULT_PLUGIN_EXTENSION = ".jar";

    /** Which catalog implementation bootstrap creates. */
    public enum StorageKind {
        /** {@code InMemoryCatalog}: one map under a read/write lock. */
        CATALOG,
        /** {@code StorageCatalogAdapter} over {@code MemoryStorage}. */
        MEMORY
    }

    private final Path pluginsDir;
    private final String pluginExtension;
    private final String pluginLoadPolicy;
    private final boolean pluginsRecursive;
    private final boolean builtinsEnabled;
    private final StorageKind storage;

    private CapregConfig(Builder b) {
        this.pluginsDir = b.pluginsDir;
        this.pluginExtension = b.pluginExtension;
        this.pluginLoadPolicy = b.pluginLoadPolicy;
        this.pluginsRecursive = b.pluginsRecursive;
        this.builtinsEnabled = b.builtinsEnabled;
        this.storage = b.storage;
    }

    /** Directory scanned for plugin modules. Default {@code plugins}. */
    public Path getPluginsDir() {
        return pluginsDir;
    }

    /** File extension of plugin modules, with leading dot. Default {@code .jar}. */
    public String getPluginExtension() {
        return pluginExtension;
    }

    /** {@value #POLICY_BEST_EFFORT} (default) or {@value #POLICY_FAIL_FAST}. */
    public String getPluginLoadPolicy() {
        return pluginLoadPolicy;
    }

    /** Whether sub-directories of the plugins dir are scanned. Default true. */
    public boolean isPluginsRecursive() {
        return pluginsRecursive;
    }

    /** Whether built-in registration hooks run at bootstrap. Default true. */
    public boolean isBuiltinsEnabled() {
        return builtinsEnabled;
    }

    public StorageKind getStorage() {
        return storage;
    }

    public static CapregConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds config from the given variables (normally {@link System#getenv()}).
     *
     * @param env variable name → value; missing keys use defaults
     */
    public static CapregConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .pluginsDir(Paths.get(getEnv(env, ENV_PLUGINS_DIR, DEFAULT_PLUGINS_DIR)))
                .pluginExtension(getEnv(env, ENV_PLUGIN_EXTENSION, DEFAULT_PLUGIN_EXTENSION))
                .pluginLoadPolicy(parsePolicy(env.get(ENV_PLUGIN_LOAD_POLICY)))
                .pluginsRecursive(parseBoolean(ENV_PLUGINS_RECURSIVE, env.get(ENV_PLUGINS_RECURSIVE), true))
                .builtinsEnabled(parseBoolean(ENV_BUILTINS_ENABLED, env.get(ENV_BUILTINS_ENABLED), true))
                .storage(parseStorage(env.get(ENV_STORAGE)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String parsePolicy(String value) {
        if (value == null || value.isBlank()) {
            return POLICY_BEST_EFFORT;
        }
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (!POLICIES.contains(v)) {
            log.warn("Unknown {}={}; using {}", ENV_PLUGIN_LOAD_POLICY, value, POLICY_BEST_EFFORT);
            return POLICY_BEST_EFFORT;
        }
        return v;
    }

    private static StorageKind parseStorage(String value) {
        if (value == null || value.isBlank()) {
            return StorageKind.CATALOG;
        }
        try {
            return StorageKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown {}={}; using {}", ENV_STORAGE, value, StorageKind.CATALOG);
            return StorageKind.CATALOG;
        }
    }

    private static boolean parseBoolean(String key, String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) {
            return true;
        }
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) {
            return false;
        }
        log.warn("Unknown {}={}; using {}", key, value, defaultValue);
        return defaultValue;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return DEFAULT_PLUGIN_EXTENSION;
        }
        String e = extension.trim();
        return e.startsWith(".") ? e : "." + e;
    }

    public static final class Builder {
        private Path pluginsDir = Paths.get(DEFAULT_PLUGINS_DIR);
        private String pluginExtension = DEFAULT_PLUGIN_EXTENSION;
        private String pluginLoadPolicy = POLICY_BEST_EFFORT;
        private boolean pluginsRecursive = true;
        private boolean builtinsEnabled = true;
        private StorageKind storage = StorageKind.CATALOG;

        public Builder pluginsDir(Path pluginsDir) {
            this.pluginsDir = Objects.requireNonNull(pluginsDir, "pluginsDir");
            return this;
        }

        public Builder pluginExtension(String pluginExtension) {
            this.pluginExtension = normalizeExtension(pluginExtension);
            return this;
        }

        public Builder pluginLoadPolicy(String pluginLoadPolicy) {
            this.pluginLoadPolicy = parsePolicy(pluginLoadPolicy);
            return this;
        }

        public Builder pluginsRecursive(boolean pluginsRecursive) {
            this.pluginsRecursive = pluginsRecursive;
            return this;
        }

        public Builder builtinsEnabled(boolean builtinsEnabled) {
            this.builtinsEnabled = builtinsEnabled;
            return this;
        }

        public Builder storage(StorageKind storage) {
            this.storage = storage != null ? storage : StorageKind.CATALOG;
            return this;
        }

        public CapregConfig build() {
            return new CapregConfig(this);
        }
    }
}
