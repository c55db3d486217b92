package com.capreg.bootstrap;

import com.capreg.config.CapregConfig;
import com.capreg.plugin.LoadPolicy;
import com.capreg.plugin.LoadReport;
import com.capreg.plugin.PluginLoader;
import com.capreg.plugin.PluginLoadingFailedException;
import com.capreg.plugin.builtin.BuiltinPlugins;
import com.capreg.registry.Catalog;
import com.capreg.registry.InMemoryCatalog;
import com.capreg.storage.MemoryStorage;
import com.capreg.storage.StorageCatalogAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bootstrap for the capability registry: creates the configured {@link Catalog}, activates the built-in hooks
 * and loads plugin modules from the configured directory.
 * <p>
 * Built-in hooks are part of the host, so any built-in failure is fatal. Plugin modules follow the configured
 * {@link LoadPolicy}: under {@code FAIL_FAST} the first failure aborts bootstrap; under {@code BEST_EFFORT}
 * failures are logged, and even a directory where every module failed leaves the registry running with the
 * built-ins.
 */
public final class CapregBootstrap {

    private static final Logger log = LoggerFactory.getLogger(CapregBootstrap.class);

    private CapregBootstrap() {
    }

    /** Same as {@link #initialize(CapregConfig)} with {@link CapregConfig#fromEnvironment()}. */
    public static BootstrapContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(CapregConfig.fromEnvironment());
    }

    /**
     * @param config registry configuration
     * @return context holding the populated catalog and the load reports
     * @throws PluginLoadingFailedException if a built-in hook fails, or a plugin module fails under FAIL_FAST
     */
    public static BootstrapContext initialize(CapregConfig config) {
        log.info("Bootstrap: storage={}, pluginsDir={}, extension={}, policy={}, recursive={}, builtins={}",
                config.getStorage(), config.getPluginsDir().toAbsolutePath(), config.getPluginExtension(),
                config.getPluginLoadPolicy(), config.isPluginsRecursive(), config.isBuiltinsEnabled());
        Catalog catalog = createCatalog(config.getStorage());
        LoadPolicy policy = LoadPolicy.fromName(config.getPluginLoadPolicy());
        PluginLoader loader = PluginLoader.builder(catalog)
                .policy(policy)
                .extension(config.getPluginExtension())
                .recursive(config.isPluginsRecursive())
                .build();
        try {
            LoadReport builtinReport = config.isBuiltinsEnabled() ? activateBuiltins(loader) : null;
            LoadReport pluginReport = loadPlugins(loader, config, policy);
            log.info("Bootstrap: catalog ready with {} entries ({} plugin module(s), {} failed)",
                    catalog.size(), pluginReport.getModuleCount(), pluginReport.getFailedCount());
            return new BootstrapContext(config, catalog, loader, builtinReport, pluginReport);
        } catch (RuntimeException e) {
            loader.close();
            throw e;
        }
    }

    static Catalog createCatalog(CapregConfig.StorageKind storage) {
        if (storage == CapregConfig.StorageKind.MEMORY) {
            return new StorageCatalogAdapter(new MemoryStorage());
        }
        return new InMemoryCatalog();
    }

    private static LoadReport activateBuiltins(PluginLoader loader) {
        BuiltinPlugins.registerAll(loader);
        LoadReport report = loader.activateBuiltins();
        if (report.hasFailures()) {
            // Built-in failures are fatal, also under BEST_EFFORT where activateBuiltins only throws if all failed.
            throw new PluginLoadingFailedException("Built-in plugin activation failed: " + report.getFailures().get(0).getMessage(), report);
        }
        return report;
    }

    private static LoadReport loadPlugins(PluginLoader loader, CapregConfig config, LoadPolicy policy) {
        try {
            return loader.loadAll(config.getPluginsDir());
        } catch (PluginLoadingFailedException e) {
            if (policy == LoadPolicy.FAIL_FAST) {
                throw e;
            }
            log.error("Bootstrap: every plugin module in {} failed to load; continuing without them",
                    config.getPluginsDir(), e);
            return e.getReport();
        }
    }
}
