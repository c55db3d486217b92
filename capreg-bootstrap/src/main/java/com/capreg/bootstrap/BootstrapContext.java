package com.capreg.bootstrap;

import com.capreg.config.CapregConfig;
import com.capreg.plugin.LoadReport;
import com.capreg.plugin.PluginLoader;
import com.capreg.registry.Catalog;

import java.util.Objects;

/**
 * Wrapper object returned from bootstrap. Holds the env-derived configuration, the populated catalog, the
 * loader that populated it and the reports of built-in activation and the plugin directory scan.
 * Closing the context releases the module classloaders.
 */
public final class BootstrapContext implements AutoCloseable {

    private final CapregConfig config;
    private final Catalog catalog;
    private final PluginLoader loader;
    private final LoadReport builtinReport;
    private final LoadReport pluginReport;

    public BootstrapContext(CapregConfig config, Catalog catalog, PluginLoader loader,
                            LoadReport builtinReport, LoadReport pluginReport) {
        this.config = Objects.requireNonNull(config, "config");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.builtinReport = builtinReport;
        this.pluginReport = Objects.requireNonNull(pluginReport, "pluginReport");
    }

    /** Configuration built from environment (CAPREG_PLUGINS_DIR, CAPREG_STORAGE, etc.). */
    public CapregConfig getConfig() {
        return config;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public PluginLoader getLoader() {
        return loader;
    }

    /** Outcome of built-in activation; null when built-ins are disabled. */
    public LoadReport getBuiltinReport() {
        return builtinReport;
    }

    /** Outcome of the plugin directory scan, including per-module failures. */
    public LoadReport getReport() {
        return pluginReport;
    }

    @Override
    public void close() {
        loader.close();
    }
}
