package com.capreg.plugin;

/**
 * Failure of one plugin module during loading. Recorded per module in a {@link LoadReport}; only
 * {@link PluginLoadingFailedException} is thrown to callers of {@link PluginLoader#loadAll(java.nio.file.Path)}.
 */
public abstract class PluginException extends RuntimeException {

    private final String module;

    protected PluginException(String module, String message, Throwable cause) {
        super(module + ": " + message, cause);
        this.module = module;
    }

    /** Module file path, or {@code builtin:<hook>} for built-in hooks. */
    public String getModule() {
        return module;
    }

    /** Short tag used for metrics and log summaries (e.g. {@code load_error}). */
    public abstract String getKind();
}
