package com.capreg.plugin;

/** The module file could not be opened as a JAR or its classloader could not be created. */
public final class PluginLoadException extends PluginException {

    public PluginLoadException(String module, String message, Throwable cause) {
        super(module, message, cause);
    }

    @Override
    public String getKind() {
        return "load_error";
    }
}
