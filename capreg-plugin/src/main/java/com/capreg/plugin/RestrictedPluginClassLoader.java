package com.capreg.plugin;

import java.util.List;

/**
 * Parent of every module's {@link java.net.URLClassLoader}. Host classes a module may link against are the
 * JDK, the catalog API ({@code com.capreg.registry}), the hook SPI ({@code com.capreg.plugin}) and SLF4J.
 * The host's own built-in hooks ({@code com.capreg.plugin.builtin}) stay hidden, as does everything else
 * on the host classpath.
 * <p>
 * A refused name is not fatal by itself: the module loader then looks in the module JAR, so a module can
 * still bundle its own copies of libraries the host does not expose.
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final List<String> VISIBLE_PREFIXES = List.of(
            "java.", "javax.", "com.capreg.registry.", "com.capreg.plugin.", "org.slf4j.");
    private static final List<String> HIDDEN_PREFIXES = List.of("com.capreg.plugin.builtin.");

    private final ClassLoader host;

    /** Delegates visible names to the loader that defined {@link RegistrationHook}. */
    public RestrictedPluginClassLoader() {
        super(null);
        this.host = RegistrationHook.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (!isAllowed(name)) {
            throw new ClassNotFoundException(name + " is not visible to plugin modules");
        }
        // this loader defines nothing itself, so there is no local cache to consult
        Class<?> type = host.loadClass(name);
        if (resolve) {
            resolveClass(type);
        }
        return type;
    }

    static boolean isAllowed(String className) {
        return HIDDEN_PREFIXES.stream().noneMatch(className::startsWith)
                && VISIBLE_PREFIXES.stream().anyMatch(className::startsWith);
    }
}
