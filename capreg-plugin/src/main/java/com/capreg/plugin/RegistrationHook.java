package com.capreg.plugin;

import com.capreg.registry.Catalog;

/**
 * Registration hook: the entry point a plugin module exposes so the loader can feed its capabilities into
 * the catalog. Module JARs publish implementations through {@link java.util.ServiceLoader}
 * ({@code META-INF/services/com.capreg.plugin.RegistrationHook}); built-in hooks are added with
 * {@link PluginLoader#registerBuiltin(RegistrationHook)}.
 * <p>
 * Implementations need a public no-arg constructor when published through a module. They may only use
 * {@code java.*}, {@code javax.*}, {@code com.capreg.registry.*}, {@code com.capreg.plugin.*} (built-ins excluded)
 * and {@code org.slf4j.*} from the host; see {@link RestrictedPluginClassLoader}.
 */
public interface RegistrationHook {

    /**
     * Registers this module's capabilities. Called once per load, outside any catalog lock.
     *
     * @param catalog catalog to register into; do not retain it beyond the call
     * @throws Exception on failure; reported as {@link PluginRegistrationException} and other modules still load
     */
    void register(Catalog catalog) throws Exception;

    /** Name used in load reports and logs. Defaults to the implementation class name. */
    default String getName() {
        return getClass().getName();
    }
}
