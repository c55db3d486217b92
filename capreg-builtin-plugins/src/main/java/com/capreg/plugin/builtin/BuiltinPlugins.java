package com.capreg.plugin.builtin;

import com.capreg.plugin.PluginLoader;
import com.capreg.plugin.RegistrationHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Static table of the registration hooks compiled into the host. The same hooks are also listed in
 * {@code META-INF/services/com.capreg.plugin.RegistrationHook} of this module.
 */
public final class BuiltinPlugins {

    private static final Logger log = LoggerFactory.getLogger(BuiltinPlugins.class);

    private BuiltinPlugins() {
    }

    /** New instances of every built-in hook: Git, Docker and generic API, in that order. */
    public static List<RegistrationHook> all() {
        return List.of(new GitPluginHook(), new DockerPluginHook(), new ApiPluginHook());
    }

    /**
     * Adds every built-in hook to the loader. They run on {@link PluginLoader#activateBuiltins()}.
     *
     * @return number of hooks added
     */
    public static int registerAll(PluginLoader loader) {
        List<RegistrationHook> hooks = all();
        hooks.forEach(loader::registerBuiltin);
        log.info("Built-in plugins: {}", hooks.stream().map(RegistrationHook::getName).collect(Collectors.toList()));
        return hooks.size();
    }
}
