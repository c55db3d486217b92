package com.capreg.plugin.builtin;

import java.util.Map;

/** Docker API built-in. Registers {@code docker} with type {@value ApiDescriptor#TYPE}. */
public final class DockerPluginHook extends ApiRegistrationHook {

    public static final String ID = "docker";

    public DockerPluginHook() {
        super(new ApiDescriptor(ID, "Docker API", Map.of("source", "builtin")));
    }
}
