package com.capreg.plugin.builtin;

import java.util.Map;

/** SPI hook for the Git API built-in. Registers {@code git} with type {@value ApiDescriptor#TYPE}. */
public final class GitPluginHook extends ApiRegistrationHook {

    public static final String ID = "git";

    public GitPluginHook() {
        super(new ApiDescriptor(ID, "Git API", Map.of("source", "builtin")));
    }
}
