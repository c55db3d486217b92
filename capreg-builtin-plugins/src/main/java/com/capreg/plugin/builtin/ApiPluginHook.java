package com.capreg.plugin.builtin;

import java.util.Map;

/** Generic API built-in, for services without a dedicated descriptor. Registers {@code api} with type {@value ApiDescriptor#TYPE}. */
public final class ApiPluginHook extends ApiRegistrationHook {

    public static final String ID = "api";

    public ApiPluginHook() {
        super(new ApiDescriptor(ID, "Generic API", Map.of("source", "builtin")));
    }
}
