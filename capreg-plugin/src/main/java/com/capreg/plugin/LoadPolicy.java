package com.capreg.plugin;

import java.util.Locale;

/** How per-module failures aggregate into the result of a load. */
public enum LoadPolicy {

    /**
     * Scan every module; the load fails only if at least one module was found and all of them failed.
     * Individual failures are still recorded in the {@link LoadReport}.
     */
    BEST_EFFORT,

    /** Stop at the first failing module and fail the load. Modules activated before it stay registered. */
    FAIL_FAST;

    /** Parses a policy name ({@code best-effort} and {@code BEST_EFFORT} are equivalent); null/blank → BEST_EFFORT. */
    public static LoadPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return BEST_EFFORT;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
