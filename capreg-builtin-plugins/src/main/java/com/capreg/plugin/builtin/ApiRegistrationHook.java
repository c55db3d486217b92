package com.capreg.plugin.builtin;

import com.capreg.plugin.RegistrationHook;
import com.capreg.registry.Catalog;
import com.capreg.registry.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base for hooks that register a single {@link ApiDescriptor}.
 */
abstract class ApiRegistrationHook implements RegistrationHook {

    private static final Logger log = LoggerFactory.getLogger(ApiRegistrationHook.class);

    private final ApiDescriptor descriptor;

    ApiRegistrationHook(ApiDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    public ApiDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public void register(Catalog catalog) {
        Entry registered = catalog.register(descriptor.toEntry());
        log.debug("Registered {} (version={})", registered.getId(), registered.getVersion());
    }

    @Override
    public String getName() {
        return descriptor.getId();
    }
}
