package com.capreg.bootstrap;

import com.capreg.registry.EntryJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capability registry entry point. Bootstraps from the environment and logs the resulting catalog as JSON.
 * Exits with code 1 when bootstrap fails.
 */
public final class CapregApplication {

    private static final Logger log = LoggerFactory.getLogger(CapregApplication.class);

    private CapregApplication() {
    }

    public static void main(String[] args) {
        BootstrapContext ctx;
        try {
            ctx = CapregBootstrap.initialize();
        } catch (RuntimeException e) {
            log.error("Bootstrap failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        try (BootstrapContext context = ctx) {
            log.info("Catalog: {}", EntryJson.toJson(context.getCatalog().list()));
        }
    }
}
