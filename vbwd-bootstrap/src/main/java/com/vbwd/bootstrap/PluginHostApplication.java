package com.vbwd.bootstrap;

import com.vbwd.plugin.api.capability.Capability;
import com.vbwd.plugin.core.CapabilityBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Plugin host entry point. Runs the bootstrap, logs the mounted capabilities and keeps the JVM alive until
 * it is stopped; the shutdown hook disables every enabled plugin without touching persisted state.
 */
public final class PluginHostApplication {

    private static final Logger log = LoggerFactory.getLogger(PluginHostApplication.class);

    private PluginHostApplication() {
    }

    public static void main(String[] args) {
        PluginHostContext ctx = PluginHostBootstrap.initialize();
        logCapabilities(ctx.getManager().getCapabilityBundle());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down plugin host...");
            ctx.close();
        }, "vbwd-plugin-host-shutdown"));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down plugin host...");
            ctx.close();
        }
    }

    static void logCapabilities(CapabilityBundle bundle) {
        if (bundle.size() == 0) {
            log.info("No capabilities mounted");
            return;
        }
        for (Map.Entry<String, List<Capability<?>>> entry : bundle.asMap().entrySet()) {
            for (Capability<?> capability : entry.getValue()) {
                log.info("Mounted {} from {} at {}", entry.getKey(), capability.ownerName(), capability.mountPrefix());
            }
        }
    }
}
