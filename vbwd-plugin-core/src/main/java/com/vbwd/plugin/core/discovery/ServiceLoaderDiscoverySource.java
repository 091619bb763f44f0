package com.vbwd.plugin.core.discovery;

import com.vbwd.plugin.api.Plugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Plugins bundled with the host, declared in {@code META-INF/services/com.vbwd.plugin.api.Plugin}.
 * A provider that fails to load or instantiate is logged and skipped.
 */
public final class ServiceLoaderDiscoverySource implements DiscoverySource {

    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderDiscoverySource.class);
    /** Stops iterating when the service configuration keeps failing on the same entry. */
    private static final int MAX_PROVIDER_FAILURES = 64;

    private final ClassLoader classLoader;

    public ServiceLoaderDiscoverySource() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ServiceLoaderDiscoverySource(ClassLoader classLoader) {
        this.classLoader = classLoader != null ? classLoader : ServiceLoaderDiscoverySource.class.getClassLoader();
    }

    @Override
    public List<Plugin> loadPlugins() {
        List<Plugin> out = new ArrayList<>();
        Iterator<Plugin> it = ServiceLoader.load(Plugin.class, classLoader).iterator();
        int failures = 0;
        while (failures < MAX_PROVIDER_FAILURES) {
            try {
                if (!it.hasNext()) {
                    break;
                }
                out.add(it.next());
            } catch (ServiceConfigurationError e) {
                failures++;
                log.error("Bundled plugin provider failed to load (skipping): {}", e.getMessage(), e);
            }
        }
        log.debug("ServiceLoader discovered {} bundled plugin(s)", out.size());
        return out;
    }
}
