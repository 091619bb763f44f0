package com.vbwd.plugin.core.discovery;

import com.vbwd.plugin.api.Plugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;

/**
 * Classloader of one plugin module JAR, parented by a {@link RestrictedPluginClassLoader}. It stays open
 * while any plugin it defined is registered; the manager closes it when the last one goes away.
 */
public final class PluginModuleClassLoader extends URLClassLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginModuleClassLoader.class);

    static {
        registerAsParallelCapable();
    }

    private final Path module;
    private volatile boolean closed;

    PluginModuleClassLoader(Path module) throws MalformedURLException {
        super(new URL[]{module.toUri().toURL()}, new RestrictedPluginClassLoader());
        this.module = module;
    }

    /** The module loader that defined the plugin's class, or null for classpath plugins. */
    public static PluginModuleClassLoader of(Plugin plugin) {
        ClassLoader loader = plugin.getClass().getClassLoader();
        return loader instanceof PluginModuleClassLoader ? (PluginModuleClassLoader) loader : null;
    }

    public Path getModule() {
        return module;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Closes the JAR; failures are logged since nothing can be done about them at this point. */
    public void release() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            close();
            log.debug("Closed plugin module {}", module.getFileName());
        } catch (IOException e) {
            log.warn("Failed to close plugin module {}: {}", module.getFileName(), e.getMessage());
        }
    }
}
