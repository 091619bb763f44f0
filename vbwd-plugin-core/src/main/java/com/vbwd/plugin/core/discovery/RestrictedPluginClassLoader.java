package com.vbwd.plugin.core.discovery;

import com.vbwd.plugin.api.Plugin;

import java.util.List;

/**
 * Restricted parent classloader for plugin JARs. Exposes only the allowed package prefixes from the host;
 * every other request throws {@link ClassNotFoundException}, so a plugin JAR resolves its own classes
 * itself and cannot reach manager internals.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code jakarta.*}, {@code com.vbwd.plugin.api.*},
 * {@code org.slf4j.*}, {@code com.fasterxml.jackson.*}
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    static final List<String> ALLOWED_PREFIXES = List.of(
            "java.",
            "javax.",
            "jakarta.",
            "com.vbwd.plugin.api.",
            "org.slf4j.",
            "com.fasterxml.jackson."
    );

    private final ClassLoader hostLoader;

    /**
     * Creates a restricted classloader with no parent that delegates allowed names to the loader that
     * loaded {@link Plugin}.
     */
    public RestrictedPluginClassLoader() {
        this(Plugin.class.getClassLoader());
    }

    RestrictedPluginClassLoader(ClassLoader hostLoader) {
        super(null);
        this.hostLoader = hostLoader;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                if (!isAllowed(name)) {
                    throw new ClassNotFoundException("Access denied: " + name
                            + " (plugins may only use " + String.join("*, ", ALLOWED_PREFIXES) + "*)");
                }
                c = hostLoader.loadClass(name);
            }
            if (resolve) resolveClass(c);
            return c;
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}
