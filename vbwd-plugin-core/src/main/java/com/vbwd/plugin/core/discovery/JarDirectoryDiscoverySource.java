package com.vbwd.plugin.core.discovery;

import com.vbwd.plugin.api.Plugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Discovers plugins from a controlled directory. Every {@code *.jar} directly inside the directory is one
 * plugin module, loaded with its own {@link PluginModuleClassLoader} whose parent is a
 * {@link RestrictedPluginClassLoader}. A module that yields no plugin is closed right away; the others are
 * closed by the manager once none of their plugins is registered.
 * Only classes defined by the module itself count: concrete (non-abstract, non-interface) implementers of
 * {@link Plugin}, created through their public no-arg constructor.
 * <p>
 * <b>Partial failure:</b> a JAR that cannot be opened, a class that fails to load or link, and a
 * constructor or static initializer that throws are all logged and skipped; the remaining modules and
 * classes still load. Modules are scanned on the supplied {@link Executor} (concurrently when it is a
 * pool); results are merged in file-name order.
 */
public final class JarDirectoryDiscoverySource implements DiscoverySource {

    private static final Logger log = LoggerFactory.getLogger(JarDirectoryDiscoverySource.class);
    private static final String CLASS_SUFFIX = ".class";

    private final Path pluginsDir;
    private final Executor executor;

    /** Scans modules sequentially on the calling thread. */
    public JarDirectoryDiscoverySource(Path pluginsDir) {
        this(pluginsDir, Runnable::run);
    }

    public JarDirectoryDiscoverySource(Path pluginsDir, Executor executor) {
        this.pluginsDir = Objects.requireNonNull(pluginsDir, "pluginsDir");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Path getPluginsDir() {
        return pluginsDir;
    }

    @Override
    public List<Plugin> loadPlugins() {
        List<Path> modules = listModules();
        if (modules.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<List<Plugin>>> futures = new ArrayList<>(modules.size());
        for (Path jar : modules) {
            futures.add(CompletableFuture.supplyAsync(() -> loadModule(jar), executor));
        }
        List<Plugin> out = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.addAll(futures.get(i).join());
            } catch (Exception e) {
                log.error("Plugin module {} failed to load (skipping): {}", modules.get(i).getFileName(), e.getMessage(), e);
            }
        }
        log.info("Scanned {} plugin module(s) in {}; {} plugin(s) instantiated", modules.size(), pluginsDir, out.size());
        return out;
    }

    private List<Path> listModules() {
        if (!Files.exists(pluginsDir)) {
            log.debug("Plugins directory does not exist: {}", pluginsDir);
            return List.of();
        }
        if (!Files.isDirectory(pluginsDir)) {
            log.warn("Plugins path is not a directory: {}", pluginsDir);
            return List.of();
        }
        List<Path> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, "*.jar")) {
            for (Path jar : stream) {
                if (Files.isRegularFile(jar)) {
                    jars.add(jar);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list plugins directory {}: {}", pluginsDir, e.getMessage());
            return List.of();
        }
        jars.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return jars;
    }

    /**
     * Loads one module. Never throws: any failure is logged and yields the plugins loaded so far
     * (or none when the module itself cannot be opened).
     */
    private List<Plugin> loadModule(Path jar) {
        List<String> classNames;
        try {
            classNames = listClassNames(jar);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to open plugin module {} (skipping): {}", jar.getFileName(), e.getMessage(), e);
            return List.of();
        }
        PluginModuleClassLoader loader;
        try {
            loader = new PluginModuleClassLoader(jar);
        } catch (IOException e) {
            log.error("Failed to create classloader for plugin module {} (skipping): {}", jar.getFileName(), e.getMessage(), e);
            return List.of();
        }
        List<Plugin> plugins = new ArrayList<>();
        for (String className : classNames) {
            Class<? extends Plugin> type = loadPluginClass(jar, loader, className);
            if (type == null) {
                continue;
            }
            Plugin plugin = instantiate(jar, type);
            if (plugin != null) {
                plugins.add(plugin);
            }
        }
        if (plugins.isEmpty()) {
            log.warn("Plugin module {} contains no loadable plugin implementation", jar.getFileName());
            loader.release();
        } else {
            log.info("Loaded {} plugin(s) from module {}", plugins.size(), jar.getFileName());
        }
        return plugins;
    }

    private static List<String> listClassNames(Path jar) throws IOException {
        List<String> names = new ArrayList<>();
        try (JarFile jarFile = new JarFile(jar.toFile())) {
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                String entryName = entry.getName();
                if (entry.isDirectory() || !entryName.endsWith(CLASS_SUFFIX)
                        || entryName.endsWith("module-info.class") || entryName.startsWith("META-INF/")) {
                    continue;
                }
                names.add(entryName.substring(0, entryName.length() - CLASS_SUFFIX.length()).replace('/', '.'));
            }
        }
        names.sort(String::compareTo);
        return names;
    }

    /**
     * Returns the class when it is a concrete plugin implementation defined by this module, else null.
     * Loading does not run static initializers.
     */
    private static Class<? extends Plugin> loadPluginClass(Path jar, ClassLoader loader, String className) {
        Class<?> c;
        try {
            c = Class.forName(className, false, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            log.warn("Plugin module {}: class {} failed to load (skipping): {}", jar.getFileName(), className, e.toString());
            return null;
        }
        if (c.getClassLoader() != loader
                || !Plugin.class.isAssignableFrom(c)
                || c.isInterface()
                || Modifier.isAbstract(c.getModifiers())
                || c.isAnonymousClass()) {
            return null;
        }
        return c.asSubclass(Plugin.class);
    }

    private static Plugin instantiate(Path jar, Class<? extends Plugin> type) {
        try {
            Constructor<? extends Plugin> ctor = type.getConstructor();
            return ctor.newInstance();
        } catch (NoSuchMethodException e) {
            log.warn("Plugin module {}: {} has no public no-arg constructor (skipping)", jar.getFileName(), type.getName());
        } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Plugin module {}: {} failed to instantiate (skipping): {}", jar.getFileName(), type.getName(), cause.toString(), cause);
        }
        return null;
    }
}
