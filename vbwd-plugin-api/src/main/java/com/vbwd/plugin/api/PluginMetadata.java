package com.vbwd.plugin.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable identity of a plugin. {@code name} is the registry key and must be non-blank;
 * {@code dependencies} lists the plugins that must be enabled first, in declaration order, without duplicates.
 */
public record PluginMetadata(String name, String version, String author, String description,
                             List<String> dependencies) {

    private static final String DEFAULT_VERSION = "0.0.0";

    public PluginMetadata {
        Objects.requireNonNull(name, "name");
        name = name.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Plugin name must be non-blank");
        }
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version.trim();
        author = author != null ? author : "";
        description = description != null ? description : "";
        dependencies = normalizeDependencies(name, dependencies);
    }

    public static PluginMetadata of(String name, String version, String... dependencies) {
        return new PluginMetadata(name, version, null, null, List.of(dependencies));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** True if this plugin declares a dependency on the given plugin name. */
    public boolean dependsOn(String pluginName) {
        return pluginName != null && dependencies.contains(pluginName.trim());
    }

    private static List<String> normalizeDependencies(String self, List<String> raw) {
        if (raw == null || raw.isEmpty()) return List.of();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String dep : raw) {
            if (dep == null || dep.isBlank()) continue;
            String d = dep.trim();
            if (d.equals(self)) {
                throw new IllegalArgumentException("Plugin " + self + " cannot depend on itself");
            }
            out.add(d);
        }
        return Collections.unmodifiableList(new ArrayList<>(out));
    }

    public static final class Builder {
        private final String name;
        private String version;
        private String author;
        private String description;
        private final List<String> dependencies = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder dependsOn(String... names) {
            dependencies.addAll(List.of(names));
            return this;
        }

        public PluginMetadata build() {
            return new PluginMetadata(name, version, author, description, dependencies);
        }
    }
}
