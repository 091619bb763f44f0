package com.vbwd.plugin.api.capability;

import com.vbwd.plugin.api.Plugin;

import java.util.Objects;
import java.util.function.Function;

/**
 * A kind of artifact plugins may expose (routes, translation bundles, UI units, ...). The extractor reads
 * the artifact from a plugin and returns null when the plugin offers none. The mount prefix template
 * may contain {@value #NAME_PLACEHOLDER}, replaced by the owning plugin's name.
 *
 * @param <T> artifact type
 */
public final class CapabilityKind<T> {

    public static final String NAME_PLACEHOLDER = "{name}";

    private final String name;
    private final Class<T> artifactType;
    private final Function<Plugin, ? extends T> extractor;
    private final String mountPrefixTemplate;

    private CapabilityKind(String name, Class<T> artifactType, Function<Plugin, ? extends T> extractor,
                           String mountPrefixTemplate) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Capability kind name must be non-blank");
        }
        this.name = name.trim();
        this.artifactType = Objects.requireNonNull(artifactType, "artifactType");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.mountPrefixTemplate = mountPrefixTemplate != null ? mountPrefixTemplate : "";
    }

    public static <T> CapabilityKind<T> of(String name, Class<T> artifactType,
                                           Function<Plugin, ? extends T> extractor, String mountPrefixTemplate) {
        return new CapabilityKind<>(name, artifactType, extractor, mountPrefixTemplate);
    }

    /** Same kind with a different mount prefix template (e.g. host-configured URL prefix). */
    public CapabilityKind<T> withMountPrefix(String template) {
        return new CapabilityKind<>(name, artifactType, extractor, template);
    }

    public String getName() {
        return name;
    }

    public Class<T> getArtifactType() {
        return artifactType;
    }

    public String getMountPrefixTemplate() {
        return mountPrefixTemplate;
    }

    /** Reads the artifact from the plugin; null when the plugin offers none of this kind. */
    public T extract(Plugin plugin) {
        return extractor.apply(plugin);
    }

    /** Mount prefix for the given owner, e.g. {@code /api/v1/plugins/{name}} → {@code /api/v1/plugins/stripe}. */
    public String mountPrefixFor(String ownerName) {
        return mountPrefixTemplate.replace(NAME_PLACEHOLDER, ownerName != null ? ownerName : "");
    }

    @Override
    public String toString() {
        return "CapabilityKind{" + name + "}";
    }
}
