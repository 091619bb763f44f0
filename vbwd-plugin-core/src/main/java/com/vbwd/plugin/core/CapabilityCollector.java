package com.vbwd.plugin.core;

import com.vbwd.plugin.api.capability.Capability;
import com.vbwd.plugin.api.capability.CapabilityKind;
import com.vbwd.plugin.api.capability.CapabilityKinds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@link CapabilityBundle} from enabled plugins. For each registered kind it asks every
 * enabled plugin for an artifact and keeps the non-null ones, tagged with owner name and mount prefix.
 * New kinds are added here; plugins and the manager stay unchanged.
 */
public final class CapabilityCollector {

    private static final Logger log = LoggerFactory.getLogger(CapabilityCollector.class);

    private final Map<String, CapabilityKind<?>> kinds = new LinkedHashMap<>();

    /** Collector for the built-in kinds (route, translation-bundle, ui-component). */
    public CapabilityCollector() {
        this(CapabilityKinds.defaults());
    }

    public CapabilityCollector(Collection<? extends CapabilityKind<?>> kinds) {
        Objects.requireNonNull(kinds, "kinds");
        for (CapabilityKind<?> kind : kinds) {
            if (this.kinds.putIfAbsent(kind.getName(), kind) != null) {
                throw new IllegalArgumentException("Capability kind registered twice: " + kind.getName());
            }
        }
    }

    public List<CapabilityKind<?>> getKinds() {
        return List.copyOf(kinds.values());
    }

    public CapabilityKind<?> getKind(String name) {
        return kinds.get(name);
    }

    /**
     * Collects capabilities from the given plugins, which must all be enabled and in load order.
     * A capability method that throws is logged and contributes nothing.
     */
    public CapabilityBundle collect(List<PluginInstance> enabledInOrder) {
        Map<String, List<Capability<?>>> byKind = new LinkedHashMap<>();
        for (CapabilityKind<?> kind : kinds.values()) {
            byKind.put(kind.getName(), collectKind(kind, enabledInOrder));
        }
        return new CapabilityBundle(byKind);
    }

    private static <T> List<Capability<?>> collectKind(CapabilityKind<T> kind, List<PluginInstance> plugins) {
        List<Capability<?>> out = new ArrayList<>();
        for (PluginInstance instance : plugins) {
            T artifact;
            try {
                artifact = kind.extract(instance.getPlugin());
            } catch (Exception e) {
                log.warn("Plugin {} failed to provide capability {} (skipping): {}",
                        instance.getName(), kind.getName(), e.getMessage(), e);
                continue;
            }
            if (artifact == null) {
                continue;
            }
            out.add(new Capability<>(instance.getName(), artifact, kind.mountPrefixFor(instance.getName())));
        }
        return out;
    }
}
