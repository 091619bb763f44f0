package com.vbwd.plugin.core;

import com.vbwd.plugin.api.capability.Capability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of capabilities contributed by enabled plugins: capability kind name → artifacts in
 * plugin load order. Never persisted; rebuilt whenever enabled membership changes.
 */
public final class CapabilityBundle {

    static final CapabilityBundle EMPTY = new CapabilityBundle(Map.of());

    private final Map<String, List<Capability<?>>> byKind;

    CapabilityBundle(Map<String, List<Capability<?>>> byKind) {
        Map<String, List<Capability<?>>> copy = new LinkedHashMap<>();
        byKind.forEach((kind, list) -> copy.put(kind, List.copyOf(list)));
        this.byKind = Collections.unmodifiableMap(copy);
    }

    /** Capabilities of the given kind; empty for unknown kinds. */
    public List<Capability<?>> get(String kind) {
        List<Capability<?>> list = byKind.get(kind);
        return list != null ? list : List.of();
    }

    /** Kind names known to this bundle (including kinds with no contributions). */
    public List<String> getKinds() {
        return List.copyOf(byKind.keySet());
    }

    public Map<String, List<Capability<?>>> asMap() {
        return byKind;
    }

    /** Total number of artifacts across all kinds. */
    public int size() {
        int n = 0;
        for (List<Capability<?>> list : byKind.values()) n += list.size();
        return n;
    }
}
