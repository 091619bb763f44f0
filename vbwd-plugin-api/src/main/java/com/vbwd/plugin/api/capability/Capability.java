package com.vbwd.plugin.api.capability;

import java.util.Objects;

/**
 * An artifact contributed by an enabled plugin, tagged with its owner and the prefix the host should
 * mount it under. Consumers (HTTP layer, UI router) bind the artifact with their own framework.
 *
 * @param <T> artifact type
 */
public record Capability<T>(String ownerName, T artifact, String mountPrefix) {

    public Capability {
        Objects.requireNonNull(ownerName, "ownerName");
        Objects.requireNonNull(artifact, "artifact");
        mountPrefix = mountPrefix != null ? mountPrefix : "";
    }
}
