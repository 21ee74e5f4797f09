package io.scanhive.docker;

import java.util.Map;

public record ClusterConfig(String id, String name, Map<String, String> labels) implements ClusterResource {
    public ClusterConfig {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    /**
     * Reference that mounts this config at {@code fileName} inside a service's containers.
     */
    public ConfigReference mountedAt(String fileName) {
        return new ConfigReference(id, name, fileName);
    }
}
