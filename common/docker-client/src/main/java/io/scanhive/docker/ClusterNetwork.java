package io.scanhive.docker;

import java.util.Map;

public record ClusterNetwork(String id, String name, Map<String, String> labels) implements ClusterResource {
    public ClusterNetwork {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
