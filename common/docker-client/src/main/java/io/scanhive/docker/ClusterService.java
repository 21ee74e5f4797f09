package io.scanhive.docker;

import java.util.Map;

/**
 * Snapshot of a cluster service. {@code version} is the spec version the snapshot was read at;
 * updates issued against an outdated version are rejected by the cluster.
 */
public record ClusterService(String id,
                             String name,
                             Map<String, String> labels,
                             int replicas,
                             boolean runOnce,
                             long version) implements ClusterResource {
    public ClusterService {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
