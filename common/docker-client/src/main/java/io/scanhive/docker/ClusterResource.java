package io.scanhive.docker;

import java.util.Map;
import java.util.Optional;

/**
 * A network, service or config living on the cluster.
 */
public sealed interface ClusterResource permits ClusterNetwork, ClusterService, ClusterConfig {

    String id();

    String name();

    Map<String, String> labels();

    /**
     * Value of the {@link ClusterResourceManager#UNIVERSE_LABEL} label, if the resource carries one.
     */
    default Optional<String> universe() {
        return Optional.ofNullable(labels().get(ClusterResourceManager.UNIVERSE_LABEL));
    }
}
