package io.scanhive.runtime.agent;

import io.scanhive.runtime.broker.BrokerEndpoint;
import java.util.Objects;
import java.util.Set;

/**
 * What every agent of one scan shares: the universe label value, the private network, the broker
 * coordinates and the keys whose logs are followed.
 */
public record ScanContext(String universe, String network, BrokerEndpoint broker, Set<String> follow) {
    public ScanContext {
        Objects.requireNonNull(universe, "universe");
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(broker, "broker");
        follow = follow == null ? Set.of() : Set.copyOf(follow);
    }

    public boolean follows(String key) {
        return follow.contains(key);
    }
}
