package io.scanhive.runtime.broker;

import io.scanhive.docker.ClusterService;

/**
 * Per-scan message broker. Agents exchange events through it; its protocol is not the runtime's
 * concern.
 */
public interface BrokerService {

    ClusterService start();

    /**
     * Blocks until the broker answers its status probe or the retry budget is spent.
     */
    boolean isHealthy();

    /**
     * Cluster service name, also the handle used to follow the broker's logs.
     */
    String serviceName();

    BrokerEndpoint endpoint();
}
