package io.scanhive.runtime.broker;

/**
 * Coordinates agents use to reach a scan's message broker.
 */
public record BrokerEndpoint(String serviceName,
                             String url,
                             String exchangeTopic,
                             String managementUrl,
                             String vhost) {
}
