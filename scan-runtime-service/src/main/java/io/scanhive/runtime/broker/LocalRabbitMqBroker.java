package io.scanhive.runtime.broker;

import io.scanhive.docker.ClusterResourceManager;
import io.scanhive.docker.ClusterService;
import io.scanhive.docker.ServiceDefinition;
import io.scanhive.runtime.config.ScanRuntimeProperties;
import io.scanhive.runtime.health.HealthChecker;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RabbitMQ service {@code mq_<universe>} attached to the scan network.
 */
public class LocalRabbitMqBroker implements BrokerService {

    static final String SERVICE_PREFIX = "mq_";
    static final int AMQP_PORT = 5672;
    static final int MANAGEMENT_PORT = 15672;

    private static final Logger log = LoggerFactory.getLogger(LocalRabbitMqBroker.class);

    private final ClusterResourceManager cluster;
    private final HealthChecker healthChecker;
    private final ScanRuntimeProperties.Broker settings;
    private final String universe;
    private final String network;

    public LocalRabbitMqBroker(ClusterResourceManager cluster,
                               HealthChecker healthChecker,
                               ScanRuntimeProperties.Broker settings,
                               String universe,
                               String network) {
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.healthChecker = Objects.requireNonNull(healthChecker, "healthChecker");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.universe = Objects.requireNonNull(universe, "universe");
        this.network = Objects.requireNonNull(network, "network");
    }

    public static BrokerServiceFactory factory(ClusterResourceManager cluster,
                                               HealthChecker healthChecker,
                                               ScanRuntimeProperties.Broker settings) {
        return (universe, network) -> new LocalRabbitMqBroker(cluster, healthChecker, settings, universe, network);
    }

    @Override
    public ClusterService start() {
        log.info("starting broker {} on network {}", serviceName(), network);
        ServiceDefinition definition = new ServiceDefinition(
            serviceName(),
            settings.image(),
            List.of(),
            Map.of(
                "RABBITMQ_DEFAULT_USER", settings.username(),
                "RABBITMQ_DEFAULT_PASS", settings.password(),
                "RABBITMQ_DEFAULT_VHOST", settings.vhost()),
            List.of(),
            false,
            1,
            network,
            ClusterResourceManager.universeLabels(universe),
            List.of());
        return cluster.createService(definition);
    }

    @Override
    public boolean isHealthy() {
        return healthChecker.isInfraServiceHealthy(serviceName());
    }

    @Override
    public String serviceName() {
        return SERVICE_PREFIX + universe;
    }

    @Override
    public BrokerEndpoint endpoint() {
        String host = serviceName();
        return new BrokerEndpoint(
            host,
            "amqp://" + settings.username() + ":" + settings.password() + "@" + host + ":" + AMQP_PORT + "/",
            settings.exchange(),
            "http://" + host + ":" + MANAGEMENT_PORT + "/",
            settings.vhost());
    }
}
