package io.scanhive.runtime.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scanhive.docker.ClusterConfig;
import io.scanhive.docker.ClusterResourceManager;
import io.scanhive.docker.ClusterService;
import io.scanhive.docker.ConfigReference;
import io.scanhive.docker.ServiceDefinition;
import io.scanhive.runtime.logs.LogStreamer;
import io.scanhive.scan.model.AgentSettings;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts one agent as a cluster service of a scan.
 */
public class AgentSequencer {

    static final String SETTINGS_FILE = "/tmp/settings.json";
    static final String UNIVERSE_ENV = "UNIVERSE";

    private static final Logger log = LoggerFactory.getLogger(AgentSequencer.class);

    private final ClusterResourceManager cluster;
    private final AgentImageResolver imageResolver;
    private final LogStreamer logStreamer;
    private final ObjectMapper objectMapper;
    private final int healthcheckPort;

    public AgentSequencer(ClusterResourceManager cluster,
                          AgentImageResolver imageResolver,
                          LogStreamer logStreamer,
                          ObjectMapper objectMapper,
                          int healthcheckPort) {
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.imageResolver = Objects.requireNonNull(imageResolver, "imageResolver");
        this.logStreamer = Objects.requireNonNull(logStreamer, "logStreamer");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.healthcheckPort = healthcheckPort;
    }

    public AgentStartResult startAgent(ScanContext context, AgentSettings settings) {
        return startAgent(context, settings, List.of());
    }

    /**
     * Starts the agent with {@code extraConfigs} mounted next to its settings document. Services
     * asking for several replicas are created with one and scaled afterwards on a freshly listed
     * copy, as the cluster rejects multi-replica creation under load.
     */
    public AgentStartResult startAgent(ScanContext context, AgentSettings settings, List<ConfigReference> extraConfigs) {
        log.info("starting agent {} with {}", settings.key(), settings.args());
        Optional<AgentSettings> resolved = withImage(settings);
        if (resolved.isEmpty()) {
            return new AgentStartResult.NotInstalled(settings.key());
        }
        AgentSettings agent = resolved.get();
        String serviceName = AgentServiceNames.serviceName(agent.key(), context.universe());
        Map<String, String> labels = ClusterResourceManager.universeLabels(context.universe());

        ClusterConfig settingsConfig = cluster.createConfig(
            AgentServiceNames.settingsConfigName(serviceName), labels, instanceSettings(context, agent));
        List<ConfigReference> configs = new ArrayList<>();
        configs.add(settingsConfig.mountedAt(SETTINGS_FILE));
        if (extraConfigs != null) {
            configs.addAll(extraConfigs);
        }

        ClusterService service = cluster.createService(new ServiceDefinition(
            serviceName,
            agent.containerImage(),
            List.of(),
            Map.of(UNIVERSE_ENV, context.universe()),
            agent.mounts(),
            agent.restartPolicy().isRunOnce(),
            1,
            context.network(),
            labels,
            configs));

        if (agent.replicas() > 1) {
            scaleFresh(serviceName, labels, agent.replicas());
        }
        if (context.follows(agent.key())) {
            logStreamer.stream(serviceName);
        }
        return new AgentStartResult.Started(service);
    }

    private Optional<AgentSettings> withImage(AgentSettings settings) {
        if (settings.hasContainerImage()) {
            return Optional.of(settings);
        }
        return imageResolver.resolve(settings.key()).map(settings::withContainerImage);
    }

    private void scaleFresh(String serviceName, Map<String, String> labels, int replicas) {
        for (ClusterService live : cluster.listServices(labels)) {
            if (live.name().equals(serviceName)) {
                log.info("scaling {} to {} replica(s)", serviceName, replicas);
                cluster.scale(live.name(), replicas);
            }
        }
    }

    private byte[] instanceSettings(ScanContext context, AgentSettings agent) {
        try {
            return objectMapper.writeValueAsBytes(AgentInstanceSettings.of(agent, context.broker(), healthcheckPort));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to serialize settings of agent " + agent.key(), e);
        }
    }
}
