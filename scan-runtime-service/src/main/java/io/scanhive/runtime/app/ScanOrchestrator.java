package io.scanhive.runtime.app;

import io.scanhive.docker.ClusterConfig;
import io.scanhive.docker.ClusterNetwork;
import io.scanhive.docker.ClusterResource;
import io.scanhive.docker.ClusterResourceManager;
import io.scanhive.docker.ClusterService;
import io.scanhive.docker.ConfigReference;
import io.scanhive.runtime.agent.AgentInstaller;
import io.scanhive.runtime.agent.AgentSequencer;
import io.scanhive.runtime.agent.AgentStartResult;
import io.scanhive.runtime.agent.ScanContext;
import io.scanhive.runtime.broker.BrokerService;
import io.scanhive.runtime.broker.BrokerServiceFactory;
import io.scanhive.runtime.config.ScanRuntimeProperties;
import io.scanhive.runtime.domain.Scan;
import io.scanhive.runtime.domain.ScanFailure;
import io.scanhive.runtime.domain.ScanOutcome;
import io.scanhive.runtime.domain.ScanProgress;
import io.scanhive.runtime.domain.ScanRecordStore;
import io.scanhive.runtime.domain.ServiceUnhealthyException;
import io.scanhive.runtime.health.HealthChecker;
import io.scanhive.runtime.logs.LogStreamer;
import io.scanhive.scan.model.AgentGroupDefinition;
import io.scanhive.scan.model.AgentSettings;
import io.scanhive.scan.model.Asset;
import io.scanhive.scan.model.RestartPolicy;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local runtime: runs each scan on its own labeled network of cluster services.
 * <p>
 * {@link #scan} is a single sequential pass. The broker comes first, then the persistence agent,
 * the requested agents, the tracker and finally the run-once injector carrying the asset. Every
 * agent stage is health checked before the next one starts.
 * <p>
 * Failures are handled by kind. An unhealthy agent stage tears the scan down and ends it in
 * {@link ScanProgress#ERROR}. A missing agent image is reported and leaves everything in place. An
 * unhealthy broker is raised to the caller as {@link ServiceUnhealthyException}, also without
 * cleanup.
 */
public class ScanOrchestrator implements ScanRuntime {

    public static final String RUNTIME_NAME = "local";
    public static final String BROKER_FOLLOW_KEY = "mq";

    static final String ASSET_CONFIG_PREFIX = "asset_";
    static final String ASSET_SELECTOR_CONFIG_PREFIX = "asset_selector_";
    static final String ASSET_FILE = "/tmp/asset.binproto";
    static final String ASSET_SELECTOR_FILE = "/tmp/asset_selector.txt";

    private static final Logger log = LoggerFactory.getLogger(ScanOrchestrator.class);

    private enum Stage {
        PRE_AGENTS("pre-agents"),
        AGENTS("agents"),
        POST_AGENTS("post-agents");

        private final String label;

        Stage(String label) {
            this.label = label;
        }
    }

    private final ScanRecordStore store;
    private final ClusterResourceManager cluster;
    private final BrokerServiceFactory brokerFactory;
    private final HealthChecker healthChecker;
    private final AgentSequencer sequencer;
    private final AgentInstaller installer;
    private final LogStreamer logStreamer;
    private final ScanReporter reporter;
    private final ScanMetrics metrics;
    private final ScanRuntimeProperties properties;

    public ScanOrchestrator(ScanRecordStore store,
                            ClusterResourceManager cluster,
                            BrokerServiceFactory brokerFactory,
                            HealthChecker healthChecker,
                            AgentSequencer sequencer,
                            AgentInstaller installer,
                            LogStreamer logStreamer,
                            ScanReporter reporter,
                            ScanMetrics metrics,
                            ScanRuntimeProperties properties) {
        this.store = Objects.requireNonNull(store, "store");
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.brokerFactory = Objects.requireNonNull(brokerFactory, "brokerFactory");
        this.healthChecker = Objects.requireNonNull(healthChecker, "healthChecker");
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer");
        this.installer = Objects.requireNonNull(installer, "installer");
        this.logStreamer = Objects.requireNonNull(logStreamer, "logStreamer");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public String name() {
        return RUNTIME_NAME;
    }

    @Override
    public String network(long scanId) {
        return properties.getNetworkPrefix() + "_" + scanId;
    }

    @Override
    public boolean canRun(AgentGroupDefinition definition) {
        return true;
    }

    @Override
    public ScanOutcome scan(String title, AgentGroupDefinition definition, Asset asset) {
        return scan(title, definition, asset, properties.getFollow());
    }

    /**
     * @param follow agent keys, plus {@value #BROKER_FOLLOW_KEY} for the broker, whose logs are relayed
     * @throws ServiceUnhealthyException when the broker never becomes healthy
     */
    public ScanOutcome scan(String title, AgentGroupDefinition definition, Asset asset, Set<String> follow) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(asset, "asset");
        reporter.info("Creating scan entry");
        Scan scan = store.create(title, asset.describe());
        String universe = scan.universe();
        String network = network(scan.id());

        reporter.info("Creating network");
        ClusterNetwork created = cluster.createNetwork(network, ClusterResourceManager.universeLabels(universe));
        log.info("scan {} uses network {} ({})", scan.id(), created.name(), created.id());

        reporter.info("Starting services");
        BrokerService broker = brokerFactory.create(universe, network);
        broker.start();
        if (follow != null && follow.contains(BROKER_FOLLOW_KEY)) {
            logStreamer.stream(broker.serviceName());
        }
        reporter.info("Checking services are healthy");
        if (!broker.isHealthy()) {
            ScanFailure failure = ScanFailure.infraUnhealthy(broker.serviceName());
            metrics.scanFailed(failure);
            throw new ServiceUnhealthyException(scan.id(), failure);
        }

        ScanContext context = new ScanContext(universe, network, broker.endpoint(), follow);
        ScanFailure failure = startAgents(context, definition, asset);
        if (failure != null) {
            return handleFailure(scan.id(), failure);
        }

        reporter.info("Updating scan status");
        store.updateProgress(scan.id(), ScanProgress.IN_PROGRESS);
        metrics.scanStarted();
        reporter.success("Scan created successfully");
        return ScanOutcome.started(scan.id());
    }

    @Override
    public void stop(long scanId) {
        stop(scanId, ScanProgress.STOPPED);
    }

    /**
     * Stops following the scan's services, removes its services, networks and configs, then moves its record to {@code target}
     * unless the record is already terminal. Works without a record.
     */
    void stop(long scanId, ScanProgress target) {
        Map<String, String> labels = ClusterResourceManager.universeLabels(Long.toString(scanId));
        List<ClusterResource> removed = new ArrayList<>();
        for (ClusterService service : cluster.listServices(labels)) {
            logStreamer.stop(service.name());
            cluster.remove(service);
            removed.add(service);
        }
        for (ClusterNetwork network : cluster.listNetworks(labels)) {
            log.debug("removing network {}", network.name());
            cluster.remove(network);
            removed.add(network);
        }
        for (ClusterConfig config : cluster.listConfigs(labels)) {
            log.debug("removing config {}", config.name());
            cluster.remove(config);
            removed.add(config);
        }
        if (!removed.isEmpty()) {
            log.info("removed {} resource(s) of scan {}", removed.size(), scanId);
            reporter.success("All scan components stopped.");
        }

        store.findById(scanId).ifPresent(scan -> {
            if (scan.progress().canTransitionTo(target)) {
                store.updateProgress(scanId, target);
            } else {
                log.info("scan {} keeps progress {}", scanId, scan.progress());
            }
        });
        metrics.scanStopped();
        reporter.success("Scan stopped successfully.");
    }

    /**
     * All persisted scans. Live universes without a record are reported as drift and not listed.
     */
    @Override
    public List<Scan> list(Integer page, Integer pageSize) {
        if (page != null || pageSize != null) {
            reporter.warning("Local runtime ignores scan list pagination");
        }
        List<Scan> scans = store.listAll();
        Set<Long> known = scans.stream().map(Scan::id).collect(Collectors.toSet());

        Set<String> universes = new LinkedHashSet<>();
        for (ClusterService service : cluster.listServices(Map.of())) {
            service.universe().ifPresent(universes::add);
        }
        for (String universe : universes) {
            OptionalLong id = numericUniverse(universe);
            if (id.isEmpty()) {
                log.debug("ignoring non numeric universe {}", universe);
            } else if (!known.contains(id.getAsLong())) {
                reporter.warning("Scan " + universe + " has not traced in DB.");
            }
        }
        return scans;
    }

    @Override
    public void install() {
        for (String key : properties.getAgents().defaults()) {
            reporter.info("Installing agent " + key);
            installer.install(key);
        }
    }

    private ScanFailure startAgents(ScanContext context, AgentGroupDefinition definition, Asset asset) {
        for (Stage stage : Stage.values()) {
            reporter.info("Starting " + stage.label);
            for (AgentSettings agent : agentsOf(stage, definition)) {
                AgentStartResult result = sequencer.startAgent(context, agent);
                if (result instanceof AgentStartResult.NotInstalled notInstalled) {
                    return ScanFailure.agentNotInstalled(notInstalled.agentKey());
                }
            }
            reporter.info("Checking " + stage.label + " are healthy");
            if (!healthChecker.areAgentsReady(context.universe())) {
                return ScanFailure.agentNotHealthy(stage.label);
            }
        }
        reporter.info("Injecting asset");
        return injectAsset(context, asset);
    }

    private List<AgentSettings> agentsOf(Stage stage, AgentGroupDefinition definition) {
        ScanRuntimeProperties.Agents agents = properties.getAgents();
        return switch (stage) {
            case PRE_AGENTS -> List.of(AgentSettings.of(agents.persistVulnz()));
            case AGENTS -> distinct(definition);
            case POST_AGENTS -> List.of(AgentSettings.of(agents.tracker()));
        };
    }

    private List<AgentSettings> distinct(AgentGroupDefinition definition) {
        List<AgentSettings> distinct = definition.distinctAgents();
        if (distinct.size() < definition.agents().size()) {
            log.warn("agent group lists {} agent(s) with {} distinct key(s); duplicates are ignored",
                definition.agents().size(), distinct.size());
        }
        return distinct;
    }

    private ScanFailure injectAsset(ScanContext context, Asset asset) {
        String universe = context.universe();
        Map<String, String> labels = ClusterResourceManager.universeLabels(universe);
        ClusterConfig payload = cluster.createConfig(ASSET_CONFIG_PREFIX + universe, labels, asset.toPayload());
        ClusterConfig selector = cluster.createConfig(ASSET_SELECTOR_CONFIG_PREFIX + universe, labels,
            asset.selector().getBytes(StandardCharsets.UTF_8));
        List<ConfigReference> configs = List.of(
            payload.mountedAt(ASSET_FILE),
            selector.mountedAt(ASSET_SELECTOR_FILE));

        AgentSettings injector = AgentSettings.of(properties.getAgents().injectAsset())
            .withRestartPolicy(RestartPolicy.NONE);
        AgentStartResult result = sequencer.startAgent(context, injector, configs);
        if (result instanceof AgentStartResult.NotInstalled notInstalled) {
            return ScanFailure.agentNotInstalled(notInstalled.agentKey());
        }
        return null;
    }

    private ScanOutcome handleFailure(long scanId, ScanFailure failure) {
        metrics.scanFailed(failure);
        if (failure.recoverable()) {
            reporter.error("Agent not starting");
            log.warn("scan {} failed: {}", scanId, failure.message());
            stop(scanId, ScanProgress.ERROR);
            return ScanOutcome.failed(scanId, ScanProgress.ERROR, failure);
        }
        reporter.error(failure.message());
        return ScanOutcome.failed(scanId, ScanProgress.CREATED, failure);
    }

    private static OptionalLong numericUniverse(String universe) {
        if (universe.isEmpty() || !universe.chars().allMatch(Character::isDigit)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(universe));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
