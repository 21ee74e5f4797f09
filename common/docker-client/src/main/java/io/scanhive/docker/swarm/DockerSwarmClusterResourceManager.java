package io.scanhive.docker.swarm;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateConfigResponse;
import com.github.dockerjava.api.command.CreateNetworkResponse;
import com.github.dockerjava.api.command.CreateServiceResponse;
import com.github.dockerjava.api.command.ListConfigsCmd;
import com.github.dockerjava.api.command.ListServicesCmd;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Config;
import com.github.dockerjava.api.model.ContainerSpec;
import com.github.dockerjava.api.model.ContainerSpecConfig;
import com.github.dockerjava.api.model.ContainerSpecFile;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.Info;
import com.github.dockerjava.api.model.LocalNodeState;
import com.github.dockerjava.api.model.Mount;
import com.github.dockerjava.api.model.MountType;
import com.github.dockerjava.api.model.Network;
import com.github.dockerjava.api.model.NetworkAttachmentConfig;
import com.github.dockerjava.api.model.Service;
import com.github.dockerjava.api.model.ServiceModeConfig;
import com.github.dockerjava.api.model.ServiceReplicatedModeOptions;
import com.github.dockerjava.api.model.ServiceRestartCondition;
import com.github.dockerjava.api.model.ServiceRestartPolicy;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.SwarmSpec;
import com.github.dockerjava.api.model.Task;
import com.github.dockerjava.api.model.TaskSpec;
import io.scanhive.docker.ClusterConfig;
import io.scanhive.docker.ClusterNetwork;
import io.scanhive.docker.ClusterResource;
import io.scanhive.docker.ClusterResourceManager;
import io.scanhive.docker.ClusterResourceNotFoundException;
import io.scanhive.docker.ClusterService;
import io.scanhive.docker.ConfigReference;
import io.scanhive.docker.DockerDaemonUnavailableException;
import io.scanhive.docker.HostResolver;
import io.scanhive.docker.ServiceDefinition;
import io.scanhive.docker.ServiceTask;
import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClusterResourceManager} backed by Docker Swarm through docker-java.
 * <p>
 * Networks are filtered by label client side, services and configs by the daemon. Connection
 * level failures are translated into {@link DockerDaemonUnavailableException};
 * any other daemon error reaches the caller unchanged.
 */
public final class DockerSwarmClusterResourceManager implements ClusterResourceManager {

    private static final Logger log = LoggerFactory.getLogger(DockerSwarmClusterResourceManager.class);

    private static final String DOCKER_HINT =
        "Ensure Docker is installed, running, and that the process can access the Docker socket "
            + "(for example /var/run/docker.sock) or an explicit DOCKER_HOST.";

    private static final String NETWORK_DRIVER = "overlay";
    private static final long CONFIG_FILE_MODE = 0444L;

    private final DockerClient dockerClient;
    private final HostResolver hostResolver;

    public DockerSwarmClusterResourceManager(DockerClient dockerClient) {
        this(dockerClient, HostResolver.system());
    }

    public DockerSwarmClusterResourceManager(DockerClient dockerClient, HostResolver hostResolver) {
        this.dockerClient = Objects.requireNonNull(dockerClient, "dockerClient");
        this.hostResolver = Objects.requireNonNull(hostResolver, "hostResolver");
    }

    /**
     * Turns the local engine into a single node swarm manager when it is not part of a swarm yet.
     */
    public void ensureSwarmInitialized() {
        Info info = callDocker("inspect docker engine", () -> dockerClient.infoCmd().exec());
        LocalNodeState state = info.getSwarm() == null ? null : info.getSwarm().getLocalNodeState();
        if (state == LocalNodeState.ACTIVE) {
            return;
        }
        log.info("docker engine is not part of a swarm (state={}), initializing single node swarm", state);
        callDocker("initialize swarm", () -> dockerClient.initializeSwarmCmd(new SwarmSpec()).exec());
    }

    @Override
    public ClusterNetwork createNetwork(String name, Map<String, String> labels) {
        String resolvedName = requireNonBlank(name, "name");
        Map<String, String> resolvedLabels = labels == null ? Map.of() : Map.copyOf(labels);
        List<Network> networks = callDocker("list networks", () -> dockerClient.listNetworksCmd().exec());
        for (Network network : networks) {
            if (resolvedName.equals(network.getName())) {
                log.warn("network {} already exists", resolvedName);
                return toNetwork(network);
            }
        }
        log.info("creating private network {}", resolvedName);
        CreateNetworkResponse response = callDocker("create network", () -> dockerClient.createNetworkCmd()
            .withName(resolvedName)
            .withDriver(NETWORK_DRIVER)
            .withAttachable(true)
            .withLabels(resolvedLabels)
            .exec());
        return new ClusterNetwork(response.getId(), resolvedName, resolvedLabels);
    }

    @Override
    public ClusterService createService(ServiceDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        log.info("creating service {} using image {} with {} replica(s)",
            definition.name(), definition.image(), definition.replicas());
        ServiceSpec spec = buildServiceSpec(definition);
        CreateServiceResponse response = callDocker("create service",
            () -> dockerClient.createServiceCmd(spec).exec());
        return new ClusterService(
            response.getId(),
            definition.name(),
            definition.labels(),
            definition.replicas(),
            definition.runOnce(),
            0L);
    }

    @Override
    public ClusterConfig createConfig(String name, Map<String, String> labels, byte[] data) {
        String resolvedName = requireNonBlank(name, "name");
        Objects.requireNonNull(data, "data");
        Map<String, String> resolvedLabels = labels == null ? Map.of() : Map.copyOf(labels);
        log.info("creating config {} ({} bytes)", resolvedName, data.length);
        CreateConfigResponse response = callDocker("create config", () -> dockerClient.createConfigCmd()
            .withName(resolvedName)
            .withLabels(resolvedLabels)
            .withData(data)
            .exec());
        return new ClusterConfig(response.getId(), resolvedName, resolvedLabels);
    }

    @Override
    public List<ClusterNetwork> listNetworks(Map<String, String> labelFilter) {
        List<Network> networks = callDocker("list networks", () -> dockerClient.listNetworksCmd().exec());
        List<ClusterNetwork> matching = new ArrayList<>();
        for (Network network : networks) {
            ClusterNetwork candidate = toNetwork(network);
            if (matches(candidate.labels(), labelFilter)) {
                matching.add(candidate);
            }
        }
        return matching;
    }

    @Override
    public List<ClusterService> listServices(Map<String, String> labelFilter) {
        List<Service> services = callDocker("list services", () -> {
            ListServicesCmd cmd = dockerClient.listServicesCmd();
            if (labelFilter != null && !labelFilter.isEmpty()) {
                cmd = cmd.withLabelFilter(labelFilter);
            }
            return cmd.exec();
        });
        List<ClusterService> matching = new ArrayList<>();
        for (Service service : services) {
            ClusterService candidate = toService(service);
            // the daemon filter is authoritative, this guards against older engines ignoring it
            if (matches(candidate.labels(), labelFilter)) {
                matching.add(candidate);
            }
        }
        return matching;
    }

    @Override
    public List<ClusterConfig> listConfigs(Map<String, String> labelFilter) {
        Map<String, String> resolvedFilter = labelFilter == null ? Map.of() : Map.copyOf(labelFilter);
        // config specs carry no labels client side, so the daemon does the filtering
        List<Config> configs = callDocker("list configs", () -> {
            ListConfigsCmd cmd = dockerClient.listConfigsCmd();
            if (!resolvedFilter.isEmpty()) {
                cmd = cmd.withFilters(Map.of("label", toLabelFilters(resolvedFilter)));
            }
            return cmd.exec();
        });
        List<ClusterConfig> matching = new ArrayList<>(configs.size());
        for (Config config : configs) {
            matching.add(toConfig(config, resolvedFilter));
        }
        return matching;
    }

    @Override
    public void remove(ClusterResource resource) {
        Objects.requireNonNull(resource, "resource");
        try {
            if (resource instanceof ClusterService service) {
                log.info("removing service {}", service.name());
                callDocker("remove service", () -> dockerClient.removeServiceCmd(service.id()).exec());
            } else if (resource instanceof ClusterNetwork network) {
                log.info("removing network {}", network.name());
                callDocker("remove network", () -> dockerClient.removeNetworkCmd(network.id()).exec());
            } else if (resource instanceof ClusterConfig config) {
                log.info("removing config {}", config.name());
                callDocker("remove config", () -> dockerClient.removeConfigCmd(config.id()).exec());
            }
        } catch (NotFoundException e) {
            log.debug("{} {} is already gone", resource.getClass().getSimpleName(), resource.name());
        }
    }

    @Override
    public void scale(String serviceName, int replicas) {
        String resolvedName = requireNonBlank(serviceName, "serviceName");
        if (replicas < 0) {
            throw new IllegalArgumentException("replicas must not be negative");
        }
        // Re-read the service so the update carries the current spec version.
        Service current = findService(resolvedName);
        ServiceSpec spec = current.getSpec()
            .withMode(new ServiceModeConfig()
                .withReplicated(new ServiceReplicatedModeOptions().withReplicas(replicas)));
        long version = current.getVersion() == null ? 0L : current.getVersion().getIndex();
        log.info("scaling service {} to {} replica(s)", resolvedName, replicas);
        callDocker("scale service", () -> dockerClient.updateServiceCmd(current.getId(), spec)
            .withVersion(version)
            .exec());
    }

    @Override
    public List<ServiceTask> listTasks(String serviceName) {
        String resolvedName = requireNonBlank(serviceName, "serviceName");
        List<Task> tasks;
        try {
            tasks = callDocker("list tasks", () -> dockerClient.listTasksCmd()
                .withServiceFilter(resolvedName)
                .exec());
        } catch (NotFoundException e) {
            throw new ClusterResourceNotFoundException("service " + resolvedName + " not found", e);
        }
        List<ServiceTask> result = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            String state = task.getStatus() == null || task.getStatus().getState() == null
                ? null
                : task.getStatus().getState().name();
            result.add(new ServiceTask(task.getId(), task.getServiceId(), state));
        }
        return result;
    }

    @Override
    public Set<String> resolveTaskAddresses(String serviceName) {
        String host = "tasks." + requireNonBlank(serviceName, "serviceName");
        log.info("getting ips for task {}", serviceName);
        try {
            Set<String> addresses = hostResolver.resolve(host);
            log.info("found ips {} for task {}", addresses, serviceName);
            return Set.copyOf(addresses);
        } catch (UnknownHostException e) {
            log.debug("unable to resolve {}: {}", host, e.getMessage());
            return Set.of();
        }
    }

    @Override
    public Closeable streamLogs(String serviceName, Consumer<String> lines) {
        Objects.requireNonNull(lines, "lines");
        Service service = findService(requireNonBlank(serviceName, "serviceName"));
        ResultCallback.Adapter<Frame> callback = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(Frame frame) {
                if (frame == null || frame.getPayload() == null) {
                    return;
                }
                String payload = new String(frame.getPayload(), StandardCharsets.UTF_8);
                for (String line : payload.split("\\R")) {
                    if (!line.isBlank()) {
                        lines.accept(line);
                    }
                }
            }
        };
        return callDocker("stream service logs", () -> dockerClient.logServiceCmd(service.getId())
            .withFollow(true)
            .withStdout(true)
            .withStderr(true)
            .exec(callback));
    }

    private Service findService(String serviceName) {
        List<Service> services = callDocker("list services", () -> dockerClient.listServicesCmd()
            .withNameFilter(List.of(serviceName))
            .exec());
        // the daemon name filter matches prefixes
        for (Service service : services) {
            if (service.getSpec() != null && serviceName.equals(service.getSpec().getName())) {
                return service;
            }
        }
        throw new ClusterResourceNotFoundException("service " + serviceName + " not found");
    }

    private ServiceSpec buildServiceSpec(ServiceDefinition definition) {
        ContainerSpec containerSpec = new ContainerSpec()
            .withImage(definition.image())
            .withEnv(toEnvList(definition.env()));
        if (!definition.args().isEmpty()) {
            containerSpec = containerSpec.withArgs(definition.args());
        }
        List<Mount> mounts = toMounts(definition.mounts());
        if (!mounts.isEmpty()) {
            containerSpec = containerSpec.withMounts(mounts);
        }
        if (!definition.configs().isEmpty()) {
            containerSpec = containerSpec.withConfigs(toConfigs(definition.configs()));
        }

        ServiceRestartPolicy restartPolicy = new ServiceRestartPolicy()
            .withCondition(definition.runOnce() ? ServiceRestartCondition.NONE : ServiceRestartCondition.ANY);
        TaskSpec taskSpec = new TaskSpec()
            .withContainerSpec(containerSpec)
            .withRestartPolicy(restartPolicy);

        ServiceModeConfig mode = new ServiceModeConfig()
            .withReplicated(new ServiceReplicatedModeOptions().withReplicas(definition.replicas()));

        ServiceSpec serviceSpec = new ServiceSpec()
            .withName(definition.name())
            .withTaskTemplate(taskSpec)
            .withMode(mode)
            .withLabels(definition.labels());

        String network = definition.network();
        if (network != null && !network.isBlank()) {
            NetworkAttachmentConfig attachment = new NetworkAttachmentConfig()
                .withTarget(network);
            serviceSpec = serviceSpec.withNetworks(List.of(attachment));
        }
        return serviceSpec;
    }

    private static List<ContainerSpecConfig> toConfigs(List<ConfigReference> references) {
        List<ContainerSpecConfig> configs = new ArrayList<>(references.size());
        for (ConfigReference reference : references) {
            ContainerSpecFile file = new ContainerSpecFile()
                .withName(reference.fileName())
                .withUid("0")
                .withGid("0")
                .withMode(CONFIG_FILE_MODE);
            configs.add(new ContainerSpecConfig()
                .withConfigID(reference.configId())
                .withConfigName(reference.configName())
                .withFile(file));
        }
        return configs;
    }

    private static List<String> toEnvList(Map<String, String> env) {
        if (env == null || env.isEmpty()) {
            return List.of();
        }
        return env.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .toList();
    }

    private static List<Mount> toMounts(List<String> volumes) {
        if (volumes == null || volumes.isEmpty()) {
            return List.of();
        }
        List<Mount> mounts = new ArrayList<>();
        for (String spec : volumes) {
            if (spec == null || spec.isBlank()) {
                continue;
            }
            String[] parts = spec.trim().split(":");
            if (parts.length < 2) {
                log.warn("ignoring mount '{}', expected source:target", spec);
                continue;
            }
            Mount mount = new Mount()
                .withType(MountType.BIND)
                .withSource(parts[0])
                .withTarget(parts[1]);
            if (parts.length > 2 && "ro".equals(parts[2])) {
                mount = mount.withReadOnly(true);
            }
            mounts.add(mount);
        }
        return mounts;
    }

    private static ClusterNetwork toNetwork(Network network) {
        return new ClusterNetwork(network.getId(), network.getName(), network.getLabels());
    }

    private static ClusterConfig toConfig(Config config, Map<String, String> labels) {
        String name = config.getSpec() == null ? null : config.getSpec().getName();
        return new ClusterConfig(config.getId(), name, labels);
    }

    private static List<String> toLabelFilters(Map<String, String> labels) {
        return labels.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .sorted()
            .toList();
    }

    private static ClusterService toService(Service service) {
        ServiceSpec spec = service.getSpec();
        String name = spec == null ? null : spec.getName();
        Map<String, String> labels = spec == null ? null : spec.getLabels();
        int replicas = 0;
        if (spec != null && spec.getMode() != null && spec.getMode().getReplicated() != null) {
            replicas = Math.toIntExact(spec.getMode().getReplicated().getReplicas());
        }
        boolean runOnce = spec != null
            && spec.getTaskTemplate() != null
            && spec.getTaskTemplate().getRestartPolicy() != null
            && spec.getTaskTemplate().getRestartPolicy().getCondition() == ServiceRestartCondition.NONE;
        long version = service.getVersion() == null ? 0L : service.getVersion().getIndex();
        return new ClusterService(service.getId(), name, labels, replicas, runOnce, version);
    }

    private static boolean matches(Map<String, String> labels, Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        if (labels == null) {
            return false;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            if (!Objects.equals(labels.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof DockerDaemonUnavailableException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            return new DockerDaemonUnavailableException(action, DOCKER_HINT, e);
        }
        return e;
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            if (messageContains(t, "Could not find a valid Docker environment")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT)
            .contains(needle.toLowerCase(Locale.ROOT));
    }
}
