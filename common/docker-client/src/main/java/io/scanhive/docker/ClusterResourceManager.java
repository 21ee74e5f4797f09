package io.scanhive.docker;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Narrow façade over the cluster control plane. Nothing else in the runtime talks to the cluster,
 * so tests can swap in an in-memory cluster.
 * <p>
 * Label filters match resources carrying every given label with exactly the given value; an empty
 * filter matches everything.
 */
public interface ClusterResourceManager {

    /**
     * Label joining every resource of a scan to the scan id.
     */
    String UNIVERSE_LABEL = "universe";

    static Map<String, String> universeLabels(String universe) {
        return Map.of(UNIVERSE_LABEL, universe);
    }

    /**
     * Creates an attachable overlay network. When a network with the same name exists it is
     * returned as is and nothing is created.
     */
    ClusterNetwork createNetwork(String name, Map<String, String> labels);

    ClusterService createService(ServiceDefinition definition);

    ClusterConfig createConfig(String name, Map<String, String> labels, byte[] data);

    List<ClusterNetwork> listNetworks(Map<String, String> labelFilter);

    List<ClusterService> listServices(Map<String, String> labelFilter);

    List<ClusterConfig> listConfigs(Map<String, String> labelFilter);

    /**
     * Removes the resource. Removing a resource that is already gone is a no-op.
     */
    void remove(ClusterResource resource);

    /**
     * Sets the replica count of the named service, acting on a freshly read copy of the service.
     *
     * @throws ClusterResourceNotFoundException when no service has that name
     */
    void scale(String serviceName, int replicas);

    /**
     * Tasks currently known for the named service.
     *
     * @throws ClusterResourceNotFoundException when no service has that name
     */
    List<ServiceTask> listTasks(String serviceName);

    /**
     * Addresses of the service's tasks; empty when the name does not resolve.
     */
    Set<String> resolveTaskAddresses(String serviceName);

    /**
     * Follows stdout and stderr of the named service, handing every line to {@code lines} until the
     * returned handle is closed.
     */
    Closeable streamLogs(String serviceName, Consumer<String> lines);
}
