package io.scanhive.runtime.health;

import io.scanhive.docker.ClusterResourceManager;
import io.scanhive.docker.ClusterResourceNotFoundException;
import io.scanhive.docker.ClusterService;
import io.scanhive.runtime.agent.AgentServiceNames;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded-retry health verification of a scan's services.
 * <p>
 * Infrastructure services are probed over HTTP on every task address; agent services are judged by
 * comparing desired replicas with running tasks. Both checks return a verdict once the retry budget
 * is spent and never raise for "not yet healthy" conditions.
 */
public class HealthChecker {

    public static final int MAX_ATTEMPTS = 20;
    public static final int INFRA_MAX_BACKOFF_UNITS = 12;
    public static final int AGENT_MAX_BACKOFF_UNITS = 20;

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private final ClusterResourceManager cluster;
    private final StatusProbe statusProbe;
    private final Sleeper sleeper;
    private final RetryPolicy infraPolicy;
    private final RetryPolicy agentPolicy;

    public HealthChecker(ClusterResourceManager cluster,
                         StatusProbe statusProbe,
                         Duration backoffUnit,
                         Sleeper sleeper) {
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.statusProbe = Objects.requireNonNull(statusProbe, "statusProbe");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        Objects.requireNonNull(backoffUnit, "backoffUnit");
        this.infraPolicy = RetryPolicy.exponential(MAX_ATTEMPTS, backoffUnit, INFRA_MAX_BACKOFF_UNITS);
        this.agentPolicy = RetryPolicy.exponential(MAX_ATTEMPTS, backoffUnit, AGENT_MAX_BACKOFF_UNITS);
    }

    public RetryPolicy infraPolicy() {
        return infraPolicy;
    }

    public RetryPolicy agentPolicy() {
        return agentPolicy;
    }

    /**
     * Retries the HTTP status probe of a singleton infrastructure service.
     */
    public boolean isInfraServiceHealthy(String serviceName) {
        return Retries.retryUntilTrue(() -> probeInfra(serviceName), infraPolicy, sleeper);
    }

    /**
     * Retries the readiness check of every long-running agent of the universe, failing fast on the
     * first unhealthy service.
     */
    public boolean areAgentsReady(String universe) {
        return areAgentsReady(universe, true);
    }

    public boolean areAgentsReady(String universe, boolean failFast) {
        return Retries.retryUntilTrue(() -> checkAgents(universe, failFast), agentPolicy, sleeper);
    }

    /**
     * Single-shot task-count check. {@code replicas} overrides the service's configured count when
     * given. A service the cluster no longer knows is unhealthy.
     */
    public boolean isServiceHealthy(ClusterService service, Integer replicas) {
        int desired = replicas != null && replicas > 0 ? replicas : service.replicas();
        try {
            long running = cluster.listTasks(service.name()).stream()
                .filter(task -> task.isRunning())
                .count();
            log.debug("service {}: {}/{} task(s) running", service.name(), running, desired);
            return running == desired;
        } catch (ClusterResourceNotFoundException e) {
            log.debug("service {} not found while checking tasks", service.name());
            return false;
        }
    }

    /**
     * Long-running agent services of the universe; run-once services are expected to exit and are
     * left out.
     */
    public List<ClusterService> listAgentServices(String universe) {
        return cluster.listServices(ClusterResourceManager.universeLabels(universe)).stream()
            .filter(service -> AgentServiceNames.isAgentService(service.name()))
            .filter(service -> !service.runOnce())
            .toList();
    }

    boolean probeInfra(String serviceName) {
        Set<String> addresses = cluster.resolveTaskAddresses(serviceName);
        if (addresses.isEmpty()) {
            log.info("no task address found for {}", serviceName);
            return false;
        }
        log.info("found ips {} for service {}", addresses, serviceName);
        for (String address : addresses) {
            if (!statusProbe.isUp(address)) {
                return false;
            }
        }
        return true;
    }

    boolean checkAgents(String universe, boolean failFast) {
        log.info("listing agent services of universe {}", universe);
        boolean allHealthy = true;
        for (ClusterService service : listAgentServices(universe)) {
            if (isServiceHealthy(service, null)) {
                log.info("agent service {} is healthy", service.name());
                continue;
            }
            log.error("agent service {} is not healthy", service.name());
            if (failFast) {
                return false;
            }
            allHealthy = false;
        }
        return allHealthy;
    }
}
