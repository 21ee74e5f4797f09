package io.scanhive.runtime.infra.docker;

import com.github.dockerjava.api.DockerClient;
import io.scanhive.runtime.agent.AgentInstaller;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls the {@code latest} image of an agent.
 */
public class DockerAgentInstaller implements AgentInstaller {

    static final String DEFAULT_TAG = "latest";

    private static final Logger log = LoggerFactory.getLogger(DockerAgentInstaller.class);

    private final DockerClient dockerClient;

    public DockerAgentInstaller(DockerClient dockerClient) {
        this.dockerClient = Objects.requireNonNull(dockerClient, "dockerClient");
    }

    @Override
    public void install(String agentKey) {
        if (agentKey == null || agentKey.isBlank()) {
            throw new IllegalArgumentException("agent key must not be blank");
        }
        log.info("pulling image {}:{}", agentKey, DEFAULT_TAG);
        try {
            dockerClient.pullImageCmd(agentKey).withTag(DEFAULT_TAG).start().awaitCompletion();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while installing agent " + agentKey, e);
        }
        log.info("agent {} installed", agentKey);
    }
}
