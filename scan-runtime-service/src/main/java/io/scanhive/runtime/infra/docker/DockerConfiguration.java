package io.scanhive.runtime.infra.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import io.scanhive.docker.ClusterResourceManager;
import io.scanhive.docker.swarm.DockerSwarmClusterResourceManager;
import io.scanhive.runtime.agent.AgentImageResolver;
import io.scanhive.runtime.agent.AgentInstaller;
import io.scanhive.runtime.config.ScanRuntimeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DockerConfiguration {
    private final ScanRuntimeProperties properties;

    public DockerConfiguration(ScanRuntimeProperties properties) {
        this.properties = properties;
    }

    @Bean
    public DefaultDockerClientConfig dockerClientConfig() {
        DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        ScanRuntimeProperties.Docker docker = properties.getDocker();
        if (docker.hasHost()) {
            builder.withDockerHost(docker.host());
        } else {
            builder.withDockerHost("unix://" + docker.socketPath());
        }
        return builder.build();
    }

    @Bean
    public DockerClient dockerClient(DefaultDockerClientConfig config) {
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
            .dockerHost(config.getDockerHost())
            .sslConfig(config.getSSLConfig())
            .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    /**
     * The local engine is joined to a single node swarm on first use, as services need one.
     */
    @Bean
    public ClusterResourceManager clusterResourceManager(DockerClient dockerClient) {
        DockerSwarmClusterResourceManager manager = new DockerSwarmClusterResourceManager(dockerClient);
        manager.ensureSwarmInitialized();
        return manager;
    }

    @Bean
    public AgentImageResolver agentImageResolver(DockerClient dockerClient) {
        return new DockerAgentImageResolver(dockerClient);
    }

    @Bean
    public AgentInstaller agentInstaller(DockerClient dockerClient) {
        return new DockerAgentInstaller(dockerClient);
    }
}
