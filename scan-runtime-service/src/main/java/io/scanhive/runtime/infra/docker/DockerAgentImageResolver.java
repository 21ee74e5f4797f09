package io.scanhive.runtime.infra.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.model.Image;
import io.scanhive.runtime.agent.AgentImageResolver;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up a local image whose repository equals the agent key. {@code latest} wins over other
 * tags.
 */
public class DockerAgentImageResolver implements AgentImageResolver {

    static final String LATEST_SUFFIX = ":latest";

    private static final Logger log = LoggerFactory.getLogger(DockerAgentImageResolver.class);

    private final DockerClient dockerClient;

    public DockerAgentImageResolver(DockerClient dockerClient) {
        this.dockerClient = Objects.requireNonNull(dockerClient, "dockerClient");
    }

    @Override
    public Optional<String> resolve(String agentKey) {
        List<Image> images = dockerClient.listImagesCmd().withImageNameFilter(agentKey).exec();
        String match = null;
        for (Image image : images) {
            String[] tags = image.getRepoTags();
            if (tags == null) {
                continue;
            }
            for (String tag : tags) {
                if (!agentKey.equals(repository(tag))) {
                    continue;
                }
                if (tag.endsWith(LATEST_SUFFIX)) {
                    return Optional.of(tag);
                }
                if (match == null) {
                    match = tag;
                }
            }
        }
        if (match == null) {
            log.debug("no local image for agent {}", agentKey);
        }
        return Optional.ofNullable(match);
    }

    static String repository(String repoTag) {
        int colon = repoTag.lastIndexOf(':');
        int slash = repoTag.lastIndexOf('/');
        return colon > slash ? repoTag.substring(0, colon) : repoTag;
    }
}
