package io.scanhive.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Optional;

/**
 * Immutable definition of one agent inside an agent group.
 *
 * @param key            unique agent identifier, also the image repository of the agent
 * @param args           arguments passed to the agent
 * @param replicas       number of service replicas, at least one
 * @param containerImage resolved image reference; {@code null} until the image is known to be installed
 * @param mounts         bind mounts in {@code source:target} form
 * @param restartPolicy  long-running or run-once behaviour
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSettings(@NotBlank String key,
                            @Valid List<AgentArg> args,
                            @Min(1) Integer replicas,
                            String containerImage,
                            List<String> mounts,
                            RestartPolicy restartPolicy) {
    public AgentSettings {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("agent key must not be blank");
        }
        args = args == null ? List.of() : List.copyOf(args);
        if (replicas == null) {
            replicas = 1;
        } else if (replicas < 1) {
            throw new IllegalArgumentException("replicas must be at least 1 for agent " + key);
        }
        containerImage = containerImage == null || containerImage.isBlank() ? null : containerImage;
        mounts = mounts == null ? List.of() : List.copyOf(mounts);
        restartPolicy = restartPolicy == null ? RestartPolicy.ANY : restartPolicy;
    }

    public static AgentSettings of(String key) {
        return new AgentSettings(key, null, 1, null, null, null);
    }

    public Optional<String> image() {
        return Optional.ofNullable(containerImage);
    }

    public boolean hasContainerImage() {
        return containerImage != null;
    }

    public AgentSettings withContainerImage(String image) {
        return new AgentSettings(key, args, replicas, image, mounts, restartPolicy);
    }

    public AgentSettings withRestartPolicy(RestartPolicy policy) {
        return new AgentSettings(key, args, replicas, containerImage, mounts, policy);
    }

    public AgentSettings withReplicas(int count) {
        return new AgentSettings(key, args, count, containerImage, mounts, restartPolicy);
    }
}
