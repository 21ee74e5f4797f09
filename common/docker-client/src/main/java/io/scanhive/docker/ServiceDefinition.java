package io.scanhive.docker;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to materialize a replicated cluster service.
 *
 * @param name     service name, unique on the cluster
 * @param image    container image reference
 * @param args     container arguments
 * @param env      environment variables
 * @param mounts   bind mounts in {@code source:target[:mode]} form
 * @param runOnce  {@code true} for tasks that must not be restarted once they exit
 * @param replicas requested replica count
 * @param network  network to attach the service to, may be {@code null}
 * @param labels   service labels
 * @param configs  configs mounted into the service's containers
 */
public record ServiceDefinition(String name,
                                String image,
                                List<String> args,
                                Map<String, String> env,
                                List<String> mounts,
                                boolean runOnce,
                                int replicas,
                                String network,
                                Map<String, String> labels,
                                List<ConfigReference> configs) {
    public ServiceDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("service name must not be blank");
        }
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("service image must not be blank");
        }
        if (replicas < 0) {
            throw new IllegalArgumentException("replicas must not be negative");
        }
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
        mounts = mounts == null ? List.of() : List.copyOf(mounts);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        configs = configs == null ? List.of() : List.copyOf(configs);
    }

    public ServiceDefinition withReplicas(int count) {
        return new ServiceDefinition(name, image, args, env, mounts, runOnce, count, network, labels, configs);
    }
}
