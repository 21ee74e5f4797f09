package io.scanhive.runtime.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scanhive.runtime")
public class ScanRuntimeProperties {

    private final String networkPrefix;
    private final Docker docker;
    private final Broker broker;
    private final Health health;
    private final Agents agents;
    private final Set<String> follow;

    public ScanRuntimeProperties(@DefaultValue("scanhive_local_network") @NotBlank String networkPrefix,
                                 @DefaultValue @Valid Docker docker,
                                 @DefaultValue @Valid Broker broker,
                                 @DefaultValue @Valid Health health,
                                 @DefaultValue @Valid Agents agents,
                                 List<String> follow) {
        this.networkPrefix = requireNonBlank(networkPrefix, "networkPrefix");
        this.docker = Objects.requireNonNull(docker, "docker");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.health = Objects.requireNonNull(health, "health");
        this.agents = Objects.requireNonNull(agents, "agents");
        this.follow = follow == null ? Set.of() : Set.copyOf(follow);
    }

    public String getNetworkPrefix() {
        return networkPrefix;
    }

    public Docker getDocker() {
        return docker;
    }

    public Broker getBroker() {
        return broker;
    }

    public Health getHealth() {
        return health;
    }

    public Agents getAgents() {
        return agents;
    }

    /**
     * Agent keys (and {@code mq} for the broker) whose output is streamed into the runtime log.
     */
    public Set<String> getFollow() {
        return follow;
    }

    @Validated
    public static final class Docker {
        private final String host;
        private final String socketPath;

        public Docker(String host, @DefaultValue("/var/run/docker.sock") @NotBlank String socketPath) {
            this.host = host;
            this.socketPath = requireNonBlank(socketPath, "socketPath");
        }

        public String host() {
            return host;
        }

        public String socketPath() {
            return socketPath;
        }

        public boolean hasHost() {
            return host != null && !host.isBlank();
        }
    }

    @Validated
    public static final class Broker {
        private final String image;
        private final String exchange;
        private final String vhost;
        private final String username;
        private final String password;

        public Broker(@DefaultValue("rabbitmq:3.9-management") @NotBlank String image,
                      @DefaultValue("scanhive.topic") @NotBlank String exchange,
                      @DefaultValue("/") @NotBlank String vhost,
                      @DefaultValue("guest") @NotBlank String username,
                      @DefaultValue("guest") @NotBlank String password) {
            this.image = requireNonBlank(image, "image");
            this.exchange = requireNonBlank(exchange, "exchange");
            this.vhost = requireNonBlank(vhost, "vhost");
            this.username = requireNonBlank(username, "username");
            this.password = requireNonBlank(password, "password");
        }

        public String image() {
            return image;
        }

        public String exchange() {
            return exchange;
        }

        public String vhost() {
            return vhost;
        }

        public String username() {
            return username;
        }

        public String password() {
            return password;
        }
    }

    @Validated
    public static final class Health {
        private final Duration backoffUnit;
        private final int statusPort;
        private final String statusPath;
        private final Duration requestTimeout;

        public Health(@DefaultValue("1s") @NotNull Duration backoffUnit,
                      @DefaultValue("5000") @Min(1) @Max(65535) int statusPort,
                      @DefaultValue("/status") @NotBlank String statusPath,
                      @DefaultValue("5s") @NotNull Duration requestTimeout) {
            this.backoffUnit = Objects.requireNonNull(backoffUnit, "backoffUnit");
            if (backoffUnit.isNegative()) {
                throw new IllegalArgumentException("backoffUnit must not be negative");
            }
            this.statusPort = statusPort;
            this.statusPath = requireNonBlank(statusPath, "statusPath");
            this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        }

        /**
         * Length of one backoff unit; retry waits are whole multiples of it.
         */
        public Duration backoffUnit() {
            return backoffUnit;
        }

        public int statusPort() {
            return statusPort;
        }

        public String statusPath() {
            return statusPath;
        }

        public Duration requestTimeout() {
            return requestTimeout;
        }
    }

    @Validated
    public static final class Agents {
        private final String injectAsset;
        private final String tracker;
        private final String persistVulnz;

        public Agents(@DefaultValue("agent/scanhive/inject_asset") @NotBlank String injectAsset,
                      @DefaultValue("agent/scanhive/tracker") @NotBlank String tracker,
                      @DefaultValue("agent/scanhive/local_persist_vulnz") @NotBlank String persistVulnz) {
            this.injectAsset = requireNonBlank(injectAsset, "injectAsset");
            this.tracker = requireNonBlank(tracker, "tracker");
            this.persistVulnz = requireNonBlank(persistVulnz, "persistVulnz");
        }

        public String injectAsset() {
            return injectAsset;
        }

        public String tracker() {
            return tracker;
        }

        public String persistVulnz() {
            return persistVulnz;
        }

        /**
         * Agents every local scan depends on, in installation order.
         */
        public List<String> defaults() {
            return List.of(injectAsset, tracker, persistVulnz);
        }
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
