package io.scanhive.runtime.agent;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.scanhive.runtime.broker.BrokerEndpoint;
import io.scanhive.scan.model.AgentArg;
import io.scanhive.scan.model.AgentSettings;
import java.util.List;

/**
 * Settings document mounted into every agent container; agents read their bus coordinates and
 * arguments from it.
 */
public record AgentInstanceSettings(
    @JsonProperty("key") String key,
    @JsonProperty("bus_url") String busUrl,
    @JsonProperty("bus_exchange_topic") String busExchangeTopic,
    @JsonProperty("bus_management_url") String busManagementUrl,
    @JsonProperty("bus_vhost") String busVhost,
    @JsonProperty("args") List<AgentArg> args,
    @JsonProperty("mounts") List<String> mounts,
    @JsonProperty("restart_policy") String restartPolicy,
    @JsonProperty("replicas") int replicas,
    @JsonProperty("healthcheck_host") String healthcheckHost,
    @JsonProperty("healthcheck_port") int healthcheckPort) {

    static final String HEALTHCHECK_HOST = "0.0.0.0";

    public AgentInstanceSettings {
        args = args == null ? List.of() : List.copyOf(args);
        mounts = mounts == null ? List.of() : List.copyOf(mounts);
    }

    public static AgentInstanceSettings of(AgentSettings settings, BrokerEndpoint broker, int healthcheckPort) {
        return new AgentInstanceSettings(
            settings.key(),
            broker.url(),
            broker.exchangeTopic(),
            broker.managementUrl(),
            broker.vhost(),
            settings.args(),
            settings.mounts(),
            settings.restartPolicy().value(),
            settings.replicas(),
            HEALTHCHECK_HOST,
            healthcheckPort);
    }
}
