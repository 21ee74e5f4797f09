package io.scanhive.runtime.agent;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scanhive.docker.ClusterConfig;
import io.scanhive.docker.ClusterResourceManager;
import io.scanhive.docker.ConfigReference;
import io.scanhive.docker.ServiceDefinition;
import io.scanhive.runtime.broker.BrokerEndpoint;
import io.scanhive.runtime.logs.LogStreamer;
import io.scanhive.runtime.support.FakeClusterResourceManager;
import io.scanhive.scan.model.AgentArg;
import io.scanhive.scan.model.AgentSettings;
import io.scanhive.scan.model.RestartPolicy;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AgentSequencerTest {

    private static final BrokerEndpoint BROKER = new BrokerEndpoint(
        "mq_1", "amqp://guest:guest@mq_1:5672/", "scanhive.topic", "http://mq_1:15672/", "/");

    private final FakeClusterResourceManager cluster = new FakeClusterResourceManager();
    private final ObjectMapper mapper = new ObjectMapper();
    private final AgentSequencer sequencer = new AgentSequencer(
        cluster,
        key -> key.endsWith("missing") ? Optional.empty() : Optional.of(key + ":latest"),
        new LogStreamer(cluster),
        mapper,
        5000);

    @Test
    void multiReplicaAgentIsCreatedWithOneReplicaThenScaled() {
        AgentStartResult result = sequencer.startAgent(context(Set.of()), AgentSettings.of("agent/scanhive/nmap").withReplicas(3));

        assertThat(result).isInstanceOf(AgentStartResult.Started.class);
        assertThat(cluster.operations()).containsSubsequence(
            "createService:agent_scanhive_nmap_1:1",
            "scale:agent_scanhive_nmap_1:3");
        assertThat(cluster.listTasks("agent_scanhive_nmap_1")).hasSize(3).allMatch(task -> task.isRunning());
    }

    @Test
    void singleReplicaAgentIsNotScaled() {
        sequencer.startAgent(context(Set.of()), AgentSettings.of("agent/scanhive/nmap"));

        assertThat(cluster.operations()).noneMatch(op -> op.startsWith("scale:"));
    }

    @Test
    void missingImageCreatesNothing() {
        AgentStartResult result = sequencer.startAgent(context(Set.of()), AgentSettings.of("agent/scanhive/missing"));

        assertThat(result).isEqualTo(new AgentStartResult.NotInstalled("agent/scanhive/missing"));
        assertThat(cluster.isEmpty()).isTrue();
    }

    @Test
    void serviceCarriesSettingsConfigLabelsAndRunPolicy() throws Exception {
        AgentSettings settings = new AgentSettings(
            "agent/scanhive/whois",
            List.of(new AgentArg("depth", "number", "2")),
            1,
            null,
            List.of("/data:/data"),
            RestartPolicy.NONE);

        sequencer.startAgent(context(Set.of()), settings);

        ServiceDefinition definition = cluster.definition("agent_scanhive_whois_1");
        assertThat(definition.image()).isEqualTo("agent/scanhive/whois:latest");
        assertThat(definition.runOnce()).isTrue();
        assertThat(definition.network()).isEqualTo("scanhive_local_network_1");
        assertThat(definition.labels()).isEqualTo(ClusterResourceManager.universeLabels("1"));
        assertThat(definition.env()).containsEntry("UNIVERSE", "1");
        assertThat(definition.mounts()).containsExactly("/data:/data");
        assertThat(definition.configs()).extracting(ConfigReference::fileName).containsExactly("/tmp/settings.json");

        JsonNode document = mapper.readTree(cluster.configData("settings_agent_scanhive_whois_1"));
        assertThat(document.get("key").asText()).isEqualTo("agent/scanhive/whois");
        assertThat(document.get("bus_url").asText()).isEqualTo("amqp://guest:guest@mq_1:5672/");
        assertThat(document.get("bus_exchange_topic").asText()).isEqualTo("scanhive.topic");
        assertThat(document.get("bus_management_url").asText()).isEqualTo("http://mq_1:15672/");
        assertThat(document.get("bus_vhost").asText()).isEqualTo("/");
        assertThat(document.get("restart_policy").asText()).isEqualTo("none");
        assertThat(document.get("replicas").asInt()).isEqualTo(1);
        assertThat(document.get("healthcheck_port").asInt()).isEqualTo(5000);
        assertThat(document.get("args").get(0).get("name").asText()).isEqualTo("depth");
    }

    @Test
    void extraConfigsAreMountedAfterSettings() {
        ClusterConfig asset = cluster.createConfig("asset_1", ClusterResourceManager.universeLabels("1"), new byte[] {1});

        sequencer.startAgent(context(Set.of()), AgentSettings.of("agent/scanhive/inject_asset"),
            List.of(asset.mountedAt("/tmp/asset.binproto")));

        assertThat(cluster.definition("agent_scanhive_inject_asset_1").configs())
            .extracting(ConfigReference::configName)
            .containsExactly("settings_agent_scanhive_inject_asset_1", "asset_1");
    }

    @Test
    void longAgentKeyKeepsSettingsConfigWithinTheConfigNameLimit() {
        String key = "agent/acme/" + "k".repeat(50);

        sequencer.startAgent(context(Set.of()), AgentSettings.of(key));

        assertThat(cluster.configNames()).singleElement()
            .satisfies(name -> assertThat(name).startsWith("settings_agent_acme_k").endsWith("_1").hasSizeLessThanOrEqualTo(64));
        assertThat(cluster.serviceNames()).singleElement()
            .satisfies(name -> assertThat("settings_" + name).isEqualTo(cluster.configNames().iterator().next()));
    }

    @Test
    void followedAgentLogsAreStreamed() {
        sequencer.startAgent(context(Set.of("agent/scanhive/nmap")), AgentSettings.of("agent/scanhive/nmap"));
        sequencer.startAgent(context(Set.of("agent/scanhive/nmap")), AgentSettings.of("agent/scanhive/whois"));

        assertThat(cluster.followed()).containsExactly("agent_scanhive_nmap_1");
    }

    private static ScanContext context(Set<String> follow) {
        return new ScanContext("1", "scanhive_local_network_1", BROKER, follow);
    }
}
