package io.scanhive.runtime.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AgentServiceNamesTest {

    @Test
    void derivesServiceNameFromKeyAndUniverse() {
        assertThat(AgentServiceNames.serviceName("agent/scanhive/nmap", "7")).isEqualTo("agent_scanhive_nmap_7");
        assertThat(AgentServiceNames.serviceName("agent/Acme/Tls.Check:1.0", "12")).isEqualTo("agent_acme_tls_check_12");
        assertThat(AgentServiceNames.serviceName("whois", "3")).isEqualTo("agent_whois_3");
    }

    @Test
    void longKeysAreTruncatedButKeepTheUniverse() {
        String name = AgentServiceNames.serviceName("agent/scanhive/" + "x".repeat(80), "12345");

        assertThat(name).hasSize(AgentServiceNames.MAX_LENGTH).startsWith("agent_scanhive_x").endsWith("_12345");
    }

    @Test
    void settingsConfigOfTheLongestServiceNameFitsTheConfigLimit() {
        String service = AgentServiceNames.serviceName("agent/acme/" + "k".repeat(50), "1");

        String config = AgentServiceNames.settingsConfigName(service);

        assertThat(service).hasSize(AgentServiceNames.MAX_LENGTH).endsWith("_1");
        assertThat(config).isEqualTo("settings_" + service).hasSize(64);
    }

    @Test
    void settingsConfigNameOfShortServiceIsPrefixed() {
        assertThat(AgentServiceNames.settingsConfigName("agent_scanhive_nmap_7")).isEqualTo("settings_agent_scanhive_nmap_7");
    }

    @Test
    void recognisesAgentServices() {
        assertThat(AgentServiceNames.isAgentService("agent_scanhive_nmap_7")).isTrue();
        assertThat(AgentServiceNames.isAgentService("mq_7")).isFalse();
        assertThat(AgentServiceNames.isAgentService(null)).isFalse();
    }

    @Test
    void rejectsBlankKey() {
        assertThatThrownBy(() -> AgentServiceNames.serviceName(" ", "1"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
