package io.scanhive.runtime.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.scanhive.docker.DockerDaemonUnavailableException;
import io.scanhive.runtime.app.ScanRuntime;
import io.scanhive.runtime.app.VulnzDumper;
import io.scanhive.runtime.domain.Scan;
import io.scanhive.runtime.domain.ScanFailure;
import io.scanhive.runtime.domain.ScanOutcome;
import io.scanhive.runtime.domain.ScanProgress;
import io.scanhive.runtime.domain.ServiceUnhealthyException;
import io.scanhive.runtime.domain.Vulnerability;
import io.scanhive.runtime.support.InMemoryScanRecordStore;
import io.scanhive.scan.model.AgentGroupDefinition;
import io.scanhive.scan.model.Asset;
import io.scanhive.scan.model.DomainNameAsset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ScanControllerTest {

    private static final String SCAN_REQUEST = """
        {
          "title": "nightly",
          "agentGroup": {
            "description": "recon",
            "agents": [
              {"key": "agent/scanhive/nmap", "replicas": 2, "args": [{"name": "ports", "value": "1-1024"}]}
            ]
          },
          "asset": {"type": "domain_name", "name": "example.com"}
        }
        """;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final ScanRuntime runtime = mock(ScanRuntime.class);
    private final InMemoryScanRecordStore scans = new InMemoryScanRecordStore();
    private MockMvc mvc;

    @BeforeEach
    void setup() {
        VulnzDumper dumper = new VulnzDumper(scans, scanId -> List.of(
            new Vulnerability(1, scanId, "Open port", "Port 22 is open", "LOW", "CVSS:3.1/AV:N")), mapper);
        mvc = MockMvcBuilders.standaloneSetup(new ScanController(runtime, dumper), new AgentController(runtime))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(
                new StringHttpMessageConverter(StandardCharsets.UTF_8),
                new MappingJackson2HttpMessageConverter(mapper))
            .build();
    }

    @Test
    void scanDelegatesToRuntime() throws Exception {
        when(runtime.scan(eq("nightly"), any(AgentGroupDefinition.class), any(Asset.class)))
            .thenReturn(ScanOutcome.started(7));

        mvc.perform(post("/api/scans").contentType(MediaType.APPLICATION_JSON).content(SCAN_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scanId").value(7))
            .andExpect(jsonPath("$.progress").value("IN_PROGRESS"));

        ArgumentCaptor<AgentGroupDefinition> group = ArgumentCaptor.forClass(AgentGroupDefinition.class);
        ArgumentCaptor<Asset> asset = ArgumentCaptor.forClass(Asset.class);
        verify(runtime).scan(eq("nightly"), group.capture(), asset.capture());
        assertThat(group.getValue().agents()).singleElement()
            .satisfies(agent -> {
                assertThat(agent.key()).isEqualTo("agent/scanhive/nmap");
                assertThat(agent.replicas()).isEqualTo(2);
                assertThat(agent.args().get(0).value()).isEqualTo("1-1024");
            });
        assertThat(asset.getValue()).isEqualTo(new DomainNameAsset("example.com"));
    }

    @Test
    void failedScanIsReturnedWithItsFailure() throws Exception {
        when(runtime.scan(eq("nightly"), any(AgentGroupDefinition.class), any(Asset.class)))
            .thenReturn(ScanOutcome.failed(7, ScanProgress.ERROR, ScanFailure.agentNotHealthy("agents")));

        mvc.perform(post("/api/scans").contentType(MediaType.APPLICATION_JSON).content(SCAN_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.progress").value("ERROR"))
            .andExpect(jsonPath("$.failure.kind").value("AGENT_NOT_HEALTHY"))
            .andExpect(jsonPath("$.failure.recoverable").value(true));
    }

    @Test
    void unhealthyInfrastructureMapsToServiceUnavailable() throws Exception {
        when(runtime.scan(eq("nightly"), any(AgentGroupDefinition.class), any(Asset.class)))
            .thenThrow(new ServiceUnhealthyException(7, ScanFailure.infraUnhealthy("mq_7")));

        mvc.perform(post("/api/scans").contentType(MediaType.APPLICATION_JSON).content(SCAN_REQUEST))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.scanId").value(7))
            .andExpect(jsonPath("$.kind").value("INFRA_UNHEALTHY"))
            .andExpect(jsonPath("$.message").value("Service mq_7 is unhealthy."));
    }

    @Test
    void unreachableDockerDaemonMapsToServiceUnavailable() throws Exception {
        doThrow(new DockerDaemonUnavailableException("list services", "Start Docker.", new IllegalStateException("refused")))
            .when(runtime).stop(3L);

        mvc.perform(delete("/api/scans/3"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.message")
                .value("Unable to list services because the Docker daemon is unavailable. Start Docker."));
    }

    @Test
    void scanWithoutAssetIsRejected() throws Exception {
        mvc.perform(post("/api/scans").contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"nightly\",\"agentGroup\":{\"agents\":[]}}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(runtime);
    }

    @Test
    void stopReturnsNoContent() throws Exception {
        mvc.perform(delete("/api/scans/5"))
            .andExpect(status().isNoContent());

        verify(runtime).stop(5L);
    }

    @Test
    void listPassesPaginationThrough() throws Exception {
        when(runtime.list(2, 10)).thenReturn(List.of(
            new Scan(1, "nightly", "Domain Name: example.com", ScanProgress.STOPPED, Instant.parse("2024-01-01T00:00:00Z"))));

        mvc.perform(get("/api/scans").param("page", "2").param("size", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(1))
            .andExpect(jsonPath("$[0].progress").value("STOPPED"));
    }

    @Test
    void vulnerabilitiesAreDumpedAsCsv() throws Exception {
        scans.create("nightly", "Domain Name: example.com");

        mvc.perform(get("/api/scans/1/vulnerabilities").param("format", "csv"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("text/csv"))
            .andExpect(content().string(
                "id,title,risk_rating,cvss_v3_vector,short_description\r\n"
                    + "1,Open port,LOW,CVSS:3.1/AV:N,Port 22 is open\r\n"));
    }

    @Test
    void vulnerabilitiesOfUnknownScanAreNotFound() throws Exception {
        mvc.perform(get("/api/scans/9/vulnerabilities"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.scanId").value(9));
    }

    @Test
    void unsupportedDumpFormatIsBadRequest() throws Exception {
        scans.create("nightly", "Domain Name: example.com");

        mvc.perform(get("/api/scans/1/vulnerabilities").param("format", "xml"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void installDelegatesToRuntime() throws Exception {
        mvc.perform(post("/api/agents/install"))
            .andExpect(status().isNoContent());

        verify(runtime).install();
    }
}
