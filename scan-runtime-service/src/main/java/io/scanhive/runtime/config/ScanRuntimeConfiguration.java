package io.scanhive.runtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.scanhive.docker.ClusterResourceManager;
import io.scanhive.runtime.agent.AgentImageResolver;
import io.scanhive.runtime.agent.AgentInstaller;
import io.scanhive.runtime.agent.AgentSequencer;
import io.scanhive.runtime.app.LoggingScanReporter;
import io.scanhive.runtime.app.ScanMetrics;
import io.scanhive.runtime.app.ScanOrchestrator;
import io.scanhive.runtime.app.ScanReporter;
import io.scanhive.runtime.app.VulnzDumper;
import io.scanhive.runtime.broker.BrokerServiceFactory;
import io.scanhive.runtime.broker.LocalRabbitMqBroker;
import io.scanhive.runtime.domain.ScanRecordStore;
import io.scanhive.runtime.domain.VulnerabilityStore;
import io.scanhive.runtime.health.HealthChecker;
import io.scanhive.runtime.health.HttpStatusProbe;
import io.scanhive.runtime.health.Sleeper;
import io.scanhive.runtime.health.StatusProbe;
import io.scanhive.runtime.infra.jdbc.JdbcScanRecordStore;
import io.scanhive.runtime.infra.jdbc.JdbcVulnerabilityStore;
import io.scanhive.runtime.logs.LogStreamer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class ScanRuntimeConfiguration {

    private final ScanRuntimeProperties properties;

    public ScanRuntimeConfiguration(ScanRuntimeProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusProbe statusProbe() {
        ScanRuntimeProperties.Health health = properties.getHealth();
        return new HttpStatusProbe(health.statusPort(), health.statusPath(), health.requestTimeout());
    }

    @Bean
    public HealthChecker healthChecker(ClusterResourceManager cluster, StatusProbe statusProbe, Sleeper sleeper) {
        return new HealthChecker(cluster, statusProbe, properties.getHealth().backoffUnit(), sleeper);
    }

    @Bean(destroyMethod = "close")
    public LogStreamer logStreamer(ClusterResourceManager cluster) {
        return new LogStreamer(cluster);
    }

    @Bean
    public AgentSequencer agentSequencer(ClusterResourceManager cluster,
                                         AgentImageResolver imageResolver,
                                         LogStreamer logStreamer,
                                         ObjectMapper objectMapper) {
        return new AgentSequencer(cluster, imageResolver, logStreamer, objectMapper,
            properties.getHealth().statusPort());
    }

    @Bean
    public BrokerServiceFactory brokerServiceFactory(ClusterResourceManager cluster, HealthChecker healthChecker) {
        return LocalRabbitMqBroker.factory(cluster, healthChecker, properties.getBroker());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanReporter scanReporter() {
        return new LoggingScanReporter();
    }

    @Bean
    public ScanMetrics scanMetrics(MeterRegistry registry) {
        return new ScanMetrics(registry);
    }

    @Bean
    public ScanRecordStore scanRecordStore(JdbcTemplate jdbc) {
        return new JdbcScanRecordStore(jdbc);
    }

    @Bean
    public VulnerabilityStore vulnerabilityStore(JdbcTemplate jdbc) {
        return new JdbcVulnerabilityStore(jdbc);
    }

    @Bean
    public ScanOrchestrator scanOrchestrator(ScanRecordStore store,
                                             ClusterResourceManager cluster,
                                             BrokerServiceFactory brokerFactory,
                                             HealthChecker healthChecker,
                                             AgentSequencer sequencer,
                                             AgentInstaller installer,
                                             LogStreamer logStreamer,
                                             ScanReporter reporter,
                                             ScanMetrics metrics) {
        return new ScanOrchestrator(store, cluster, brokerFactory, healthChecker, sequencer, installer,
            logStreamer, reporter, metrics, properties);
    }

    @Bean
    public VulnzDumper vulnzDumper(ScanRecordStore store, VulnerabilityStore vulnerabilities, ObjectMapper objectMapper) {
        return new VulnzDumper(store, vulnerabilities, objectMapper);
    }
}
