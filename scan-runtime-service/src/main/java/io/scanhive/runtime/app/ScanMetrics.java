package io.scanhive.runtime.app;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.scanhive.runtime.domain.ScanFailure;
import java.util.Locale;
import java.util.Objects;

/**
 * Counters of scan outcomes and stops.
 */
public class ScanMetrics {

    static final String SCANS = "scanhive.scans";
    static final String STOPS = "scanhive.stops";
    static final String OUTCOME_TAG = "outcome";

    private final MeterRegistry registry;
    private final Counter stops;

    public ScanMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.stops = Counter.builder(STOPS)
            .description("Scans stopped, explicitly or after a failed stage")
            .register(registry);
    }

    public void scanStarted() {
        outcome("in_progress").increment();
    }

    public void scanFailed(ScanFailure failure) {
        String outcome = switch (failure.kind()) {
            case AGENT_NOT_HEALTHY -> "error";
            case AGENT_NOT_INSTALLED, INFRA_UNHEALTHY -> failure.kind().name().toLowerCase(Locale.ROOT);
        };
        outcome(outcome).increment();
    }

    public void scanStopped() {
        stops.increment();
    }

    private Counter outcome(String outcome) {
        return Counter.builder(SCANS)
            .tag(OUTCOME_TAG, outcome)
            .register(registry);
    }
}
