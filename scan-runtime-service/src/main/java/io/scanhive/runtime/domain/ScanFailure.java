package io.scanhive.runtime.domain;

import java.util.Objects;

/**
 * Tagged failure of a scan stage. {@code recoverable} failures are cleaned up by the runtime and
 * end the scan in {@link ScanProgress#ERROR}; the others leave resources and the record untouched.
 */
public record ScanFailure(Kind kind, boolean recoverable, String subject, String message) {

    public enum Kind {
        INFRA_UNHEALTHY,
        AGENT_NOT_INSTALLED,
        AGENT_NOT_HEALTHY
    }

    public ScanFailure {
        kind = Objects.requireNonNull(kind, "kind");
        subject = subject == null ? "" : subject;
        message = message == null ? "" : message;
    }

    public static ScanFailure infraUnhealthy(String serviceName) {
        return new ScanFailure(Kind.INFRA_UNHEALTHY, false, serviceName,
            "Service " + serviceName + " is unhealthy.");
    }

    public static ScanFailure agentNotInstalled(String agentKey) {
        return new ScanFailure(Kind.AGENT_NOT_INSTALLED, false, agentKey,
            "Agent " + agentKey + " not installed");
    }

    public static ScanFailure agentNotHealthy(String stage) {
        return new ScanFailure(Kind.AGENT_NOT_HEALTHY, true, stage,
            "Agents of stage " + stage + " are not healthy");
    }
}
