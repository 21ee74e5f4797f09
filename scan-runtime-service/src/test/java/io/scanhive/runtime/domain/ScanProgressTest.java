package io.scanhive.runtime.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScanProgressTest {

    @Test
    void liveScansMoveForwardOrEnd() {
        assertThat(ScanProgress.CREATED.canTransitionTo(ScanProgress.IN_PROGRESS)).isTrue();
        assertThat(ScanProgress.CREATED.canTransitionTo(ScanProgress.ERROR)).isTrue();
        assertThat(ScanProgress.IN_PROGRESS.canTransitionTo(ScanProgress.STOPPED)).isTrue();
        assertThat(ScanProgress.IN_PROGRESS.canTransitionTo(ScanProgress.CREATED)).isFalse();
    }

    @Test
    void terminalStatesNeverLeave() {
        assertThat(ScanProgress.ERROR.isTerminal()).isTrue();
        assertThat(ScanProgress.STOPPED.isTerminal()).isTrue();
        assertThat(ScanProgress.ERROR.canTransitionTo(ScanProgress.STOPPED)).isFalse();
        assertThat(ScanProgress.STOPPED.canTransitionTo(ScanProgress.IN_PROGRESS)).isFalse();
        assertThat(ScanProgress.STOPPED.canTransitionTo(ScanProgress.STOPPED)).isTrue();
    }

    @Test
    void failureKindsCarryRecoverability() {
        assertThat(ScanFailure.agentNotHealthy("agents").recoverable()).isTrue();
        assertThat(ScanFailure.agentNotInstalled("agent/x").recoverable()).isFalse();
        assertThat(ScanFailure.infraUnhealthy("mq_1").recoverable()).isFalse();
        assertThat(ScanFailure.infraUnhealthy("mq_1").message()).isEqualTo("Service mq_1 is unhealthy.");
    }
}
