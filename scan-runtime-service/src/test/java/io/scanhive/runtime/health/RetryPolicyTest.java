package io.scanhive.runtime.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    @Test
    void backoffDoublesUntilCap() {
        RetryPolicy policy = RetryPolicy.exponential(20, Duration.ofSeconds(1), 12);

        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.backoffAfter(5)).isEqualTo(Duration.ofSeconds(12));
        assertThat(policy.backoffAfter(19)).isEqualTo(Duration.ofSeconds(12));
    }

    @Test
    void agentPolicyCapsAtTwentyUnits() {
        RetryPolicy policy = RetryPolicy.exponential(20, Duration.ofMillis(500), 20);

        assertThat(policy.backoffAfter(5)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.backoffAfter(6)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.backoffAfter(60)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.exponential(3, Duration.ofSeconds(1), 2).backoffAfter(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
