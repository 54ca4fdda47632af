package com.ledgerlens.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_firstFailure_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            long d = policy.delayMs(1);
            assertThat(d).isBetween(800L, 1200L); // ±20% of 1000
        }
    }

    @Test
    void delayMs_exponentialIncreases() {
        RetryPolicy policy = new RetryPolicy(2000L, 0, 3); // no jitter for deterministic test
        assertThat(policy.delayMs(1)).isEqualTo(2000L);
        assertThat(policy.delayMs(2)).isEqualTo(4000L);
        assertThat(policy.delayMs(3)).isEqualTo(8000L);
    }

    @Test
    void canRetry_stopsAtMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(10L, 0, 3);
        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
    }

    @Test
    void constructor_rejectsNonPositiveAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(10L, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultPolicy_hasExpectedMaxAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(3);
        assertThat(RetryPolicy.defaultPolicy().getBaseDelayMs()).isEqualTo(2000L);
    }
}
