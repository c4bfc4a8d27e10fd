package com.liquidswap.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 60_000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            long d = policy.delayMs(0);
            assertThat(d).isBetween(800L, 1200L); // ±20% of 1000
        }
    }

    @Test
    void delayMs_exponentialIncreases() {
        RetryPolicy policy = new RetryPolicy(100L, 60_000L, 0, 5); // no jitter for deterministic test
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
    }

    @Test
    void delayMs_cappedAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(500L, 2_000L, 0, 10);
        assertThat(policy.delayMs(3)).isEqualTo(2_000L);
        assertThat(policy.delayMs(40)).isEqualTo(2_000L);
    }

    @Test
    void defaultPolicy_hasExpectedMaxAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 1_000L, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
