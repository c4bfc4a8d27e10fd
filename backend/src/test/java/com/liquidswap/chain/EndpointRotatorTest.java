package com.liquidswap.chain;

import com.liquidswap.common.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointRotatorTest {

    @Test
    void next_roundRobinsOverEndpoints() {
        EndpointRotator rotator = new EndpointRotator(List.of("https://a", "https://b"), RetryPolicy.defaultPolicy());
        assertThat(rotator.next()).isEqualTo("https://a");
        assertThat(rotator.next()).isEqualTo("https://b");
        assertThat(rotator.next()).isEqualTo("https://a");
    }

    @Test
    void retrySchedule_comesFromPolicy() {
        EndpointRotator rotator = new EndpointRotator(List.of("https://a"), new RetryPolicy(100L, 1_000L, 0, 4));
        assertThat(rotator.maxAttempts()).isEqualTo(4);
        assertThat(rotator.retryDelayMs(1)).isEqualTo(200L);
    }

    @Test
    void nullPolicy_fallsBackToDefault() {
        EndpointRotator rotator = new EndpointRotator(List.of("https://a"), null);
        assertThat(rotator.maxAttempts()).isEqualTo(RetryPolicy.defaultPolicy().getMaxAttempts());
    }

    @Test
    void emptyEndpoints_rejected() {
        assertThatThrownBy(() -> new EndpointRotator(List.of(), RetryPolicy.defaultPolicy()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
