package com.liquidswap.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Esplora retry policy (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "liquidswap.chain.retry")
@NoArgsConstructor
@Getter
@Setter
public class ChainRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 500. */
    private long baseDelayMs = 500L;

    /** Upper bound of a single delay in ms. Default 8000. */
    private long maxDelayMs = 8_000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Total attempts per request, including the first. Default 3. */
    private int maxAttempts = 3;
}
