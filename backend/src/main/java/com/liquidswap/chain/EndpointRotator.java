package com.liquidswap.chain;

import com.liquidswap.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin endpoint selection with the retry schedule of its {@link RetryPolicy}.
 */
public class EndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;

    public EndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String next() {
        return endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
    }

    /** Delay in ms before retrying after the given zero-based attempt. */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int maxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> endpoints() {
        return endpoints;
    }
}
