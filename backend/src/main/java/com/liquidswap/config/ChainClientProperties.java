package com.liquidswap.config;

import com.liquidswap.domain.Chain;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Esplora endpoints used to query swap-script history, per chain, plus shared throttling.
 */
@ConfigurationProperties(prefix = "liquidswap.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainClientProperties {

    /** Esplora base URLs per chain (LIQUID, BITCOIN). A chain with no URLs gets no history client. */
    private Map<Chain, Endpoint> endpoints = new EnumMap<>(Chain.class);

    /** Shared Esplora budget (requests per second) for this instance. */
    private int maxRequestsPerSecond = 10;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 5_000;

    /** Max history pages fetched per script. */
    private int maxPages = 20;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Endpoint {
        private List<String> urls = new ArrayList<>();
    }
}
