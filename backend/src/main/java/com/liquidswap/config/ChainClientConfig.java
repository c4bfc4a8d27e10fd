package com.liquidswap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liquidswap.chain.EndpointRotator;
import com.liquidswap.chain.EsploraChainClient;
import com.liquidswap.chain.EsploraHttpClient;
import com.liquidswap.chain.SwapChainClient;
import com.liquidswap.chain.WebClientEsploraHttpClient;
import com.liquidswap.common.RetryPolicy;
import com.liquidswap.domain.Chain;
import com.liquidswap.domain.LiquidNetwork;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Esplora history clients for swap scripts, one per chain. A chain without configured URLs falls back to the
 * public Blockstream Esplora of the wallet's network.
 */
@Configuration
@EnableConfigurationProperties({ ChainClientProperties.class, ChainRetryProperties.class })
public class ChainClientConfig {

    @Autowired
    private ChainRetryProperties retryProperties;

    private RetryPolicy retryPolicy() {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getMaxDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public EsploraHttpClient esploraHttpClient(WebClient.Builder webClientBuilder) {
        return new WebClientEsploraHttpClient(webClientBuilder);
    }

    @Bean(name = "esploraRateLimiter")
    public RateLimiter esploraRateLimiter(ChainClientProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("esplora", config);
    }

    @Bean
    public SwapChainClient liquidChainClient(ChainClientProperties properties,
                                             LiquidSdkProperties sdkProperties,
                                             EsploraHttpClient httpClient,
                                             @Qualifier("esploraRateLimiter") RateLimiter rateLimiter,
                                             ObjectMapper objectMapper) {
        return chainClient(Chain.LIQUID, properties, sdkProperties.getNetwork(), httpClient, rateLimiter, objectMapper);
    }

    @Bean
    public SwapChainClient bitcoinChainClient(ChainClientProperties properties,
                                              LiquidSdkProperties sdkProperties,
                                              EsploraHttpClient httpClient,
                                              @Qualifier("esploraRateLimiter") RateLimiter rateLimiter,
                                              ObjectMapper objectMapper) {
        return chainClient(Chain.BITCOIN, properties, sdkProperties.getNetwork(), httpClient, rateLimiter, objectMapper);
    }

    private SwapChainClient chainClient(Chain chain,
                                        ChainClientProperties properties,
                                        LiquidNetwork network,
                                        EsploraHttpClient httpClient,
                                        RateLimiter rateLimiter,
                                        ObjectMapper objectMapper) {
        ChainClientProperties.Endpoint endpoint = properties.getEndpoints().get(chain);
        List<String> urls = endpoint != null && endpoint.getUrls() != null && !endpoint.getUrls().isEmpty()
                ? endpoint.getUrls()
                : List.of(defaultUrl(chain, network));
        return new EsploraChainClient(chain, httpClient, new EndpointRotator(urls, retryPolicy()), rateLimiter,
                objectMapper, properties.getMaxPages());
    }

    static String defaultUrl(Chain chain, LiquidNetwork network) {
        return switch (network) {
            case MAINNET -> chain == Chain.LIQUID ? "https://blockstream.info/liquid/api" : "https://blockstream.info/api";
            case TESTNET -> chain == Chain.LIQUID
                    ? "https://blockstream.info/liquidtestnet/api"
                    : "https://blockstream.info/testnet/api";
            case REGTEST -> chain == Chain.LIQUID ? "http://localhost:3003/api" : "http://localhost:3002/api";
        };
    }
}
