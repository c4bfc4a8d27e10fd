package com.liquidswap.chain;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Esplora client using WebClient.
 */
public class WebClientEsploraHttpClient implements EsploraHttpClient {

    private final WebClient webClient;

    public WebClientEsploraHttpClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> get(String baseUrl, String path) {
        return webClient.get()
                .uri(stripTrailingSlash(baseUrl) + path)
                .accept(MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, e -> new ChainClientException(e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new ChainClientException(e.getMessage(), e));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
