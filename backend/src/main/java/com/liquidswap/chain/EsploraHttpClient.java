package com.liquidswap.chain;

import reactor.core.publisher.Mono;

/**
 * Esplora REST transport. Retries and endpoint rotation are handled by the caller.
 */
public interface EsploraHttpClient {

    /**
     * GET {@code baseUrl + path}.
     *
     * @return response body; errors with {@link ChainClientException} on HTTP failure
     */
    Mono<String> get(String baseUrl, String path);
}
