package com.liquidswap.chain;

/**
 * Thrown when a chain history query fails (HTTP error, bad payload, retries exhausted).
 */
public class ChainClientException extends RuntimeException {

    public ChainClientException(String message) {
        super(message);
    }

    public ChainClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
