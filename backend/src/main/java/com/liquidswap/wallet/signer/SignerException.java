package com.liquidswap.wallet.signer;

/**
 * Thrown when the signer cannot produce keys or signatures.
 */
public class SignerException extends RuntimeException {

    public SignerException(String message) {
        super(message);
    }

    public SignerException(String message, Throwable cause) {
        super(message, cause);
    }
}
