package com.liquidswap.wallet.lwk;

/**
 * Base failure of the descriptor-wallet library.
 */
public class DescriptorWalletException extends RuntimeException {

    public DescriptorWalletException(String message) {
        super(message);
    }

    public DescriptorWalletException(String message, Throwable cause) {
        super(message, cause);
    }
}
