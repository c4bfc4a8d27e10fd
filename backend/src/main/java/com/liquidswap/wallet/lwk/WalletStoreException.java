package com.liquidswap.wallet.lwk;

/**
 * The local wallet store could not be read or is inconsistent with the descriptor.
 */
public class WalletStoreException extends DescriptorWalletException {

    public WalletStoreException(String message) {
        super(message);
    }

    public WalletStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
