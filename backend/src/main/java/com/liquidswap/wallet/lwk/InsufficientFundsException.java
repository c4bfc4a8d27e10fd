package com.liquidswap.wallet.lwk;

/**
 * Coin selection could not cover the requested amount plus fee.
 */
public class InsufficientFundsException extends DescriptorWalletException {

    public InsufficientFundsException(String message) {
        super(message);
    }
}
