package com.liquidswap.sdk.swapper;

/**
 * @param lockupScript        scriptPubKey the counterparty locks funds to, hex
 * @param onchainAmountSat    amount the counterparty locks on Liquid
 * @param timeoutBlockHeight  Liquid height after which the counterparty may refund
 */
public record CreatedReverseSwap(String id, String invoice, String lockupScript, long onchainAmountSat,
                                 int timeoutBlockHeight) {
}
