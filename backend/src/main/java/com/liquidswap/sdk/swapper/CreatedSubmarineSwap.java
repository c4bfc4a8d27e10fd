package com.liquidswap.sdk.swapper;

/**
 * @param lockupAddress      Liquid address we pay the lockup to
 * @param lockupScript       its scriptPubKey, hex
 * @param expectedAmountSat  amount the counterparty expects in the lockup
 * @param timeoutBlockHeight Liquid height after which we may refund
 */
public record CreatedSubmarineSwap(String id, String lockupAddress, String lockupScript, long expectedAmountSat,
                                   int timeoutBlockHeight) {
}
