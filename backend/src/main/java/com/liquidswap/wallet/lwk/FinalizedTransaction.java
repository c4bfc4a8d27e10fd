package com.liquidswap.wallet.lwk;

/**
 * Signed, finalized transaction ready for broadcast.
 */
public record FinalizedTransaction(String txid, String hex) {
}
