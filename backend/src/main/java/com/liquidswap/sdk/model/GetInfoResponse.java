package com.liquidswap.sdk.model;

/**
 * Wallet balance (native asset, sat) plus amounts still travelling through active swaps.
 */
public record GetInfoResponse(long balanceSat, long pendingSendSat, long pendingReceiveSat, String pubkey) {
}
