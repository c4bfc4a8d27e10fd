package com.liquidswap.sdk.swapper;

/**
 * Counterparty quote for one direction.
 *
 * @param hash          quote identifier, echoed on swap creation so the counterparty can reject a stale quote
 * @param feePercentage percentage fee on the swapped amount, e.g. 0.25
 * @param minerFeesSat  flat onchain fees charged on top
 */
public record SwapPair(String hash, long minimalSat, long maximalSat, double feePercentage, long minerFeesSat) {

    public boolean inRange(long amountSat) {
        return amountSat >= minimalSat && amountSat <= maximalSat;
    }

    /** {@code ceil(amount * feePercentage / 100) + minerFees}. */
    public long fees(long amountSat) {
        return (long) Math.ceil(amountSat * feePercentage / 100.0) + minerFeesSat;
    }
}
