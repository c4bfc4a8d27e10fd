package com.liquidswap.recovery;

/**
 * Matched history of a swap. {@code serverLeg} is {@link LegHistory#EMPTY} for single-chain swaps.
 */
public record SwapHistory(LegHistory userLeg, LegHistory serverLeg) {

    public static final SwapHistory EMPTY = new SwapHistory(LegHistory.EMPTY, LegHistory.EMPTY);
}
