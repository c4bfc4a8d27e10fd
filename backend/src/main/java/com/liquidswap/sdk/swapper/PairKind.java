package com.liquidswap.sdk.swapper;

/**
 * Swap directions offered by the counterparty.
 */
public enum PairKind {
    /** Lightning in, Liquid out: receive. */
    REVERSE,
    /** Liquid in, Lightning out: send. */
    SUBMARINE
}
