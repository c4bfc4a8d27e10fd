package com.liquidswap.domain;

/**
 * Resolution of one swap leg (one lockup output and its spends) on its chain.
 */
public enum LegState {
    NONE,
    LOCKUP_UNCONFIRMED,
    LOCKUP_CONFIRMED,
    CLAIM_UNCONFIRMED,
    CLAIM_CONFIRMED,
    REFUNDED,
    TIMED_OUT,
    AMBIGUOUS
}
