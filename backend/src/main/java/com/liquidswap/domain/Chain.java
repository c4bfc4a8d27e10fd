package com.liquidswap.domain;

/**
 * Chains a swap leg can live on.
 */
public enum Chain {
    LIQUID,
    BITCOIN
}
