package com.liquidswap.domain;

/**
 * Supported swap directions. Receive and send settle on Liquid only; chain swaps span Liquid and Bitcoin.
 */
public enum SwapKind {

    /** Lightning in, L-BTC out: counterparty locks on Liquid, we claim. */
    RECEIVE,
    /** L-BTC in, Lightning out: we lock on Liquid, counterparty claims. */
    SEND,
    /** BTC in, L-BTC out. */
    CHAIN_RECEIVE,
    /** L-BTC in, BTC out. */
    CHAIN_SEND;

    public boolean isChainSwap() {
        return this == CHAIN_RECEIVE || this == CHAIN_SEND;
    }

    /** Chain of the leg the user funds (or, for RECEIVE, the only leg). */
    public Chain userChain() {
        return this == CHAIN_RECEIVE ? Chain.BITCOIN : Chain.LIQUID;
    }

    /** Chain of the counterparty-funded leg of a chain swap. */
    public Chain serverChain() {
        return this == CHAIN_SEND ? Chain.BITCOIN : Chain.LIQUID;
    }
}
