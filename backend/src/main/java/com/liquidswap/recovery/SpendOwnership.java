package com.liquidswap.recovery;

import com.liquidswap.domain.SwapKind;

/**
 * Which spend path of a lockup output pays us. Decides how a Liquid spend is classified when neither a known
 * destination script nor its {@link SpendPath} settles it.
 */
public enum SpendOwnership {
    CLAIM_IS_OURS,
    REFUND_IS_OURS;

    public static SpendOwnership userLeg(SwapKind kind) {
        return switch (kind) {
            case RECEIVE -> CLAIM_IS_OURS;
            case SEND, CHAIN_SEND, CHAIN_RECEIVE -> REFUND_IS_OURS;
        };
    }

    /** Counterparty-locked leg of a chain swap; we always claim it. */
    public static SpendOwnership serverLeg() {
        return CLAIM_IS_OURS;
    }
}
