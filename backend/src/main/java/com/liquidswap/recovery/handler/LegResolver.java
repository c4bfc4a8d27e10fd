package com.liquidswap.recovery.handler;

import com.liquidswap.domain.LegState;
import com.liquidswap.recovery.LegHistory;
import com.liquidswap.recovery.MatchedTx;

import java.util.Optional;

/**
 * Resolves one leg: claim, then refund, then timeout, then lockup. When both a claim and a refund match, the claim
 * stands only with strictly more confirmations than the refund; otherwise the leg is {@link LegState#AMBIGUOUS}.
 * A transaction counts as confirmed once it has a block height.
 */
public final class LegResolver {

    public static final String AMBIGUOUS_REASON = "ambiguous-resolution";

    private LegResolver() {
    }

    /**
     * @param timeoutHeight null when the leg has no timeout
     * @param tip           tip of the leg's chain
     */
    public static LegState resolve(LegHistory leg, Integer timeoutHeight, int tip) {
        Optional<MatchedTx> claim = leg.claim();
        Optional<MatchedTx> refund = leg.refund();
        if (claim.isPresent() && refund.isPresent()
                && claim.get().maturity(tip) <= refund.get().maturity(tip)) {
            return LegState.AMBIGUOUS;
        }
        if (claim.isPresent()) {
            return claim.get().isConfirmed() ? LegState.CLAIM_CONFIRMED : LegState.CLAIM_UNCONFIRMED;
        }
        if (refund.isPresent()) {
            return LegState.REFUNDED;
        }
        if (timeoutHeight != null && tip > timeoutHeight) {
            return LegState.TIMED_OUT;
        }
        if (leg.lockup().isPresent()) {
            return leg.lockup().get().isConfirmed() ? LegState.LOCKUP_CONFIRMED : LegState.LOCKUP_UNCONFIRMED;
        }
        return LegState.NONE;
    }
}
