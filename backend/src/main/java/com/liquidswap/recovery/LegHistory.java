package com.liquidswap.recovery;

import java.util.Optional;

/**
 * What the chain shows for one swap leg: its lockup and the spend of the lockup output, classified as claim or
 * refund. Both spends present means the history is contradictory.
 */
public record LegHistory(Optional<MatchedTx> lockup, Optional<MatchedTx> claim, Optional<MatchedTx> refund) {

    public static final LegHistory EMPTY = new LegHistory(Optional.empty(), Optional.empty(), Optional.empty());

    public boolean isEmpty() {
        return lockup.isEmpty() && claim.isEmpty() && refund.isEmpty();
    }
}
