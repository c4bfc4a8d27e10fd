package com.liquidswap.recovery;

import com.liquidswap.domain.HistoryTxId;

/**
 * A transaction matched to a swap leg, with the amount it moved through the lockup output when known.
 */
public record MatchedTx(HistoryTxId id, Long amountSat) {

    public String txid() {
        return id.txid();
    }

    public boolean isConfirmed() {
        return id.isConfirmed();
    }

    public int maturity(int tip) {
        return id.maturity(tip);
    }
}
