package com.liquidswap.domain;

/**
 * Compact (txid, height) key used to correlate chain history with swap scripts. Height 0 or below = mempool.
 */
public record HistoryTxId(String txid, int height) {

    public boolean isConfirmed() {
        return height > 0;
    }

    /**
     * Number of confirmations at the given tip; 0 for a mempool transaction.
     */
    public int maturity(int tip) {
        if (!isConfirmed()) {
            return 0;
        }
        return Math.max(0, tip - height + 1);
    }
}
