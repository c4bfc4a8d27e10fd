package com.liquidswap.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A transaction as seen by the wallet (or fetched from a script history). Immutable once confirmed; the same
 * txid may be observed first without a height and later with one.
 */
@Value
@Builder(toBuilder = true)
public class WalletTransaction {

    String txid;
    /** Null (or non-positive) while in the mempool. */
    Integer height;
    Instant timestamp;
    /** Signed per-asset balance delta for the wallet, in satoshi. Empty for foreign transactions. */
    @Singular("balanceEntry")
    Map<String, Long> balance;
    long fee;
    /** nLockTime; 0 when unknown or unset. */
    long lockTime;
    @Singular
    List<WalletTxOut> inputs;
    @Singular
    List<WalletTxOut> outputs;

    public boolean isConfirmed() {
        return height != null && height > 0;
    }

    public long balanceOf(String assetId) {
        Long delta = balance.get(assetId);
        return delta != null ? delta : 0L;
    }

    /** True when the wallet owns at least one input or output. */
    public boolean isWalletOwned() {
        return !balance.isEmpty()
                || inputs.stream().anyMatch(WalletTxOut::isWalletOwned)
                || outputs.stream().anyMatch(WalletTxOut::isWalletOwned);
    }

    public HistoryTxId toHistoryTxId() {
        return new HistoryTxId(txid, isConfirmed() ? height : 0);
    }
}
