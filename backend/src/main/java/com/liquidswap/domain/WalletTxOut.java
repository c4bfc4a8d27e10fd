package com.liquidswap.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One side (input or output) of a transaction. For inputs, {@code txid}/{@code vout} is the spent outpoint
 * and {@code scriptPubKey} the script of the spent output when known.
 * {@code assetId} and {@code value} are null when the output is blinded and not ours to unblind.
 * {@code witness} holds the input's witness stack as hex, empty when the source does not report it.
 */
@Value
@Builder
public class WalletTxOut {
    String txid;
    int vout;
    String scriptPubKey;
    String assetId;
    Long value;
    boolean walletOwned;
    @Singular("witnessItem")
    List<String> witness;

    public boolean paysTo(String script) {
        return script != null && script.equalsIgnoreCase(scriptPubKey);
    }

    public boolean isOutpoint(String otherTxid, int otherVout) {
        return vout == otherVout && txid != null && txid.equalsIgnoreCase(otherTxid);
    }
}
