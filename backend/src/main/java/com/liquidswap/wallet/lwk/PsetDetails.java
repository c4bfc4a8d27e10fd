package com.liquidswap.wallet.lwk;

import java.util.Map;

/**
 * Wallet-relative view of a PSET: signed per-asset balance delta and the fee, in satoshi.
 */
public record PsetDetails(Map<String, Long> balance, long fee) {

    public long balanceOf(String assetId) {
        Long delta = balance.get(assetId);
        return delta != null ? delta : 0L;
    }
}
