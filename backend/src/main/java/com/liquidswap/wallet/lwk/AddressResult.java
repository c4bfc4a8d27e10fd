package com.liquidswap.wallet.lwk;

/**
 * Derived address with its derivation index and output script (hex).
 */
public record AddressResult(String address, int index, String scriptPubKey) {
}
