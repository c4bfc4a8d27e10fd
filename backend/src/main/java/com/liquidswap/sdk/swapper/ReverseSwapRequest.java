package com.liquidswap.sdk.swapper;

/**
 * @param preimageHash   sha256 of our preimage, hex
 * @param claimPublicKey compressed public key of our claim key, hex
 * @param claimAddress   Liquid address the claim pays to
 */
public record ReverseSwapRequest(long invoiceAmountSat, String preimageHash, String claimPublicKey,
                                 String claimAddress, String pairHash) {
}
