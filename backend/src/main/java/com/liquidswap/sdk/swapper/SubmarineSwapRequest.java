package com.liquidswap.sdk.swapper;

public record SubmarineSwapRequest(String invoice, String refundPublicKey, String pairHash) {
}
