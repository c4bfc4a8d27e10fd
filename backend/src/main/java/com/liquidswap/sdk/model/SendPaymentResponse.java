package com.liquidswap.sdk.model;

/**
 * @param txid lockup transaction broadcast on Liquid
 */
public record SendPaymentResponse(String txid) {
}
