package com.liquidswap.sdk.model;

public record ReceivePaymentResponse(String id, String invoice) {
}
