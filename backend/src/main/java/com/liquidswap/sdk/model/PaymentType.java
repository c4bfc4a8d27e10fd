package com.liquidswap.sdk.model;

public enum PaymentType {
    RECEIVE,
    SEND
}
