package com.liquidswap.sdk.model;

import com.liquidswap.domain.SwapState;

/**
 * User-facing payment status. Waiting for a confirmation is reported as pending.
 */
public enum PaymentStatus {
    CREATED,
    PENDING,
    COMPLETE,
    REFUNDABLE,
    REFUNDED,
    EXPIRED,
    FAILED;

    public static PaymentStatus of(SwapState state) {
        return switch (state) {
            case CREATED -> CREATED;
            case WAITING_CONFIRMATION, PENDING -> PENDING;
            case COMPLETE -> COMPLETE;
            case REFUNDABLE -> REFUNDABLE;
            case REFUNDED -> REFUNDED;
            case EXPIRED -> EXPIRED;
            case FAILED -> FAILED;
        };
    }
}
