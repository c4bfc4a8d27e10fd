package com.liquidswap.domain;

/**
 * Lifecycle of a swap. COMPLETE, REFUNDED, EXPIRED and FAILED are terminal and absorbing.
 */
public enum SwapState {
    CREATED,
    WAITING_CONFIRMATION,
    PENDING,
    COMPLETE,
    REFUNDABLE,
    REFUNDED,
    EXPIRED,
    FAILED;

    public boolean isTerminal() {
        return switch (this) {
            case COMPLETE, REFUNDED, EXPIRED, FAILED -> true;
            case CREATED, WAITING_CONFIRMATION, PENDING, REFUNDABLE -> false;
        };
    }
}
