package com.liquidswap.sdk.model;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Fee quote for a receive. Passed back unchanged to {@code receivePayment}; a stale quote is rejected there.
 */
public record PrepareReceiveResponse(
        @Positive(message = "INVALID_AMOUNT")
        long payerAmountSat,

        @PositiveOrZero(message = "INVALID_FEES")
        long feesSat
) {
}
