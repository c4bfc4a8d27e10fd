package com.liquidswap.sdk.model;

import jakarta.validation.constraints.Positive;

public record PrepareReceiveRequest(
        @Positive(message = "INVALID_AMOUNT")
        long payerAmountSat
) {
}
