package com.liquidswap.sdk.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Fee quote for paying {@code invoice}. Passed back unchanged to {@code sendPayment}.
 */
public record PrepareSendResponse(
        @NotBlank(message = "INVALID_INVOICE")
        String invoice,

        @PositiveOrZero(message = "INVALID_FEES")
        long feesSat
) {
}
