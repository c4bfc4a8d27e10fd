package com.liquidswap.sdk.model;

import jakarta.validation.constraints.NotBlank;

public record PrepareSendRequest(
        @NotBlank(message = "INVALID_INVOICE")
        String invoice
) {
}
