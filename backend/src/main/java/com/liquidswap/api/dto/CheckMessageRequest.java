package com.liquidswap.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CheckMessageRequest(
        @NotNull(message = "INVALID_MESSAGE")
        String message,

        @NotBlank(message = "INVALID_PUBKEY")
        String pubkey,

        @NotNull(message = "INVALID_SIGNATURE")
        String signature
) {
}
