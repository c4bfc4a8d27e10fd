package com.liquidswap.api.dto;

import jakarta.validation.constraints.NotNull;

public record SignMessageRequest(
        @NotNull(message = "INVALID_MESSAGE")
        String message
) {
}
