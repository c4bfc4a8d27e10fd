package com.liquidswap.api.dto;

public record CheckMessageResponse(boolean valid) {
}
