package com.liquidswap.api.dto;

/**
 * @param signature z-base-32 recoverable signature
 */
public record SignMessageResponse(String signature) {
}
