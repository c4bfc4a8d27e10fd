package com.liquidswap.api.dto;

/**
 * Counters of one sync run: active swaps examined, records changed, swaps left unresolved.
 */
public record SyncResponse(int scanned, int updated, int failed) {
}
