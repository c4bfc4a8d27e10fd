package com.liquidswap.sdk.model;

import com.liquidswap.domain.SwapRecord;

import java.time.Instant;
import java.util.List;

/**
 * On-disk backup: every swap record (archived ones included) and the derivation counter.
 */
public record BackupFile(int version, Instant createdAt, Integer lastDerivationIndex, List<SwapRecord> swaps) {

    public static final int CURRENT_VERSION = 1;
}
