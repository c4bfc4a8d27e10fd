package com.liquidswap.recovery;

/**
 * Outcome of one recovery pass: swaps examined, swaps whose record changed, swaps that could not be resolved.
 */
public record RecoveryReport(int scanned, int updated, int failed) {

    public static RecoveryReport empty() {
        return new RecoveryReport(0, 0, 0);
    }
}
