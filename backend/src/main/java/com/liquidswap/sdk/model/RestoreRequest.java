package com.liquidswap.sdk.model;

/**
 * @param backupPath backup file to restore from; null restores the default backup of the data directory
 */
public record RestoreRequest(String backupPath) {
}
