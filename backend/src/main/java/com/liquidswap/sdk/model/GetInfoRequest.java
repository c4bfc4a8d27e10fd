package com.liquidswap.sdk.model;

/**
 * @param withScan run a full wallet scan before reading balances
 */
public record GetInfoRequest(boolean withScan) {
}
