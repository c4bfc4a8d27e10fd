package com.liquidswap.domain;

/**
 * Liquid network the wallet runs against. Carries the policy (L-BTC) asset id and the BIP44 coin type
 * used for the wallet descriptor.
 */
public enum LiquidNetwork {

    MAINNET("6f0279e9ed041c3d710a9f57d0c02928416460c4b722ae3457a11eec381c526d", 1776),
    TESTNET("144c654344aa716d6f3abcc1ca90e5641e4e2a7f633bc09fe3baf64585819a49", 1),
    REGTEST("5ac9f65c0efcc4775e0baec4ec03abdde22473cd3cf33c0419ca290e0751b225", 1);

    private final String lbtcAssetId;
    private final int coinType;

    LiquidNetwork(String lbtcAssetId, int coinType) {
        this.lbtcAssetId = lbtcAssetId;
        this.coinType = coinType;
    }

    public String lbtcAssetId() {
        return lbtcAssetId;
    }

    public int coinType() {
        return coinType;
    }

    public boolean isMainnet() {
        return this == MAINNET;
    }

    /** Directory name of the local wallet store for this network. */
    public String storeName() {
        return switch (this) {
            case MAINNET -> "liquid";
            case TESTNET -> "liquid-testnet";
            case REGTEST -> "liquid-regtest";
        };
    }
}
