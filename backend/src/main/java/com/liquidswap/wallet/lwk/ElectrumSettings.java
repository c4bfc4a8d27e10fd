package com.liquidswap.wallet.lwk;

import com.liquidswap.domain.LiquidNetwork;

/**
 * Connection options for an Electrum server.
 */
public record ElectrumSettings(String url, boolean tls, boolean validateDomain, int timeoutSeconds) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 3;

    /**
     * TLS with domain validation on public networks, plain TCP on regtest.
     */
    public static ElectrumSettings forNetwork(LiquidNetwork network, String url) {
        boolean secure = network != LiquidNetwork.REGTEST;
        return new ElectrumSettings(url, secure, secure, DEFAULT_TIMEOUT_SECONDS);
    }
}
