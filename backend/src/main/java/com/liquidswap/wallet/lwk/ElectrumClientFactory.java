package com.liquidswap.wallet.lwk;

/**
 * Connects Electrum clients.
 */
public interface ElectrumClientFactory {

    ElectrumClient connect(ElectrumSettings settings);
}
