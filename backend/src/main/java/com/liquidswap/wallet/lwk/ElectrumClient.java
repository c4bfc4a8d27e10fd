package com.liquidswap.wallet.lwk;

/**
 * Connected Electrum session used for scans and broadcasts. Not thread-safe.
 */
public interface ElectrumClient {

    /**
     * @return txid of the broadcast transaction
     */
    String broadcast(FinalizedTransaction tx);
}
