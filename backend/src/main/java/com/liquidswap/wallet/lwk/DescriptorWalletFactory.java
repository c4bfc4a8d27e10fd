package com.liquidswap.wallet.lwk;

import com.liquidswap.domain.LiquidNetwork;

import java.nio.file.Path;

/**
 * Opens descriptor wallets on a local store directory.
 */
public interface DescriptorWalletFactory {

    /**
     * @throws WalletStoreException when the existing store cannot be loaded (corrupt, height regressed,
     *                              or written for a different status)
     */
    DescriptorWallet open(LiquidNetwork network, String descriptor, Path storeDir);
}
