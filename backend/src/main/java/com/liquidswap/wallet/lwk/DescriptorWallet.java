package com.liquidswap.wallet.lwk;

import com.liquidswap.domain.WalletTransaction;

import java.util.List;
import java.util.Map;

/**
 * Watch-only wallet over one confidential output descriptor, backed by a local store. Implementations are not
 * thread-safe; callers serialize access. All failures are {@link DescriptorWalletException}s.
 */
public interface DescriptorWallet {

    String descriptor();

    /**
     * Address at {@code index}, or the first unused one when {@code index} is null.
     */
    AddressResult address(Integer index);

    /** Height of the chain tip the local store last synced to. */
    int tip();

    List<WalletTransaction> transactions();

    /** Confirmed plus unconfirmed balance per asset id, in satoshi. */
    Map<String, Long> balance();

    /** Asset id of the chain's native (fee-paying) asset. */
    String policyAsset();

    /**
     * Unsigned PSET paying {@code amountSat} of the policy asset.
     *
     * @param feeRateSatPerKvb null for the library default
     * @throws InsufficientFundsException when coin selection cannot cover amount plus fee
     */
    Pset buildLbtcTx(String recipient, long amountSat, Double feeRateSatPerKvb);

    /**
     * Unsigned PSET paying {@code amountSat} of {@code assetId}; fees are still paid in the policy asset.
     *
     * @throws InsufficientFundsException when coin selection cannot cover amount plus fee
     */
    Pset buildAssetTx(String recipient, long amountSat, String assetId, Double feeRateSatPerKvb);

    /**
     * Unsigned PSET spending every policy-asset UTXO to {@code recipient}, fee deducted from the output.
     */
    Pset buildDrainTx(String recipient, Double feeRateSatPerKvb);

    PsetDetails details(Pset pset);

    FinalizedTransaction finalizeTx(Pset pset);

    /**
     * Syncs the local store against the network, deriving addresses up to {@code index}.
     *
     * @throws UpdateHeightTooOldException when the store is ahead of the update being applied
     */
    void fullScanToIndex(ElectrumClient client, int index);
}
