package com.liquidswap.wallet;

import com.liquidswap.domain.LiquidNetwork;
import com.liquidswap.domain.WalletTransaction;
import com.liquidswap.wallet.lwk.AddressResult;
import com.liquidswap.wallet.lwk.FinalizedTransaction;

import java.util.List;
import java.util.Map;

/**
 * Single point of access to the descriptor wallet. All failures are
 * {@link com.liquidswap.error.PaymentException}s.
 */
public interface OnchainWallet {

    LiquidNetwork network();

    List<WalletTransaction> transactions();

    Map<String, WalletTransaction> transactionsByTxId();

    /**
     * Builds, signs and finalizes a payment of {@code amountSat} of {@code assetId} to {@code recipient}.
     *
     * @param feeRateSatPerKvb null for the wallet default
     */
    FinalizedTransaction buildTx(Double feeRateSatPerKvb, String recipient, String assetId, long amountSat);

    /**
     * Builds, signs and finalizes a transaction sending the whole native balance to {@code recipient}.
     *
     * @param enforceAmountSat when non-null, the net outflow minus fee must equal it exactly
     */
    FinalizedTransaction buildDrainTx(Double feeRateSatPerKvb, String recipient, Long enforceAmountSat);

    /**
     * {@link #buildTx}, falling back to an enforced drain only when the native asset is short.
     */
    FinalizedTransaction buildTxOrDrainTx(Double feeRateSatPerKvb, String recipient, String assetId, long amountSat);

    AddressResult nextUnusedAddress();

    int tip();

    /** Native asset balance, in satoshi. */
    long balanceSat();

    /** @return broadcast txid */
    String broadcast(FinalizedTransaction tx);

    void fullScan();

    /** Wipes and reopens the local wallet store. */
    void emptyCache();

    String signMessage(String message);

    boolean checkMessage(String message, String pubkey, String signature);

    String pubkey();

    String fingerprint();
}
