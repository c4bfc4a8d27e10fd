package com.liquidswap.persist;

import com.liquidswap.domain.ReservedAddress;
import com.liquidswap.domain.SwapRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable state of the wallet: derivation indices, reserved addresses and swap records. Every method fails with
 * a {@code PERSIST_ERROR} {@link com.liquidswap.error.PaymentException} on storage failure.
 */
public interface Persister {

    Optional<Integer> getLastDerivationIndex();

    /**
     * Atomically increments the last derivation index and returns the new value; empty when none was ever stored.
     */
    Optional<Integer> nextDerivationIndex();

    void setLastDerivationIndex(int index);

    Optional<Integer> getLastScannedDerivationIndex();

    void setLastScannedDerivationIndex(int index);

    /**
     * Removes and returns the soonest-expired reservation with {@code expiryBlockHeight <= tip}.
     */
    Optional<ReservedAddress> nextExpiredReservedAddress(int tip);

    /**
     * Reserves an address until {@code expiryBlockHeight}. Fails if another reservation holds the same index.
     */
    void reserveAddress(String address, int derivationIndex, String scriptPubKey, int expiryBlockHeight);

    void deleteReservedAddress(String address);

    List<ReservedAddress> listReservedAddresses();

    Optional<SwapRecord> loadSwap(String id);

    /**
     * Replaces the record by id. Terminal records are stored archived.
     */
    SwapRecord saveSwap(SwapRecord record);

    List<SwapRecord> listSwaps();

    /** Non-archived (non-terminal) swaps. */
    List<SwapRecord> listActiveSwaps();

    Optional<SwapRecord> findSwapByInvoice(String invoice);

    /**
     * Drops all swaps and reservations and installs the given state (restore from backup).
     */
    void replaceAll(List<SwapRecord> swaps, Integer lastDerivationIndex);
}
