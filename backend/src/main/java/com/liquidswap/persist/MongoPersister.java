package com.liquidswap.persist;

import com.liquidswap.domain.ReservedAddress;
import com.liquidswap.domain.ReservedAddressRepository;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapRecordRepository;
import com.liquidswap.domain.WalletCacheEntry;
import com.liquidswap.domain.WalletCacheRepository;
import com.liquidswap.error.PaymentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB-backed {@link Persister}. Counters use find-and-modify, expired reservations find-and-remove,
 * swaps are whole-document replacements by id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoPersister implements Persister {

    private final SwapRecordRepository swapRecordRepository;
    private final ReservedAddressRepository reservedAddressRepository;
    private final WalletCacheRepository walletCacheRepository;

    @Override
    public Optional<Integer> getLastDerivationIndex() {
        return persist(() -> readIndex(WalletCacheEntry.LAST_DERIVATION_INDEX));
    }

    @Override
    public Optional<Integer> nextDerivationIndex() {
        return persist(() -> walletCacheRepository.incrementIfPresent(WalletCacheEntry.LAST_DERIVATION_INDEX)
                .map(Long::intValue));
    }

    @Override
    public void setLastDerivationIndex(int index) {
        persist(() -> walletCacheRepository.save(new WalletCacheEntry(WalletCacheEntry.LAST_DERIVATION_INDEX, index)));
    }

    @Override
    public Optional<Integer> getLastScannedDerivationIndex() {
        return persist(() -> readIndex(WalletCacheEntry.LAST_SCANNED_DERIVATION_INDEX));
    }

    @Override
    public void setLastScannedDerivationIndex(int index) {
        persist(() -> walletCacheRepository.save(
                new WalletCacheEntry(WalletCacheEntry.LAST_SCANNED_DERIVATION_INDEX, index)));
    }

    @Override
    public Optional<ReservedAddress> nextExpiredReservedAddress(int tip) {
        return persist(() -> reservedAddressRepository.takeNextExpired(tip));
    }

    @Override
    public void reserveAddress(String address, int derivationIndex, String scriptPubKey, int expiryBlockHeight) {
        persist(() -> reservedAddressRepository.insert(
                new ReservedAddress(address, derivationIndex, scriptPubKey, expiryBlockHeight)));
    }

    @Override
    public void deleteReservedAddress(String address) {
        persist(() -> {
            reservedAddressRepository.deleteById(address);
            return null;
        });
    }

    @Override
    public List<ReservedAddress> listReservedAddresses() {
        return persist(reservedAddressRepository::findAll);
    }

    @Override
    public Optional<SwapRecord> loadSwap(String id) {
        return persist(() -> swapRecordRepository.findById(id));
    }

    @Override
    public SwapRecord saveSwap(SwapRecord record) {
        SwapRecord toSave = record.toBuilder()
                .archived(record.isTerminal())
                .updatedAt(Instant.now())
                .build();
        return persist(() -> swapRecordRepository.save(toSave));
    }

    @Override
    public List<SwapRecord> listSwaps() {
        return persist(swapRecordRepository::findAll);
    }

    @Override
    public List<SwapRecord> listActiveSwaps() {
        return persist(swapRecordRepository::findByArchivedFalse);
    }

    @Override
    public Optional<SwapRecord> findSwapByInvoice(String invoice) {
        return persist(() -> swapRecordRepository.findFirstByInvoice(invoice));
    }

    @Override
    public void replaceAll(List<SwapRecord> swaps, Integer lastDerivationIndex) {
        persist(() -> {
            swapRecordRepository.deleteAll();
            reservedAddressRepository.deleteAll();
            walletCacheRepository.deleteAll();
            for (SwapRecord swap : swaps) {
                swapRecordRepository.save(swap.toBuilder().archived(swap.isTerminal()).build());
            }
            if (lastDerivationIndex != null) {
                walletCacheRepository.save(
                        new WalletCacheEntry(WalletCacheEntry.LAST_DERIVATION_INDEX, lastDerivationIndex));
            }
            return null;
        });
        log.info("Replaced persisted state: {} swaps, last derivation index {}", swaps.size(), lastDerivationIndex);
    }

    private Optional<Integer> readIndex(String key) {
        return walletCacheRepository.findById(key).map(e -> (int) e.getValue());
    }

    private static <T> T persist(Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            log.warn("Persistence operation failed: {}", e.getMessage());
            throw PaymentException.persistError(e);
        }
    }
}
