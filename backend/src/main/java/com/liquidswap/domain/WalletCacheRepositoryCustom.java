package com.liquidswap.domain;

import java.util.Optional;

/**
 * Atomic counter operations on wallet_cache.
 */
public interface WalletCacheRepositoryCustom {

    /**
     * Atomically increments an existing entry and returns the new value; empty when the key was never set.
     */
    Optional<Long> incrementIfPresent(String key);
}
