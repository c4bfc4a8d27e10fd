package com.liquidswap.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for wallet_cache.
 */
public interface WalletCacheRepository extends MongoRepository<WalletCacheEntry, String>, WalletCacheRepositoryCustom {
}
