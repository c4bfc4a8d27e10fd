package com.liquidswap.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed $inc on wallet_cache.
 */
@Repository
@RequiredArgsConstructor
public class WalletCacheRepositoryImpl implements WalletCacheRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Long> incrementIfPresent(String key) {
        WalletCacheEntry updated = mongoTemplate.findAndModify(
                new Query(where("_id").is(key)),
                new Update().inc("value", 1L),
                FindAndModifyOptions.options().returnNew(true),
                WalletCacheEntry.class);
        return Optional.ofNullable(updated).map(WalletCacheEntry::getValue);
    }
}
