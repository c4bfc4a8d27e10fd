package com.liquidswap.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed find-and-remove so two callers never take the same expired reservation.
 */
@Repository
@RequiredArgsConstructor
public class ReservedAddressRepositoryImpl implements ReservedAddressRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<ReservedAddress> takeNextExpired(int tip) {
        Query query = new Query(where("expiryBlockHeight").lte(tip))
                .with(Sort.by(Sort.Order.asc("expiryBlockHeight"), Sort.Order.asc("derivationIndex")));
        return Optional.ofNullable(mongoTemplate.findAndRemove(query, ReservedAddress.class));
    }
}
