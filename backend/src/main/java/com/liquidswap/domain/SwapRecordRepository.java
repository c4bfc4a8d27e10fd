package com.liquidswap.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for swaps. {@code save} replaces the whole document by id.
 */
public interface SwapRecordRepository extends MongoRepository<SwapRecord, String> {

    List<SwapRecord> findByArchivedFalse();

    Optional<SwapRecord> findFirstByInvoice(String invoice);
}
