package com.liquidswap.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for reserved_addresses.
 */
public interface ReservedAddressRepository extends MongoRepository<ReservedAddress, String>, ReservedAddressRepositoryCustom {

    Optional<ReservedAddress> findByDerivationIndex(int derivationIndex);
}
