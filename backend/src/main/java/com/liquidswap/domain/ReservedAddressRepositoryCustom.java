package com.liquidswap.domain;

import java.util.Optional;

/**
 * Atomic reservation queries that need MongoTemplate.
 */
public interface ReservedAddressRepositoryCustom {

    /**
     * Removes and returns the reservation with the lowest expiry height that is expired at {@code tip}.
     */
    Optional<ReservedAddress> takeNextExpired(int tip);
}
