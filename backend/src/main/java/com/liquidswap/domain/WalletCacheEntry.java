package com.liquidswap.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Small key/value cache for wallet bookkeeping (derivation indices).
 */
@Document(collection = "wallet_cache")
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class WalletCacheEntry {

    public static final String LAST_DERIVATION_INDEX = "last_derivation_index";
    public static final String LAST_SCANNED_DERIVATION_INDEX = "last_scanned_derivation_index";

    @Id
    private String key;
    private long value;
}
