package com.liquidswap.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Address handed out for an expected incoming lockup. At most one reservation per derivation index;
 * reusable once the tip reaches {@code expiryBlockHeight} (inclusive).
 */
@Document(collection = "reserved_addresses")
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class ReservedAddress {

    @Id
    private String address;
    @Indexed(unique = true)
    private int derivationIndex;
    private String scriptPubKey;
    @Indexed
    private int expiryBlockHeight;

    public boolean isExpiredAt(int tip) {
        return tip >= expiryBlockHeight;
    }
}
