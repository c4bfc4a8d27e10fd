package com.liquidswap.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persisted swap of any kind. Owned by the Persister: recovery handlers get a record, derive a new one with
 * {@link #toBuilder()} and hand it back for atomic replacement by id. Terminal records are archived, not deleted.
 * For RECEIVE/SEND only {@link #userLeg} is set; chain swaps also carry {@link #serverLeg}.
 */
@Document(collection = "swaps")
@CompoundIndex(name = "kind_archived", def = "{'kind': 1, 'archived': 1}")
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Getter
@Setter
@ToString(exclude = {"preimage", "claimPrivateKey", "refundPrivateKey"})
@EqualsAndHashCode
public class SwapRecord {

    @Id
    private String id;
    private SwapKind kind;
    private Instant createdAt;
    private long expectedAmountSat;
    private long feesSat;
    private long maxFeesSat;

    @Indexed(sparse = true)
    private String invoice;
    private String preimage;
    private String claimPrivateKey;
    private String refundPrivateKey;
    private String claimAddress;

    /** Our side for SEND/CHAIN_SEND, the counterparty's lockup for RECEIVE; the source chain for chain swaps. */
    private SwapScripts userLeg;
    /** Destination-chain leg of chain swaps, locked by the counterparty. */
    private SwapScripts serverLeg;

    private String lockupTxId;
    private String serverLockupTxId;
    private String claimTxId;
    private String refundTxId;
    private Long lockupAmountSat;

    private SwapState state;
    private String failureReason;
    private LegState userLegState;
    private LegState serverLegState;
    private boolean archived;
    private Instant updatedAt;

    @JsonIgnore
    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }
}
