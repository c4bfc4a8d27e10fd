package com.liquidswap.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Script material of one swap leg. Scripts are scriptPubKey hex. {@code claimScript}/{@code refundScript}
 * are the destinations of the two spend paths when known; either may be null when that path pays a party
 * whose destination we do not learn in advance.
 */
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Getter
@Setter
@EqualsAndHashCode
public class SwapScripts {
    private Chain chain;
    private String lockupScript;
    private String claimScript;
    private String refundScript;
    /** Leg becomes refund-eligible once the chain tip exceeds this height without a claim. */
    private Integer timeoutHeight;
}
