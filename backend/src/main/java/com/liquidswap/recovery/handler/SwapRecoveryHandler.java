package com.liquidswap.recovery.handler;

import com.liquidswap.domain.SwapKind;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.recovery.ChainTips;
import com.liquidswap.recovery.SwapHistory;

/**
 * Recomputes the state of one swap kind from its matched history. Implementations are pure: the same inputs
 * always yield an equal record, the input record is never mutated, and terminal records come back unchanged.
 */
public interface SwapRecoveryHandler {

    SwapKind kind();

    SwapRecord resolve(SwapRecord record, SwapHistory history, ChainTips tips);
}
