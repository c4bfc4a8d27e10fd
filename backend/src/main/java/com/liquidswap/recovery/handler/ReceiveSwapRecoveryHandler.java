package com.liquidswap.recovery.handler;

import com.liquidswap.domain.LegState;
import com.liquidswap.domain.SwapKind;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapState;
import com.liquidswap.recovery.ChainTips;
import com.liquidswap.recovery.LegHistory;
import com.liquidswap.recovery.SwapHistory;
import org.springframework.stereotype.Component;

/**
 * Lightning-in swaps: the counterparty locks L-BTC, we claim it. A timed-out receive whose lockup was seen stays
 * open, so a late claim still completes it; one that never saw a lockup expires.
 */
@Component
public class ReceiveSwapRecoveryHandler implements SwapRecoveryHandler {

    @Override
    public SwapKind kind() {
        return SwapKind.RECEIVE;
    }

    @Override
    public SwapRecord resolve(SwapRecord record, SwapHistory history, ChainTips tips) {
        if (record.isTerminal()) {
            return record;
        }
        LegHistory leg = history.userLeg();
        LegState legState = LegResolver.resolve(leg, SwapRecordUpdates.timeoutOf(record, false),
                tips.tipOf(kind().userChain()));
        SwapState next = switch (legState) {
            case CLAIM_CONFIRMED -> SwapState.COMPLETE;
            case CLAIM_UNCONFIRMED, LOCKUP_CONFIRMED -> SwapState.PENDING;
            case LOCKUP_UNCONFIRMED -> SwapState.WAITING_CONFIRMATION;
            case REFUNDED -> SwapState.REFUNDED;
            case TIMED_OUT -> leg.lockup().isPresent() ? SwapState.REFUNDABLE : SwapState.EXPIRED;
            case AMBIGUOUS -> SwapState.FAILED;
            case NONE -> record.getState();
        };
        SwapRecord.SwapRecordBuilder builder = record.toBuilder();
        SwapRecordUpdates.applyState(builder, next);
        SwapRecordUpdates.recordUserLockup(builder, leg);
        SwapRecordUpdates.recordClaim(builder, leg, legState);
        SwapRecordUpdates.recordRefund(builder, leg, legState);
        return builder.build();
    }
}
