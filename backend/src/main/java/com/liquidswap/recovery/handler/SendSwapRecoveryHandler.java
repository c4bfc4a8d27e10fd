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
 * Lightning-out swaps: we lock L-BTC, the counterparty claims it once the invoice is paid. Past the timeout without
 * a claim the lockup is ours to refund.
 */
@Component
public class SendSwapRecoveryHandler implements SwapRecoveryHandler {

    @Override
    public SwapKind kind() {
        return SwapKind.SEND;
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
            case TIMED_OUT -> SwapState.REFUNDABLE;
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
