package com.liquidswap.recovery.handler;

import com.liquidswap.domain.LegState;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapState;
import com.liquidswap.recovery.ChainTips;
import com.liquidswap.recovery.LegHistory;
import com.liquidswap.recovery.MatchedTx;
import com.liquidswap.recovery.SwapHistory;

/**
 * Two-leg swaps. The user leg is funded by the user and claimed by the counterparty; the server leg is funded by
 * the counterparty and claimed by us. Each leg is resolved on its own chain, then combined: the swap completes
 * only when our claim of the server leg is confirmed and the user lockup is confirmed.
 */
public abstract class AbstractChainSwapRecoveryHandler implements SwapRecoveryHandler {

    @Override
    public SwapRecord resolve(SwapRecord record, SwapHistory history, ChainTips tips) {
        if (record.isTerminal()) {
            return record;
        }
        LegHistory userLeg = history.userLeg();
        LegHistory serverLeg = history.serverLeg();
        LegState userState = LegResolver.resolve(userLeg, SwapRecordUpdates.timeoutOf(record, false),
                tips.tipOf(kind().userChain()));
        LegState serverState = LegResolver.resolve(serverLeg, SwapRecordUpdates.timeoutOf(record, true),
                tips.tipOf(kind().serverChain()));

        SwapRecord.SwapRecordBuilder builder = record.toBuilder()
                .userLegState(userState)
                .serverLegState(serverState);
        SwapRecordUpdates.applyState(builder, combine(record.getState(), userLeg, userState, serverState));
        SwapRecordUpdates.recordUserLockup(builder, userLeg);
        SwapRecordUpdates.recordRefund(builder, userLeg, userState);
        SwapRecordUpdates.recordServerLockup(builder, serverLeg);
        SwapRecordUpdates.recordClaim(builder, serverLeg, serverState);
        return builder.build();
    }

    /**
     * State of a swap whose user leg timed out with no lockup at all.
     */
    protected abstract SwapState timedOutWithoutLockup();

    SwapState combine(SwapState current, LegHistory userLeg, LegState userState, LegState serverState) {
        if (userState == LegState.AMBIGUOUS || serverState == LegState.AMBIGUOUS) {
            return SwapState.FAILED;
        }
        if (userState == LegState.REFUNDED) {
            return SwapState.REFUNDED;
        }
        boolean userLockupConfirmed = userLeg.lockup().map(MatchedTx::isConfirmed).orElse(false);
        if (serverState == LegState.CLAIM_CONFIRMED && userLockupConfirmed) {
            return SwapState.COMPLETE;
        }
        boolean serverClaimed = serverState == LegState.CLAIM_CONFIRMED || serverState == LegState.CLAIM_UNCONFIRMED;
        if (userState == LegState.TIMED_OUT && !serverClaimed) {
            return userLeg.lockup().isPresent() ? SwapState.REFUNDABLE : timedOutWithoutLockup();
        }
        if (hasActivity(serverState)) {
            return SwapState.PENDING;
        }
        return switch (userState) {
            case LOCKUP_UNCONFIRMED -> SwapState.WAITING_CONFIRMATION;
            case LOCKUP_CONFIRMED, CLAIM_UNCONFIRMED, CLAIM_CONFIRMED, TIMED_OUT -> SwapState.PENDING;
            case NONE -> current;
            case REFUNDED, AMBIGUOUS -> throw new IllegalStateException("Unreachable user leg state " + userState);
        };
    }

    private static boolean hasActivity(LegState state) {
        return switch (state) {
            case LOCKUP_UNCONFIRMED, LOCKUP_CONFIRMED, CLAIM_UNCONFIRMED, CLAIM_CONFIRMED, REFUNDED -> true;
            case NONE, TIMED_OUT, AMBIGUOUS -> false;
        };
    }
}
