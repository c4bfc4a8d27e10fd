package com.liquidswap.recovery.handler;

import com.liquidswap.domain.LegState;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapScripts;
import com.liquidswap.domain.SwapState;
import com.liquidswap.recovery.LegHistory;
import com.liquidswap.recovery.MatchedTx;

/**
 * Record field updates shared by the handlers. Observed txids are filled in, never cleared.
 */
final class SwapRecordUpdates {

    private SwapRecordUpdates() {
    }

    static void applyState(SwapRecord.SwapRecordBuilder builder, SwapState state) {
        builder.state(state);
        if (state == SwapState.FAILED) {
            builder.failureReason(LegResolver.AMBIGUOUS_REASON);
        }
    }

    static void recordUserLockup(SwapRecord.SwapRecordBuilder builder, LegHistory leg) {
        leg.lockup().ifPresent(lockup -> {
            builder.lockupTxId(lockup.txid());
            if (lockup.amountSat() != null) {
                builder.lockupAmountSat(lockup.amountSat());
            }
        });
    }

    static void recordServerLockup(SwapRecord.SwapRecordBuilder builder, LegHistory leg) {
        leg.lockup().map(MatchedTx::txid).ifPresent(builder::serverLockupTxId);
    }

    static void recordClaim(SwapRecord.SwapRecordBuilder builder, LegHistory leg, LegState state) {
        if (state == LegState.CLAIM_CONFIRMED || state == LegState.CLAIM_UNCONFIRMED) {
            leg.claim().map(MatchedTx::txid).ifPresent(builder::claimTxId);
        }
    }

    static void recordRefund(SwapRecord.SwapRecordBuilder builder, LegHistory leg, LegState state) {
        if (state == LegState.REFUNDED) {
            leg.refund().map(MatchedTx::txid).ifPresent(builder::refundTxId);
        }
    }

    static Integer timeoutOf(SwapRecord record, boolean serverLeg) {
        SwapScripts leg = serverLeg ? record.getServerLeg() : record.getUserLeg();
        return leg != null ? leg.getTimeoutHeight() : null;
    }
}
