package com.liquidswap.recovery.handler;

import com.liquidswap.domain.Chain;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapState;
import com.liquidswap.domain.WalletTransaction;
import com.liquidswap.recovery.ChainTips;
import com.liquidswap.recovery.HistoryReconciler;
import com.liquidswap.recovery.RecoveryHistory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.liquidswap.recovery.RecoveryFixtures.CLAIM_SCRIPT;
import static com.liquidswap.recovery.RecoveryFixtures.LIQUID_LOCKUP;
import static com.liquidswap.recovery.RecoveryFixtures.REFUND_SCRIPT;
import static com.liquidswap.recovery.RecoveryFixtures.funding;
import static com.liquidswap.recovery.RecoveryFixtures.send;
import static com.liquidswap.recovery.RecoveryFixtures.spend;
import static com.liquidswap.recovery.RecoveryFixtures.walletFunding;
import static com.liquidswap.recovery.RecoveryFixtures.walletSpend;
import static org.assertj.core.api.Assertions.assertThat;

class SendSwapRecoveryHandlerTest {

    private final SendSwapRecoveryHandler handler = new SendSwapRecoveryHandler();
    private final HistoryReconciler reconciler = new HistoryReconciler();

    private SwapRecord resolve(SwapRecord record, int tip, List<WalletTransaction> walletTxs,
                               WalletTransaction... chainTxs) {
        RecoveryHistory history = reconciler.reconcile(walletTxs, Map.of(Chain.LIQUID, List.of(chainTxs)));
        return handler.resolve(record, history.forSwap(record), new ChainTips(tip, 0));
    }

    @Test
    @DisplayName("created, refundable after the timeout, then refunded")
    void createdRefundableRefunded() {
        SwapRecord created = send("s1", 100);
        WalletTransaction lockup = walletFunding("lock", 60, LIQUID_LOCKUP, 100_000);

        SwapRecord untouched = resolve(created, 50, List.of());
        SwapRecord pending = resolve(created, 100, List.of(lockup));
        SwapRecord refundable = resolve(pending, 101, List.of(lockup));
        SwapRecord refunded = resolve(refundable, 102, List.of(lockup,
                walletSpend("refund", 102, "lock", LIQUID_LOCKUP, 100_000, REFUND_SCRIPT)));

        assertThat(untouched).isEqualTo(created);
        assertThat(pending.getState()).isEqualTo(SwapState.PENDING);
        assertThat(pending.getLockupTxId()).isEqualTo("lock");
        assertThat(pending.getLockupAmountSat()).isEqualTo(100_000L);
        assertThat(refundable.getState()).isEqualTo(SwapState.REFUNDABLE);
        assertThat(refunded.getState()).isEqualTo(SwapState.REFUNDED);
        assertThat(refunded.getRefundTxId()).isEqualTo("refund");
        assertThat(refunded.getClaimTxId()).isNull();
    }

    @Test
    @DisplayName("counterparty claim completes the swap once confirmed")
    void claimed() {
        WalletTransaction lockup = walletFunding("lock", null, LIQUID_LOCKUP, 100_000);

        SwapRecord waiting = resolve(send("s1", 100), 50, List.of(lockup));
        SwapRecord claiming = resolve(waiting, 61, List.of(lockup.toBuilder().height(60).build()),
                spend("claim", null, "lock", LIQUID_LOCKUP, 100_000, CLAIM_SCRIPT));
        SwapRecord complete = resolve(claiming, 62, List.of(lockup.toBuilder().height(60).build()),
                spend("claim", 62, "lock", LIQUID_LOCKUP, 100_000, CLAIM_SCRIPT));

        assertThat(waiting.getState()).isEqualTo(SwapState.WAITING_CONFIRMATION);
        assertThat(claiming.getState()).isEqualTo(SwapState.PENDING);
        assertThat(claiming.getClaimTxId()).isEqualTo("claim");
        assertThat(complete.getState()).isEqualTo(SwapState.COMPLETE);
        assertThat(complete.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("a late claim after the timeout still completes")
    void claimAfterTimeout() {
        SwapRecord complete = resolve(send("s1", 100), 150, List.of(),
                funding("lock", 60, LIQUID_LOCKUP, 100_000),
                spend("claim", 140, "lock", LIQUID_LOCKUP, 100_000, CLAIM_SCRIPT));

        assertThat(complete.getState()).isEqualTo(SwapState.COMPLETE);
    }

    @Test
    @DisplayName("claim and refund without a clear winner fail the swap")
    void ambiguous() {
        SwapRecord failed = resolve(send("s1", 100), 110,
                List.of(walletSpend("refund", 103, "lock", LIQUID_LOCKUP, 100_000, REFUND_SCRIPT)),
                funding("lock", 60, LIQUID_LOCKUP, 100_000),
                spend("claim", 105, "lock", LIQUID_LOCKUP, 100_000, CLAIM_SCRIPT));

        assertThat(failed.getState()).isEqualTo(SwapState.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo(LegResolver.AMBIGUOUS_REASON);
        assertThat(failed.getClaimTxId()).isNull();
        assertThat(failed.getRefundTxId()).isNull();
    }

    @Test
    @DisplayName("resolution is idempotent and never mutates its input")
    void idempotent() {
        SwapRecord created = send("s1", 100);
        SwapRecord copy = created.toBuilder().build();
        WalletTransaction lockup = walletFunding("lock", 60, LIQUID_LOCKUP, 100_000);

        SwapRecord once = resolve(created, 70, List.of(lockup));
        SwapRecord twice = resolve(once, 70, List.of(lockup));

        assertThat(twice).isEqualTo(once);
        assertThat(created).isEqualTo(copy);
    }

    @Test
    @DisplayName("terminal records come back unchanged")
    void terminalAbsorbing() {
        SwapRecord complete = send("s1", 100).toBuilder().state(SwapState.COMPLETE).claimTxId("claim").build();

        SwapRecord resolved = resolve(complete, 500, List.of(
                walletSpend("refund", 400, "lock", LIQUID_LOCKUP, 100_000, REFUND_SCRIPT)),
                funding("lock", 60, LIQUID_LOCKUP, 100_000));

        assertThat(resolved).isSameAs(complete);
    }
}
