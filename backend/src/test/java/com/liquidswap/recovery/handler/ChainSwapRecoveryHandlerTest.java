package com.liquidswap.recovery.handler;

import com.liquidswap.domain.Chain;
import com.liquidswap.domain.LegState;
import com.liquidswap.domain.SwapKind;
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

import static com.liquidswap.recovery.RecoveryFixtures.BITCOIN_LOCKUP;
import static com.liquidswap.recovery.RecoveryFixtures.BTC_CLAIM_SCRIPT;
import static com.liquidswap.recovery.RecoveryFixtures.CLAIM_SCRIPT;
import static com.liquidswap.recovery.RecoveryFixtures.LIQUID_LOCKUP;
import static com.liquidswap.recovery.RecoveryFixtures.REFUND_SCRIPT;
import static com.liquidswap.recovery.RecoveryFixtures.chainSwap;
import static com.liquidswap.recovery.RecoveryFixtures.funding;
import static com.liquidswap.recovery.RecoveryFixtures.scriptPathSpend;
import static com.liquidswap.recovery.RecoveryFixtures.spend;
import static com.liquidswap.recovery.RecoveryFixtures.walletFunding;
import static com.liquidswap.recovery.RecoveryFixtures.walletSpend;
import static org.assertj.core.api.Assertions.assertThat;

class ChainSwapRecoveryHandlerTest {

    private final ChainSendSwapRecoveryHandler sendHandler = new ChainSendSwapRecoveryHandler();
    private final ChainReceiveSwapRecoveryHandler receiveHandler = new ChainReceiveSwapRecoveryHandler();
    private final HistoryReconciler reconciler = new HistoryReconciler();

    private static final String SIGNATURE = "30" + "44".repeat(70) + "01";
    private static final String HTLC_SCRIPT = "82012088a914" + "cd".repeat(20) + "87";
    private static final String PREIMAGE = "ab".repeat(32);
    private static final String FOREIGN_SCRIPT = "0014" + "44".repeat(20);

    private SwapRecord resolve(SwapRecoveryHandler handler, SwapRecord record, ChainTips tips,
                               List<WalletTransaction> walletTxs, List<WalletTransaction> liquid,
                               List<WalletTransaction> bitcoin) {
        RecoveryHistory history = reconciler.reconcile(walletTxs, Map.of(Chain.LIQUID, liquid, Chain.BITCOIN, bitcoin));
        return handler.resolve(record, history.forSwap(record), tips);
    }

    @Test
    @DisplayName("chain send completes once our Bitcoin claim and the Liquid lockup are confirmed")
    void chainSendCompletes() {
        SwapRecord created = chainSwap("c1", SwapKind.CHAIN_SEND, 200, 800_150);
        WalletTransaction userLockup = walletFunding("ulock", 60, LIQUID_LOCKUP, 50_000);
        WalletTransaction serverLockup = funding("slock", 800_010, BITCOIN_LOCKUP, 49_000);
        WalletTransaction claim = spend("claim", null, "slock", BITCOIN_LOCKUP, 49_000, BTC_CLAIM_SCRIPT);

        SwapRecord pending = resolve(sendHandler, created, new ChainTips(70, 800_020),
                List.of(userLockup), List.of(), List.of(serverLockup, claim));
        SwapRecord complete = resolve(sendHandler, pending, new ChainTips(71, 800_021),
                List.of(userLockup), List.of(), List.of(serverLockup, claim.toBuilder().height(800_021).build()));

        assertThat(pending.getState()).isEqualTo(SwapState.PENDING);
        assertThat(pending.getServerLegState()).isEqualTo(LegState.CLAIM_UNCONFIRMED);
        assertThat(pending.getServerLockupTxId()).isEqualTo("slock");
        assertThat(complete.getState()).isEqualTo(SwapState.COMPLETE);
        assertThat(complete.getLockupTxId()).isEqualTo("ulock");
        assertThat(complete.getClaimTxId()).isEqualTo("claim");
        assertThat(complete.getUserLegState()).isEqualTo(LegState.LOCKUP_CONFIRMED);
    }

    @Test
    @DisplayName("a confirmed claim waits for the user lockup to confirm")
    void claimBeforeUserLockupConfirms() {
        SwapRecord resolved = resolve(sendHandler, chainSwap("c1", SwapKind.CHAIN_SEND, 200, 800_150),
                new ChainTips(70, 800_021),
                List.of(walletFunding("ulock", null, LIQUID_LOCKUP, 50_000)), List.of(),
                List.of(funding("slock", 800_010, BITCOIN_LOCKUP, 49_000),
                        spend("claim", 800_020, "slock", BITCOIN_LOCKUP, 49_000, BTC_CLAIM_SCRIPT)));

        assertThat(resolved.getState()).isEqualTo(SwapState.PENDING);
    }

    @Test
    @DisplayName("timed-out chain send is refundable, and refunded once our refund is seen")
    void chainSendRefund() {
        SwapRecord created = chainSwap("c1", SwapKind.CHAIN_SEND, 200, 800_150);
        WalletTransaction userLockup = walletFunding("ulock", 60, LIQUID_LOCKUP, 50_000);

        SwapRecord refundable = resolve(sendHandler, created, new ChainTips(201, 800_000),
                List.of(userLockup), List.of(), List.of());
        SwapRecord neverFunded = resolve(sendHandler, created, new ChainTips(201, 800_000),
                List.of(), List.of(), List.of());
        SwapRecord refunded = resolve(sendHandler, refundable, new ChainTips(205, 800_000),
                List.of(userLockup, walletSpend("refund", 204, "ulock", LIQUID_LOCKUP, 50_000, REFUND_SCRIPT)),
                List.of(), List.of());

        assertThat(refundable.getState()).isEqualTo(SwapState.REFUNDABLE);
        assertThat(neverFunded.getState()).isEqualTo(SwapState.REFUNDABLE);
        assertThat(refunded.getState()).isEqualTo(SwapState.REFUNDED);
        assertThat(refunded.getRefundTxId()).isEqualTo("refund");
    }

    @Test
    @DisplayName("chain receive without a Bitcoin lockup expires after the timeout")
    void chainReceiveExpires() {
        SwapRecord expired = resolve(receiveHandler, chainSwap("c2", SwapKind.CHAIN_RECEIVE, 800_100, 300),
                new ChainTips(250, 800_101), List.of(), List.of(), List.of());

        assertThat(expired.getState()).isEqualTo(SwapState.EXPIRED);
        assertThat(expired.getUserLegState()).isEqualTo(LegState.TIMED_OUT);
    }

    @Test
    @DisplayName("chain receive completes with our Liquid claim")
    void chainReceiveCompletes() {
        SwapRecord complete = resolve(receiveHandler, chainSwap("c2", SwapKind.CHAIN_RECEIVE, 800_100, 300),
                new ChainTips(250, 800_050),
                List.of(walletSpend("claim", 249, "slock", LIQUID_LOCKUP, 49_000, CLAIM_SCRIPT)),
                List.of(funding("slock", 240, LIQUID_LOCKUP, 49_000)),
                List.of(funding("ulock", 800_040, BITCOIN_LOCKUP, 50_000)));

        assertThat(complete.getState()).isEqualTo(SwapState.COMPLETE);
        assertThat(complete.getLockupTxId()).isEqualTo("ulock");
        assertThat(complete.getLockupAmountSat()).isEqualTo(50_000L);
        assertThat(complete.getServerLockupTxId()).isEqualTo("slock");
        assertThat(complete.getClaimTxId()).isEqualTo("claim");
    }

    @Test
    @DisplayName("ambiguity on either leg fails the swap")
    void ambiguousLeg() {
        SwapRecord failed = resolve(receiveHandler, chainSwap("c2", SwapKind.CHAIN_RECEIVE, 800_100, 300),
                new ChainTips(250, 800_050),
                List.of(walletSpend("claim", 249, "slock", LIQUID_LOCKUP, 49_000, CLAIM_SCRIPT)),
                List.of(funding("slock", 240, LIQUID_LOCKUP, 49_000),
                        spend("refund", 245, "slock", LIQUID_LOCKUP, 49_000, "0014" + "77".repeat(20))),
                List.of(funding("ulock", 800_040, BITCOIN_LOCKUP, 50_000)));

        assertThat(failed.getState()).isEqualTo(SwapState.FAILED);
        assertThat(failed.getServerLegState()).isEqualTo(LegState.AMBIGUOUS);
    }

    @Test
    @DisplayName("our timelocked Bitcoin refund of a chain receive is read from its lock time, not the destination")
    void chainReceiveRefundBySpendPath() {
        SwapRecord created = chainSwap("c2", SwapKind.CHAIN_RECEIVE, 800_100, 300);
        WalletTransaction userLockup = funding("ulock", 800_040, BITCOIN_LOCKUP, 50_000);
        WalletTransaction refund = scriptPathSpend("refund", 800_110, "ulock", BITCOIN_LOCKUP, 50_000,
                FOREIGN_SCRIPT, 800_100, List.of(SIGNATURE, "", HTLC_SCRIPT));

        SwapRecord refunded = resolve(receiveHandler, created, new ChainTips(260, 800_120),
                List.of(), List.of(), List.of(userLockup, refund));

        assertThat(created.getUserLeg().getRefundScript()).isNull();
        assertThat(refunded.getState()).isEqualTo(SwapState.REFUNDED);
        assertThat(refunded.getUserLegState()).isEqualTo(LegState.REFUNDED);
        assertThat(refunded.getRefundTxId()).isEqualTo("refund");
    }

    @Test
    @DisplayName("our Bitcoin claim of a chain send is read from the preimage in its witness")
    void chainSendClaimBySpendPath() {
        SwapRecord generated = chainSwap("c1", SwapKind.CHAIN_SEND, 200, 800_150);
        SwapRecord created = generated.toBuilder()
                .serverLeg(generated.getServerLeg().toBuilder().claimScript(null).build())
                .build();
        WalletTransaction claim = scriptPathSpend("claim", 800_020, "slock", BITCOIN_LOCKUP, 49_000,
                FOREIGN_SCRIPT, 0, List.of(SIGNATURE, PREIMAGE, HTLC_SCRIPT));

        SwapRecord complete = resolve(sendHandler, created, new ChainTips(70, 800_021),
                List.of(walletFunding("ulock", 60, LIQUID_LOCKUP, 50_000)), List.of(),
                List.of(funding("slock", 800_010, BITCOIN_LOCKUP, 49_000), claim));

        assertThat(complete.getState()).isEqualTo(SwapState.COMPLETE);
        assertThat(complete.getServerLegState()).isEqualTo(LegState.CLAIM_CONFIRMED);
        assertThat(complete.getClaimTxId()).isEqualTo("claim");
    }

    @Test
    @DisplayName("a Bitcoin spend showing neither path is not taken for a refund")
    void keyPathSpendIsClaim() {
        SwapRecord created = chainSwap("c2", SwapKind.CHAIN_RECEIVE, 800_100, 300);
        WalletTransaction userLockup = funding("ulock", 800_040, BITCOIN_LOCKUP, 50_000);
        WalletTransaction keyPath = scriptPathSpend("coop", 800_050, "ulock", BITCOIN_LOCKUP, 50_000,
                FOREIGN_SCRIPT, 800_049, List.of(SIGNATURE));

        SwapRecord resolved = resolve(receiveHandler, created, new ChainTips(250, 800_060),
                List.of(), List.of(), List.of(userLockup, keyPath));

        assertThat(resolved.getUserLegState()).isEqualTo(LegState.CLAIM_CONFIRMED);
        assertThat(resolved.getRefundTxId()).isNull();
    }

    @Test
    @DisplayName("resolving a chain send twice over the same history is a fixed point")
    void chainSendIdempotent() {
        SwapRecord created = chainSwap("c1", SwapKind.CHAIN_SEND, 200, 800_150);
        SwapRecord copy = created.toBuilder().build();
        List<WalletTransaction> wallet = List.of(walletFunding("ulock", 60, LIQUID_LOCKUP, 50_000));
        List<WalletTransaction> bitcoin = List.of(funding("slock", 800_010, BITCOIN_LOCKUP, 49_000),
                spend("claim", null, "slock", BITCOIN_LOCKUP, 49_000, BTC_CLAIM_SCRIPT));

        SwapRecord once = resolve(sendHandler, created, new ChainTips(70, 800_020), wallet, List.of(), bitcoin);
        SwapRecord twice = resolve(sendHandler, once, new ChainTips(70, 800_020), wallet, List.of(), bitcoin);

        assertThat(once.getUserLegState()).isEqualTo(LegState.LOCKUP_CONFIRMED);
        assertThat(once.getServerLegState()).isEqualTo(LegState.CLAIM_UNCONFIRMED);
        assertThat(twice).isEqualTo(once);
        assertThat(created).isEqualTo(copy);
    }

    @Test
    @DisplayName("resolving a chain receive twice over the same history is a fixed point")
    void chainReceiveIdempotent() {
        SwapRecord created = chainSwap("c2", SwapKind.CHAIN_RECEIVE, 800_100, 300);
        SwapRecord copy = created.toBuilder().build();
        List<WalletTransaction> liquid = List.of(funding("slock", 240, LIQUID_LOCKUP, 49_000));
        List<WalletTransaction> bitcoin = List.of(funding("ulock", 800_040, BITCOIN_LOCKUP, 50_000));

        SwapRecord once = resolve(receiveHandler, created, new ChainTips(250, 800_050), List.of(), liquid, bitcoin);
        SwapRecord twice = resolve(receiveHandler, once, new ChainTips(250, 800_050), List.of(), liquid, bitcoin);

        assertThat(once.getState()).isEqualTo(SwapState.PENDING);
        assertThat(once.getServerLegState()).isEqualTo(LegState.LOCKUP_CONFIRMED);
        assertThat(twice).isEqualTo(once);
        assertThat(created).isEqualTo(copy);
    }
}
