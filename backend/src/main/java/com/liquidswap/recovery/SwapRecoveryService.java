package com.liquidswap.recovery;

import com.liquidswap.chain.ChainClientException;
import com.liquidswap.chain.SwapChainClient;
import com.liquidswap.common.KeyedLockRegistry;
import com.liquidswap.domain.Chain;
import com.liquidswap.domain.SwapKind;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapScripts;
import com.liquidswap.domain.SwapState;
import com.liquidswap.domain.WalletTransaction;
import com.liquidswap.persist.Persister;
import com.liquidswap.recovery.handler.SwapRecoveryDispatcher;
import com.liquidswap.wallet.OnchainWallet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * One recovery pass: full scan, fetch swap-script histories, reconcile, resolve every active swap on the recovery
 * pool and save changed records under a per-swap lock. Handlers only see history gathered after the scan finished.
 */
@Slf4j
@Service
public class SwapRecoveryService {

    private final OnchainWallet wallet;
    private final Persister persister;
    private final HistoryReconciler reconciler;
    private final SwapRecoveryDispatcher dispatcher;
    private final Map<Chain, SwapChainClient> chainClients = new EnumMap<>(Chain.class);
    private final KeyedLockRegistry swapLocks;
    private final Executor recoveryExecutor;

    public SwapRecoveryService(OnchainWallet wallet,
                               Persister persister,
                               HistoryReconciler reconciler,
                               SwapRecoveryDispatcher dispatcher,
                               List<SwapChainClient> chainClients,
                               KeyedLockRegistry swapLocks,
                               @Qualifier("recovery-executor") Executor recoveryExecutor) {
        this.wallet = wallet;
        this.persister = persister;
        this.reconciler = reconciler;
        this.dispatcher = dispatcher;
        for (SwapChainClient client : chainClients) {
            this.chainClients.put(client.chain(), client);
        }
        this.swapLocks = swapLocks;
        this.recoveryExecutor = recoveryExecutor;
    }

    public RecoveryReport recover() {
        long started = System.nanoTime();
        wallet.fullScan();
        List<WalletTransaction> walletTxs = wallet.transactions();
        List<SwapRecord> active = persister.listActiveSwaps();
        if (active.isEmpty()) {
            log.debug("No active swaps to recover");
            return RecoveryReport.empty();
        }

        Map<Chain, Set<String>> scripts = reconciler.scriptsByChain(active);
        Map<Chain, List<WalletTransaction>> chainTxs = new EnumMap<>(Chain.class);
        Set<Chain> unavailable = EnumSet.noneOf(Chain.class);
        int bitcoinTip = 0;
        for (Map.Entry<Chain, Set<String>> entry : scripts.entrySet()) {
            Chain chain = entry.getKey();
            SwapChainClient client = chainClients.get(chain);
            if (client == null) {
                log.warn("No {} history client configured; swaps on {} are skipped", chain, chain);
                unavailable.add(chain);
                continue;
            }
            try {
                chainTxs.put(chain, client.scriptTransactions(entry.getValue()));
                if (chain == Chain.BITCOIN) {
                    bitcoinTip = client.tip();
                }
            } catch (ChainClientException e) {
                log.warn("Fetching {} swap script history failed; swaps on {} are skipped: {}", chain, chain,
                        e.getMessage());
                unavailable.add(chain);
            }
        }
        ChainTips tips = new ChainTips(wallet.tip(), bitcoinTip);
        RecoveryHistory history = reconciler.reconcile(walletTxs, chainTxs);

        List<CompletableFuture<Outcome>> futures = new ArrayList<>(active.size());
        int failed = 0;
        for (SwapRecord record : active) {
            if (needsUnavailableChain(record, unavailable)) {
                failed++;
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(() -> resolveAndSave(record, history, tips), recoveryExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        int updated = 0;
        for (CompletableFuture<Outcome> future : futures) {
            switch (future.join()) {
                case UPDATED -> updated++;
                case FAILED -> failed++;
                case UNCHANGED -> {
                }
            }
        }
        RecoveryReport report = new RecoveryReport(active.size(), updated, failed);
        log.info("Swap recovery finished in {} ms: scanned={}, updated={}, failed={}",
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started), report.scanned(), report.updated(),
                report.failed());
        return report;
    }

    private Outcome resolveAndSave(SwapRecord snapshot, RecoveryHistory history, ChainTips tips) {
        try {
            return swapLocks.withLock(snapshot.getId(), () -> {
                SwapRecord current = persister.loadSwap(snapshot.getId()).orElse(snapshot);
                SwapRecord resolved = dispatcher.resolve(current, history, tips);
                if (resolved.equals(current)) {
                    return Outcome.UNCHANGED;
                }
                persister.saveSwap(resolved);
                log.info("Swap {} ({}) moved {} -> {}", resolved.getId(), resolved.getKind(), current.getState(),
                        resolved.getState());
                releaseClaimAddress(resolved);
                return Outcome.UPDATED;
            });
        } catch (RuntimeException e) {
            log.warn("Recovery of swap {} failed: {}", snapshot.getId(), e.getMessage(), e);
            return Outcome.FAILED;
        }
    }

    private void releaseClaimAddress(SwapRecord record) {
        boolean receiving = record.getKind() == SwapKind.RECEIVE || record.getKind() == SwapKind.CHAIN_RECEIVE;
        if (receiving && record.getState() == SwapState.COMPLETE && record.getClaimAddress() != null) {
            persister.deleteReservedAddress(record.getClaimAddress());
        }
    }

    private static boolean needsUnavailableChain(SwapRecord record, Set<Chain> unavailable) {
        if (unavailable.isEmpty()) {
            return false;
        }
        SwapKind kind = record.getKind();
        if (unavailable.contains(legChain(record.getUserLeg(), kind.userChain()))) {
            return true;
        }
        return kind.isChainSwap() && unavailable.contains(legChain(record.getServerLeg(), kind.serverChain()));
    }

    private static Chain legChain(SwapScripts leg, Chain defaultChain) {
        return leg != null && leg.getChain() != null ? leg.getChain() : defaultChain;
    }

    private enum Outcome {
        UPDATED,
        UNCHANGED,
        FAILED
    }
}
