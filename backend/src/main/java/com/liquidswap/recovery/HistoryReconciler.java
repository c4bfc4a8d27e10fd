package com.liquidswap.recovery;

import com.liquidswap.domain.Chain;
import com.liquidswap.domain.SwapKind;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapScripts;
import com.liquidswap.domain.WalletTransaction;
import com.liquidswap.domain.WalletTxOut;
import com.liquidswap.recovery.RecoveryHistory.IndexedTx;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the wallet's transaction list plus swap-script histories into a {@link RecoveryHistory}. A txid seen
 * more than once (wallet and script history, or mempool then confirmed) is one entry: the richest view of the
 * transaction with the best known height.
 */
@Slf4j
@Component
public class HistoryReconciler {

    /**
     * @param walletTxs Liquid transactions of the wallet
     * @param chainTxs  swap-script histories per chain
     */
    public RecoveryHistory reconcile(List<WalletTransaction> walletTxs, Map<Chain, List<WalletTransaction>> chainTxs) {
        Map<Chain, Map<String, IndexedTx>> byChain = new EnumMap<>(Chain.class);
        Map<String, IndexedTx> liquid = byChain.computeIfAbsent(Chain.LIQUID, c -> new LinkedHashMap<>());
        for (WalletTransaction tx : walletTxs) {
            liquid.merge(tx.getTxid(), new IndexedTx(tx, true), HistoryReconciler::merge);
        }
        for (Map.Entry<Chain, List<WalletTransaction>> entry : chainTxs.entrySet()) {
            Map<String, IndexedTx> index = byChain.computeIfAbsent(entry.getKey(), c -> new LinkedHashMap<>());
            for (WalletTransaction tx : entry.getValue()) {
                index.merge(tx.getTxid(), new IndexedTx(tx, tx.isWalletOwned()), HistoryReconciler::merge);
            }
        }
        RecoveryHistory history = new RecoveryHistory(byChain);
        log.debug("Reconciled history: {} Liquid txs, {} Bitcoin txs",
                history.size(Chain.LIQUID), history.size(Chain.BITCOIN));
        return history;
    }

    /**
     * Lockup scripts to query per chain for the given swaps.
     */
    public Map<Chain, Set<String>> scriptsByChain(Collection<SwapRecord> records) {
        Map<Chain, Set<String>> scripts = new EnumMap<>(Chain.class);
        for (SwapRecord record : records) {
            SwapKind kind = record.getKind();
            addScript(scripts, record.getUserLeg(), kind.userChain());
            if (kind.isChainSwap()) {
                addScript(scripts, record.getServerLeg(), kind.serverChain());
            }
        }
        return scripts;
    }

    private static void addScript(Map<Chain, Set<String>> scripts, SwapScripts leg, Chain defaultChain) {
        if (leg == null || leg.getLockupScript() == null) {
            return;
        }
        Chain chain = leg.getChain() != null ? leg.getChain() : defaultChain;
        scripts.computeIfAbsent(chain, c -> new LinkedHashSet<>()).add(RecoveryHistory.normalize(leg.getLockupScript()));
    }

    static IndexedTx merge(IndexedTx existing, IndexedTx incoming) {
        WalletTransaction a = existing.tx();
        WalletTransaction b = incoming.tx();
        WalletTransaction richer = detail(b) > detail(a) ? b : a;
        WalletTransaction other = richer == a ? b : a;
        Integer height = b.isConfirmed() ? b.getHeight() : a.isConfirmed() ? a.getHeight() : null;
        WalletTransaction.WalletTransactionBuilder builder = richer.toBuilder()
                .height(height)
                .timestamp(richer.getTimestamp() != null ? richer.getTimestamp() : other.getTimestamp())
                .lockTime(Math.max(richer.getLockTime(), other.getLockTime()))
                .clearInputs()
                .inputs(withWitnesses(richer.getInputs(), other.getInputs()));
        if (richer.getBalance().isEmpty() && !other.getBalance().isEmpty()) {
            builder.clearBalance().balance(other.getBalance()).fee(other.getFee());
        }
        return new IndexedTx(builder.build(), existing.walletOwned() || incoming.walletOwned());
    }

    /** Inputs of the richer view, with witness stacks filled in from the other view where it has them. */
    private static List<WalletTxOut> withWitnesses(List<WalletTxOut> inputs, List<WalletTxOut> others) {
        List<WalletTxOut> merged = new ArrayList<>(inputs.size());
        for (WalletTxOut input : inputs) {
            WalletTxOut source = input;
            if (input.getWitness().isEmpty()) {
                for (WalletTxOut other : others) {
                    if (!other.getWitness().isEmpty() && other.isOutpoint(input.getTxid(), input.getVout())) {
                        source = other;
                        break;
                    }
                }
            }
            merged.add(source == input ? input : WalletTxOut.builder()
                    .txid(input.getTxid())
                    .vout(input.getVout())
                    .scriptPubKey(input.getScriptPubKey() != null ? input.getScriptPubKey() : source.getScriptPubKey())
                    .assetId(input.getAssetId() != null ? input.getAssetId() : source.getAssetId())
                    .value(input.getValue() != null ? input.getValue() : source.getValue())
                    .walletOwned(input.isWalletOwned())
                    .witness(source.getWitness())
                    .build());
        }
        return merged;
    }

    private static int detail(WalletTransaction tx) {
        return tx.getInputs().size() + tx.getOutputs().size();
    }
}
