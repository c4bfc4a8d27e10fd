package com.liquidswap.recovery;

import com.liquidswap.domain.Chain;
import com.liquidswap.domain.HistoryTxId;
import com.liquidswap.domain.SwapKind;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.domain.SwapScripts;
import com.liquidswap.domain.WalletTransaction;
import com.liquidswap.domain.WalletTxOut;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable per-chain index of reconciled transactions: by txid, by funded script and by spent outpoint/script.
 * Built by {@link HistoryReconciler}; queried per swap with {@link #forSwap(SwapRecord)}.
 */
public class RecoveryHistory {

    private final Map<Chain, ChainIndex> indexes = new EnumMap<>(Chain.class);

    RecoveryHistory(Map<Chain, Map<String, IndexedTx>> txsByChain) {
        for (Chain chain : Chain.values()) {
            indexes.put(chain, new ChainIndex(txsByChain.getOrDefault(chain, Map.of())));
        }
    }

    public Optional<WalletTransaction> transaction(Chain chain, String txid) {
        IndexedTx indexed = indexes.get(chain).byTxid.get(txid);
        return Optional.ofNullable(indexed).map(IndexedTx::tx);
    }

    public int size(Chain chain) {
        return indexes.get(chain).byTxid.size();
    }

    public SwapHistory forSwap(SwapRecord record) {
        SwapKind kind = record.getKind();
        LegHistory user = forLeg(record.getUserLeg(), kind.userChain(), SpendOwnership.userLeg(kind));
        LegHistory server = kind.isChainSwap()
                ? forLeg(record.getServerLeg(), kind.serverChain(), SpendOwnership.serverLeg())
                : LegHistory.EMPTY;
        return new SwapHistory(user, server);
    }

    LegHistory forLeg(SwapScripts leg, Chain defaultChain, SpendOwnership ownership) {
        if (leg == null || leg.getLockupScript() == null) {
            return LegHistory.EMPTY;
        }
        Chain chain = leg.getChain() != null ? leg.getChain() : defaultChain;
        ChainIndex index = indexes.get(chain);
        String lockupScript = normalize(leg.getLockupScript());

        List<IndexedTx> fundings = index.fundingTxs(lockupScript);
        Optional<MatchedTx> lockup = fundings.stream()
                .min(EARLIEST_CONFIRMED)
                .map(tx -> new MatchedTx(tx.tx().toHistoryTxId(), fundedAmount(tx.tx(), lockupScript)));

        Set<String> lockupOutpoints = new LinkedHashSet<>();
        for (IndexedTx funding : fundings) {
            for (WalletTxOut out : funding.tx().getOutputs()) {
                if (out.paysTo(lockupScript)) {
                    lockupOutpoints.add(outpoint(funding.tx().getTxid(), out.getVout()));
                }
            }
        }

        List<MatchedTx> claims = new ArrayList<>();
        List<MatchedTx> refunds = new ArrayList<>();
        for (IndexedTx spend : index.spendingTxs(lockupScript, lockupOutpoints)) {
            List<WalletTxOut> lockupInputs = lockupInputs(spend.tx(), lockupScript, lockupOutpoints);
            MatchedTx matched = new MatchedTx(spend.tx().toHistoryTxId(), sumValues(lockupInputs));
            if (isRefund(spend, lockupInputs, leg, chain, ownership)) {
                refunds.add(matched);
            } else {
                claims.add(matched);
            }
        }
        return new LegHistory(lockup,
                claims.stream().min(BEST_MATCH),
                refunds.stream().min(BEST_MATCH));
    }

    /**
     * Known destination scripts decide first, then the spend path. A spend that shows neither is classified by
     * wallet membership on Liquid, where the wallet sees its own transactions; on Bitcoin it counts as a claim,
     * since our refunds there are always timelocked script-path spends.
     */
    private static boolean isRefund(IndexedTx spend, List<WalletTxOut> lockupInputs, SwapScripts leg, Chain chain,
                                    SpendOwnership ownership) {
        WalletTransaction tx = spend.tx();
        if (leg.getRefundScript() != null && paysTo(tx, normalize(leg.getRefundScript()))) {
            return true;
        }
        if (leg.getClaimScript() != null && paysTo(tx, normalize(leg.getClaimScript()))) {
            return false;
        }
        SpendPath path = SpendPath.of(tx, lockupInputs, leg.getTimeoutHeight());
        if (path != SpendPath.UNKNOWN) {
            return path == SpendPath.REFUND;
        }
        if (chain != Chain.LIQUID) {
            return false;
        }
        return switch (ownership) {
            case CLAIM_IS_OURS -> !spend.walletOwned();
            case REFUND_IS_OURS -> spend.walletOwned();
        };
    }

    private static boolean paysTo(WalletTransaction tx, String script) {
        return tx.getOutputs().stream().anyMatch(o -> o.paysTo(script));
    }

    private static Long fundedAmount(WalletTransaction tx, String script) {
        return sumValues(tx.getOutputs().stream().filter(o -> o.paysTo(script)).toList());
    }

    private static List<WalletTxOut> lockupInputs(WalletTransaction tx, String script, Set<String> outpoints) {
        return tx.getInputs().stream()
                .filter(in -> in.paysTo(script) || outpoints.contains(outpoint(in.getTxid(), in.getVout())))
                .toList();
    }

    private static Long sumValues(Collection<WalletTxOut> outs) {
        long total = 0;
        for (WalletTxOut out : outs) {
            if (out.getValue() == null) {
                return null;
            }
            total += out.getValue();
        }
        return outs.isEmpty() ? null : total;
    }

    static String outpoint(String txid, int vout) {
        return normalize(txid) + ":" + vout;
    }

    static String normalize(String hex) {
        return hex == null ? null : hex.toLowerCase(Locale.ROOT);
    }

    /** Confirmed before mempool, lower height first, then txid for a stable order. */
    private static final Comparator<IndexedTx> EARLIEST_CONFIRMED = Comparator
            .comparing((IndexedTx t) -> t.tx().toHistoryTxId(), RecoveryHistory::compareEarliest);

    private static final Comparator<MatchedTx> BEST_MATCH = Comparator
            .comparing(MatchedTx::id, RecoveryHistory::compareEarliest);

    private static int compareEarliest(HistoryTxId a, HistoryTxId b) {
        if (a.isConfirmed() != b.isConfirmed()) {
            return a.isConfirmed() ? -1 : 1;
        }
        if (a.height() != b.height()) {
            return Integer.compare(a.height(), b.height());
        }
        return a.txid().compareTo(b.txid());
    }

    /** A reconciled transaction and whether the wallet is party to it. */
    record IndexedTx(WalletTransaction tx, boolean walletOwned) {
    }

    private static final class ChainIndex {

        private final Map<String, IndexedTx> byTxid;
        private final Map<String, List<IndexedTx>> fundingByScript = new HashMap<>();
        private final Map<String, List<IndexedTx>> spendingByScript = new HashMap<>();
        private final Map<String, List<IndexedTx>> spendingByOutpoint = new HashMap<>();

        ChainIndex(Map<String, IndexedTx> byTxid) {
            this.byTxid = Map.copyOf(byTxid);
            for (IndexedTx indexed : byTxid.values()) {
                for (WalletTxOut out : indexed.tx().getOutputs()) {
                    if (out.getScriptPubKey() != null) {
                        fundingByScript.computeIfAbsent(normalize(out.getScriptPubKey()), k -> new ArrayList<>())
                                .add(indexed);
                    }
                }
                for (WalletTxOut in : indexed.tx().getInputs()) {
                    if (in.getScriptPubKey() != null) {
                        spendingByScript.computeIfAbsent(normalize(in.getScriptPubKey()), k -> new ArrayList<>())
                                .add(indexed);
                    }
                    if (in.getTxid() != null) {
                        spendingByOutpoint.computeIfAbsent(outpoint(in.getTxid(), in.getVout()),
                                k -> new ArrayList<>()).add(indexed);
                    }
                }
            }
        }

        List<IndexedTx> fundingTxs(String script) {
            return fundingByScript.getOrDefault(script, List.of()).stream().distinct().toList();
        }

        List<IndexedTx> spendingTxs(String script, Set<String> outpoints) {
            Set<IndexedTx> spends = new LinkedHashSet<>(spendingByScript.getOrDefault(script, List.of()));
            for (String outpoint : outpoints) {
                spends.addAll(spendingByOutpoint.getOrDefault(outpoint, List.of()));
            }
            return List.copyOf(spends);
        }
    }
}
