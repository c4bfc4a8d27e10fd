package com.liquidswap.chain;

import com.liquidswap.domain.Chain;
import com.liquidswap.domain.WalletTransaction;

import java.util.Collection;
import java.util.List;

/**
 * Read-only history queries for swap scripts on one chain. Failures are {@link ChainClientException}s.
 */
public interface SwapChainClient {

    Chain chain();

    int tip();

    /**
     * Every transaction (confirmed and mempool) that pays to or spends from any of the given scripts,
     * deduplicated by txid.
     *
     * @param scripts scriptPubKeys, hex
     */
    List<WalletTransaction> scriptTransactions(Collection<String> scripts);
}
