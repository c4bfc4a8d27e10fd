package com.liquidswap.sdk.swapper;

import com.liquidswap.config.CaffeineConfig;
import com.liquidswap.error.PaymentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Pair quotes, cached briefly. A missing pair is not cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SwapPairService {

    private final Swapper swapper;

    @Cacheable(cacheNames = CaffeineConfig.SWAP_PAIRS_CACHE, key = "#kind")
    public SwapPair pair(PairKind kind) {
        SwapPair pair;
        try {
            pair = swapper.fetchPair(kind).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Fetching {} pair failed: {}", kind, e.getMessage());
            throw PaymentException.pairsNotFound();
        }
        if (pair == null) {
            throw PaymentException.pairsNotFound();
        }
        return pair;
    }
}
