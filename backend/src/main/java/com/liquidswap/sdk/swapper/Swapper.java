package com.liquidswap.sdk.swapper;

import java.util.Optional;

/**
 * Swap counterparty. The wire protocol behind it belongs to the embedding application, which supplies the bean.
 * Implementations throw unchecked exceptions on transport failures.
 */
public interface Swapper {

    Optional<SwapPair> fetchPair(PairKind kind);

    CreatedReverseSwap createReverseSwap(ReverseSwapRequest request);

    CreatedSubmarineSwap createSubmarineSwap(SubmarineSwapRequest request);
}
