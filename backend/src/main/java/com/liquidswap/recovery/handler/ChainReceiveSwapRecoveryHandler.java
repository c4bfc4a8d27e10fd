package com.liquidswap.recovery.handler;

import com.liquidswap.domain.SwapKind;
import com.liquidswap.domain.SwapState;
import org.springframework.stereotype.Component;

/**
 * BTC to L-BTC: the payer locks on Bitcoin, we claim the counterparty's Liquid lockup. With no Bitcoin lockup ever
 * seen there is nothing to refund once the swap times out.
 */
@Component
public class ChainReceiveSwapRecoveryHandler extends AbstractChainSwapRecoveryHandler {

    @Override
    public SwapKind kind() {
        return SwapKind.CHAIN_RECEIVE;
    }

    @Override
    protected SwapState timedOutWithoutLockup() {
        return SwapState.EXPIRED;
    }
}
