package com.liquidswap.recovery.handler;

import com.liquidswap.domain.SwapKind;
import com.liquidswap.domain.SwapState;
import org.springframework.stereotype.Component;

/**
 * L-BTC to BTC: we lock on Liquid, claim the counterparty's Bitcoin lockup.
 */
@Component
public class ChainSendSwapRecoveryHandler extends AbstractChainSwapRecoveryHandler {

    @Override
    public SwapKind kind() {
        return SwapKind.CHAIN_SEND;
    }

    @Override
    protected SwapState timedOutWithoutLockup() {
        return SwapState.REFUNDABLE;
    }
}
