package com.liquidswap.recovery;

import com.liquidswap.domain.Chain;

/**
 * Chain tips a recovery pass resolves against.
 */
public record ChainTips(int liquidTip, int bitcoinTip) {

    public int tipOf(Chain chain) {
        return switch (chain) {
            case LIQUID -> liquidTip;
            case BITCOIN -> bitcoinTip;
        };
    }
}
