package com.liquidswap.recovery;

import com.liquidswap.domain.WalletTransaction;
import com.liquidswap.domain.WalletTxOut;

import java.util.List;

/**
 * Branch of the swap script a spend of the lockup output takes, read from the spend itself. A script-path claim
 * pushes the 32-byte preimage onto the input's witness stack; a refund is timelocked, so its nLockTime is at or past
 * the leg's timeout height. Spends showing neither (cooperative key-path spends, sources without witness data) are
 * {@link #UNKNOWN}.
 */
enum SpendPath {
    CLAIM,
    REFUND,
    UNKNOWN;

    private static final int PREIMAGE_HEX_LENGTH = 64;
    /** nLockTime values from here on are unix times, not heights. */
    private static final long LOCKTIME_THRESHOLD = 500_000_000L;

    /**
     * @param lockupInputs inputs of {@code spend} that spend the lockup output
     */
    static SpendPath of(WalletTransaction spend, List<WalletTxOut> lockupInputs, Integer timeoutHeight) {
        for (WalletTxOut input : lockupInputs) {
            if (input.getWitness().stream().anyMatch(item -> item.length() == PREIMAGE_HEX_LENGTH)) {
                return CLAIM;
            }
        }
        long lockTime = spend.getLockTime();
        if (timeoutHeight != null && timeoutHeight > 0 && lockTime >= timeoutHeight && lockTime < LOCKTIME_THRESHOLD) {
            return REFUND;
        }
        return UNKNOWN;
    }
}
