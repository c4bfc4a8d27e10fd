package com.liquidswap.recovery.handler;

import com.liquidswap.domain.SwapKind;
import com.liquidswap.domain.SwapRecord;
import com.liquidswap.recovery.ChainTips;
import com.liquidswap.recovery.RecoveryHistory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes each swap to the handler of its kind.
 */
@Component
public class SwapRecoveryDispatcher {

    private final Map<SwapKind, SwapRecoveryHandler> handlers = new EnumMap<>(SwapKind.class);

    public SwapRecoveryDispatcher(List<SwapRecoveryHandler> handlers) {
        for (SwapRecoveryHandler handler : handlers) {
            if (this.handlers.put(handler.kind(), handler) != null) {
                throw new IllegalStateException("Duplicate recovery handler for " + handler.kind());
            }
        }
    }

    /**
     * Matches the swap against {@code history} and resolves it with its kind's handler.
     */
    public SwapRecord resolve(SwapRecord record, RecoveryHistory history, ChainTips tips) {
        SwapRecoveryHandler handler = handlers.get(record.getKind());
        if (handler == null) {
            throw new IllegalStateException("No recovery handler for swap kind " + record.getKind());
        }
        return handler.resolve(record, history.forSwap(record), tips);
    }
}
