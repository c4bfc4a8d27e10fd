package com.liquidswap.sync;

import com.liquidswap.error.PaymentException;
import com.liquidswap.recovery.RecoveryReport;
import com.liquidswap.sdk.LiquidSdk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic full scan + swap recovery. A tick that finds the previous run still in flight is skipped.
 * Disabled with {@code liquidswap.sync.enabled=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "liquidswap.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WalletSyncJob {

    private final LiquidSdk sdk;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(
            fixedDelayString = "${liquidswap.sync.interval-ms:60000}",
            initialDelayString = "${liquidswap.sync.initial-delay-ms:10000}")
    public void runScheduled() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Previous wallet sync still running, skipping tick");
            return;
        }
        try {
            RecoveryReport report = sdk.sync();
            if (report.failed() > 0) {
                log.warn("Wallet sync left {} of {} swaps unresolved", report.failed(), report.scanned());
            }
        } catch (PaymentException e) {
            log.warn("Wallet sync failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }

    boolean isRunning() {
        return running.get();
    }
}
