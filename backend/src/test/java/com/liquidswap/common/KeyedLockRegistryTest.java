package com.liquidswap.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyedLockRegistryTest {

    @Test
    @DisplayName("work on the same key never overlaps")
    void serializesSameKey() {
        KeyedLockRegistry registry = new KeyedLockRegistry();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(CompletableFuture.runAsync(() -> registry.withLock("swap-1", () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    sleepQuietly(2);
                    inside.decrementAndGet();
                }), pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("lock is released when the action throws")
    void releasesOnFailure() {
        KeyedLockRegistry registry = new KeyedLockRegistry();
        assertThatThrownBy(() -> registry.withLock("k", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(registry.isLocked("k")).isFalse();
        assertThat(registry.withLock("k", () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("entries are dropped once no one holds or waits for the key")
    void evictsIdleKeys() {
        KeyedLockRegistry registry = new KeyedLockRegistry();
        for (int i = 0; i < 100; i++) {
            registry.withLock("swap-" + i, () -> { });
        }
        assertThat(registry.activeKeys()).isZero();

        registry.withLock("outer", () -> {
            registry.withLock("outer", () -> assertThat(registry.activeKeys()).isEqualTo(1));
            assertThat(registry.isLocked("outer")).isTrue();
        });
        assertThat(registry.activeKeys()).isZero();
        assertThat(registry.isLocked("outer")).isFalse();
    }

    @Test
    @DisplayName("contended keys stay serialized and are dropped afterwards")
    void evictsAfterContention() {
        KeyedLockRegistry registry = new KeyedLockRegistry();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String key = "swap-" + (i % 3);
                futures.add(CompletableFuture.runAsync(() -> registry.withLock(key, () -> {
                    if (key.equals("swap-0")) {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        inside.decrementAndGet();
                    }
                }), pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(registry.activeKeys()).isZero();
    }

    private static void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
