package com.liquidswap.common;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per key. Work for distinct keys runs in parallel, work for the same key is serialized.
 * The lock is released on every exit path of the guarded action, and a key's entry is dropped once no thread
 * holds or waits for it.
 */
public class KeyedLockRegistry {

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    public boolean isLocked(String key) {
        Entry entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    /** Keys currently held or waited for. */
    int activeKeys() {
        return locks.size();
    }

    /** Users are counted under the map's per-key compute, so an entry is never removed while still in use. */
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
