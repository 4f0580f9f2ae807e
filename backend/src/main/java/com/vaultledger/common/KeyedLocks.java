package com.vaultledger.common;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair {@link ReentrantLock} per key. Entries are weakly held, so locks for idle keys are collected
 * while any thread still holding a lock keeps it alive.
 */
public class KeyedLocks<K> {

    private final LoadingCache<K, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock(true));

    public <T> T withLock(K key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(K key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    boolean isLocked(K key) {
        ReentrantLock lock = locks.getIfPresent(key);
        return lock != null && lock.isLocked();
    }
}
