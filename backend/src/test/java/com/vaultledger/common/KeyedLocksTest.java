package com.vaultledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class KeyedLocksTest {

    @Test
    @DisplayName("same key: critical sections never overlap")
    void sameKeySerializes() throws Exception {
        KeyedLocks<Long> locks = new KeyedLocks<>();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(40);
        for (int i = 0; i < 40; i++) {
            pool.submit(() -> {
                locks.withLock(7L, () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    Thread.onSpinWait();
                    inside.decrementAndGet();
                });
                done.countDown();
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("different keys do not block each other")
    void differentKeysIndependent() throws Exception {
        KeyedLocks<Long> locks = new KeyedLocks<>();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> locks.withLock(1L, () -> {
            holding.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        holder.start();
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(locks.isLocked(1L)).isTrue();
        String result = locks.withLock(2L, () -> "ran");
        assertThat(result).isEqualTo("ran");

        release.countDown();
        holder.join(5_000);
        assertThat(locks.isLocked(1L)).isFalse();
    }

    @Test
    void withLock_returnsValueAndReleasesOnException() {
        KeyedLocks<String> locks = new KeyedLocks<>();
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        try {
            locks.withLock("a", () -> {
                seen.add("first");
                throw new IllegalStateException("boom");
            });
        } catch (IllegalStateException expected) {
            seen.add("caught");
        }
        locks.withLock("a", () -> seen.add("second"));
        assertThat(seen).containsExactly("first", "caught", "second");
        assertThat(locks.isLocked("a")).isFalse();
    }
}
