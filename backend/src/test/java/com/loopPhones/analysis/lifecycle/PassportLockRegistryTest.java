package com.loopPhones.analysis.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PassportLockRegistryTest {

    private final PassportLockRegistry registry = new PassportLockRegistry();

    @Test
    void serializesUpdatesToSamePassport() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        int[] counter = {0};
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                results.add(pool.submit(() -> registry.withLock("PASS-1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    int value = ++counter[0];
                    inside.decrementAndGet();
                    return value;
                })));
            }
            for (Future<Integer> result : results) {
                result.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(counter[0]).isEqualTo(200);
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void differentPassportsDoNotBlockEachOther() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> holder = pool.submit(() -> registry.withLock("PASS-A", () -> {
                holding.countDown();
                try {
                    return release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }));
            assertThat(holding.await(10, TimeUnit.SECONDS)).isTrue();

            String other = registry.withLock("PASS-B", () -> "done");

            assertThat(other).isEqualTo("done");
            release.countDown();
            assertThat(holder.get(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void releasesEntriesOnceNoThreadNeedsThem() {
        for (int i = 0; i < 10_000; i++) {
            registry.withLock("PASS-unknown-" + i, () -> null);
        }

        assertThat(registry.activeLocks()).isZero();
    }

    @Test
    void keepsEntryWhileLockIsHeldAndDropsItAfterwards() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> holder = pool.submit(() -> registry.withLock("PASS-A", () -> {
                holding.countDown();
                try {
                    return release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }));
            assertThat(holding.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(registry.activeLocks()).isEqualTo(1);

            release.countDown();
            assertThat(holder.get(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.activeLocks()).isZero();
    }

    @Test
    void releasesEntryWhenActionThrows() {
        assertThatThrownBy(() -> registry.withLock("PASS-X", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(registry.activeLocks()).isZero();
    }
}
