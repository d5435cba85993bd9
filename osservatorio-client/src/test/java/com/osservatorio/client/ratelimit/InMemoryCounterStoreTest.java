package com.osservatorio.client.ratelimit;

import com.osservatorio.common.model.RateTier;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCounterStoreTest {

    private static final long T0 = Instant.parse("2024-05-01T08:00:00Z").toEpochMilli();

    private final InMemoryCounterStore store = new InMemoryCounterStore();

    private static Map<RateTier, Integer> limits(int burst, int minute) {
        Map<RateTier, Integer> limits = new EnumMap<>(RateTier.class);
        limits.put(RateTier.BURST, burst);
        limits.put(RateTier.MINUTE, minute);
        return limits;
    }

    @Test
    void deniedAcquireLeavesEveryCounterUntouched() {
        Map<RateTier, Integer> limits = limits(10, 12);
        for (int second = 0; second < 3; second++) {
            for (int i = 0; i < 4; i++) {
                store.tryAcquire("c", limits, T0 + second * 1_000L);
            }
        }

        CounterAcquisition denied = store.tryAcquire("c", limits, T0 + 3_000);

        assertThat(denied.isAcquired()).isFalse();
        assertThat(denied.getWindows().get(RateTier.BURST).getCount()).isZero();
        assertThat(denied.getWindows().get(RateTier.MINUTE).getCount()).isEqualTo(12);
        assertThat(denied.bindingDenial()).get().extracting(WindowUsage::getTier).isEqualTo(RateTier.MINUTE);
    }

    @Test
    void countersResetAtTheWindowBoundary() {
        Map<RateTier, Integer> limits = limits(2, 100);
        store.tryAcquire("c", limits, T0 + 900);
        store.tryAcquire("c", limits, T0 + 950);
        assertThat(store.tryAcquire("c", limits, T0 + 999).isAcquired()).isFalse();

        CounterAcquisition next = store.tryAcquire("c", limits, T0 + 1_000);

        assertThat(next.isAcquired()).isTrue();
        assertThat(next.getWindows().get(RateTier.BURST).getCount()).isEqualTo(1);
        assertThat(next.getWindows().get(RateTier.MINUTE).getCount()).isEqualTo(3);
    }

    @Test
    void identifiersAreIndependent() {
        Map<RateTier, Integer> limits = limits(1, 10);
        assertThat(store.tryAcquire("a", limits, T0).isAcquired()).isTrue();
        assertThat(store.tryAcquire("b", limits, T0).isAcquired()).isTrue();
        assertThat(store.tryAcquire("a", limits, T0).isAcquired()).isFalse();
    }

    @Test
    void usageDoesNotConsumeQuota() {
        Map<RateTier, Integer> limits = limits(5, 10);
        store.tryAcquire("c", limits, T0);

        Map<RateTier, WindowUsage> usage = store.usage("c", limits, T0);
        store.usage("c", limits, T0);

        assertThat(usage.get(RateTier.BURST).getCount()).isEqualTo(1);
        assertThat(usage.get(RateTier.BURST).remaining()).isEqualTo(4);
        assertThat(store.usage("unknown", limits, T0).get(RateTier.MINUTE).getCount()).isZero();
    }

    @Test
    void purgeDropsIdentifiersWhoseWindowsAllEnded() {
        store.tryAcquire("old", limits(5, 10), T0);
        store.tryAcquire("fresh", limits(5, 10), T0 + 90_000);

        int removed = store.purgeStale(T0 + 90_500);

        assertThat(removed).isEqualTo(1);
        assertThat(store.trackedIdentifiers()).isEqualTo(1);
    }

    @Test
    void concurrentAcquiresAreSound() throws Exception {
        Map<RateTier, Integer> limits = limits(25, 1_000);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger acquired = new AtomicInteger();
        for (int t = 0; t < 16; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 10; i++) {
                    if (store.tryAcquire("shared", limits, T0).isAcquired()) {
                        acquired.incrementAndGet();
                    }
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(acquired.get()).isEqualTo(25);
        assertThat(store.usage("shared", limits, T0).get(RateTier.MINUTE).getCount()).isEqualTo(25);
    }
}
