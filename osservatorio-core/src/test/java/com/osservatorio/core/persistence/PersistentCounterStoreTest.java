package com.osservatorio.core.persistence;

import com.osservatorio.client.ratelimit.CounterAcquisition;
import com.osservatorio.client.ratelimit.CounterStore;
import com.osservatorio.client.ratelimit.FailoverCounterStore;
import com.osservatorio.common.model.RateTier;
import com.osservatorio.data.repository.RateWindowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DataJpaTest
class PersistentCounterStoreTest {

    private static final long NOW = Instant.parse("2024-05-01T08:00:00.250Z").toEpochMilli();

    @Autowired
    private RateWindowRepository repository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private PersistentCounterStore store;

    @BeforeEach
    void setUp() {
        store = new PersistentCounterStore(repository, transactionManager);
    }

    private static Map<RateTier, Integer> limits(int burst, int minute) {
        Map<RateTier, Integer> limits = new EnumMap<>(RateTier.class);
        limits.put(RateTier.BURST, burst);
        limits.put(RateTier.MINUTE, minute);
        return limits;
    }

    @Test
    void admitsUntilTheTightestTierIsFull() {
        Map<RateTier, Integer> limits = limits(2, 5);

        assertThat(store.tryAcquire("client-1", limits, NOW).isAcquired()).isTrue();
        assertThat(store.tryAcquire("client-1", limits, NOW).isAcquired()).isTrue();
        CounterAcquisition denied = store.tryAcquire("client-1", limits, NOW);

        assertThat(denied.isAcquired()).isFalse();
        assertThat(denied.bindingDenial()).get()
                .extracting(usage -> usage.getTier()).isEqualTo(RateTier.BURST);
        assertThat(repository.findByIdentifier("client-1")).hasSize(2);
    }

    @Test
    void deniedAttemptDoesNotIncrementAnyTier() {
        Map<RateTier, Integer> limits = limits(1, 5);
        store.tryAcquire("client-1", limits, NOW);
        store.tryAcquire("client-1", limits, NOW);
        store.tryAcquire("client-1", limits, NOW);

        assertThat(store.usage("client-1", limits, NOW).get(RateTier.MINUTE).getCount()).isEqualTo(1);
    }

    @Test
    void shorterWindowResetsWhileLongerOneAccumulates() {
        Map<RateTier, Integer> limits = limits(1, 5);
        store.tryAcquire("client-1", limits, NOW);

        CounterAcquisition next = store.tryAcquire("client-1", limits, NOW + 1_000);

        assertThat(next.isAcquired()).isTrue();
        assertThat(next.getWindows().get(RateTier.BURST).getCount()).isEqualTo(1);
        assertThat(next.getWindows().get(RateTier.MINUTE).getCount()).isEqualTo(2);
        assertThat(next.getWindows().get(RateTier.MINUTE).getWindowStartMillis())
                .isEqualTo(Instant.parse("2024-05-01T08:00:00Z").toEpochMilli());
    }

    @Test
    void identifiersAreCountedSeparately() {
        Map<RateTier, Integer> limits = limits(1, 5);
        store.tryAcquire("client-1", limits, NOW);

        assertThat(store.tryAcquire("client-2", limits, NOW).isAcquired()).isTrue();
        assertThat(store.tryAcquire("client-1", limits, NOW).isAcquired()).isFalse();
    }

    @Test
    void resetForgetsTheIdentifier() {
        Map<RateTier, Integer> limits = limits(1, 5);
        store.tryAcquire("client-1", limits, NOW);

        store.reset("client-1");

        assertThat(repository.findByIdentifier("client-1")).isEmpty();
        assertThat(store.tryAcquire("client-1", limits, NOW).isAcquired()).isTrue();
    }

    @Test
    void purgeRemovesWindowsOlderThanADay() {
        store.tryAcquire("client-1", limits(1, 5), NOW);
        store.tryAcquire("client-2", limits(1, 5), NOW + 172_800_000L);

        int removed = store.purgeStale(NOW + 172_800_000L);

        assertThat(removed).isEqualTo(2);
        assertThat(repository.findByIdentifier("client-1")).isEmpty();
        assertThat(repository.findByIdentifier("client-2")).hasSize(2);
        assertThat(store.name()).isEqualTo("database");
    }

    @Test
    void countsTakenWhileRedisIsDownSurviveARestart() {
        CounterStore redis = mock(CounterStore.class);
        when(redis.name()).thenReturn("redis");
        when(redis.tryAcquire(anyString(), anyMap(), anyLong()))
                .thenThrow(new IllegalStateException("connection refused"));
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        Map<RateTier, Integer> limits = limits(5, 2);

        FailoverCounterStore beforeRestart = new FailoverCounterStore(redis, store, Duration.ofSeconds(30), clock);
        assertThat(beforeRestart.tryAcquire("client-1", limits, NOW).isAcquired()).isTrue();
        assertThat(beforeRestart.tryAcquire("client-1", limits, NOW).isAcquired()).isTrue();

        FailoverCounterStore afterRestart = new FailoverCounterStore(redis,
                new PersistentCounterStore(repository, transactionManager), Duration.ofSeconds(30), clock);
        CounterAcquisition denied = afterRestart.tryAcquire("client-1", limits, NOW);

        assertThat(denied.isAcquired()).isFalse();
        assertThat(denied.getWindows().get(RateTier.MINUTE).getCount()).isEqualTo(2);
        assertThat(afterRestart.name()).isEqualTo("redis+database");
    }
}
