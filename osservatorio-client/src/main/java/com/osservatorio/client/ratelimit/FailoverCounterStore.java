package com.osservatorio.client.ratelimit;

import com.osservatorio.common.model.RateTier;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Shared store first, local store while the shared one is unreachable.
 *
 * After a shared-store failure the local store takes over for the recheck
 * interval; the next call after that tries the shared store again. Accounting is
 * at-least-once: a request whose shared increment may or may not have landed is
 * also counted locally, so a caller can be throttled slightly early during a
 * failover but never gets more than the configured quota from either store.
 */
@Slf4j
public class FailoverCounterStore implements CounterStore {

    private final CounterStore shared;
    private final CounterStore local;
    private final Duration recheckInterval;
    private final Clock clock;
    private volatile long sharedRetryAtMillis = 0L;

    public FailoverCounterStore(CounterStore shared, CounterStore local, Duration recheckInterval, Clock clock) {
        this.shared = shared;
        this.local = local;
        this.recheckInterval = recheckInterval;
        this.clock = clock;
    }

    @Override
    public CounterAcquisition tryAcquire(String identifier, Map<RateTier, Integer> limits, long nowMillis) {
        if (isSharedAvailable()) {
            try {
                return shared.tryAcquire(identifier, limits, nowMillis);
            } catch (RuntimeException e) {
                markSharedDown(e);
            }
        }
        return local.tryAcquire(identifier, limits, nowMillis);
    }

    @Override
    public Map<RateTier, WindowUsage> usage(String identifier, Map<RateTier, Integer> limits, long nowMillis) {
        if (isSharedAvailable()) {
            try {
                return shared.usage(identifier, limits, nowMillis);
            } catch (RuntimeException e) {
                markSharedDown(e);
            }
        }
        return local.usage(identifier, limits, nowMillis);
    }

    @Override
    public void reset(String identifier) {
        local.reset(identifier);
        if (isSharedAvailable()) {
            try {
                shared.reset(identifier);
            } catch (RuntimeException e) {
                markSharedDown(e);
            }
        }
    }

    @Override
    public int purgeStale(long nowMillis) {
        return local.purgeStale(nowMillis);
    }

    @Override
    public String name() {
        return shared.name() + "+" + local.name();
    }

    @Override
    public boolean isHealthy() {
        return isSharedAvailable();
    }

    public boolean isSharedAvailable() {
        return clock.millis() >= sharedRetryAtMillis;
    }

    private void markSharedDown(RuntimeException e) {
        sharedRetryAtMillis = clock.millis() + recheckInterval.toMillis();
        log.warn("[RATE_LIMIT] Shared counter store unavailable, using local counters | store={} | retryInMs={} | error={}",
                shared.name(), recheckInterval.toMillis(), e.getMessage());
    }
}
