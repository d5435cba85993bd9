package com.osservatorio.client.ratelimit;

import com.osservatorio.common.model.RateTier;

import java.util.Map;

/**
 * Backend holding per-identifier window counters. Implementations must make
 * {@link #tryAcquire} atomic for one identifier: either every tier is
 * incremented or none is, and the decision reflects the latest committed counts.
 */
public interface CounterStore {

    CounterAcquisition tryAcquire(String identifier, Map<RateTier, Integer> limits, long nowMillis);

    Map<RateTier, WindowUsage> usage(String identifier, Map<RateTier, Integer> limits, long nowMillis);

    void reset(String identifier);

    /**
     * Drop windows that ended before the given instant.
     *
     * @return number of windows removed, when the backend can tell
     */
    int purgeStale(long nowMillis);

    String name();

    default boolean isHealthy() {
        return true;
    }
}
