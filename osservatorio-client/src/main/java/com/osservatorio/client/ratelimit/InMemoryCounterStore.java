package com.osservatorio.client.ratelimit;

import com.osservatorio.common.model.RateTier;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local counters. Used alone for single-instance deployments and as the
 * fallback of {@link FailoverCounterStore}.
 */
public class InMemoryCounterStore implements CounterStore {

    private final Map<String, Windows> counters = new ConcurrentHashMap<>();

    @Override
    public CounterAcquisition tryAcquire(String identifier, Map<RateTier, Integer> limits, long nowMillis) {
        Windows windows = counters.computeIfAbsent(identifier, id -> new Windows());
        synchronized (windows) {
            boolean fits = true;
            for (Map.Entry<RateTier, Integer> entry : limits.entrySet()) {
                if (windows.current(entry.getKey(), nowMillis) + 1 > entry.getValue()) {
                    fits = false;
                }
            }
            if (fits) {
                limits.keySet().forEach(tier -> windows.increment(tier, nowMillis));
            }
            return new CounterAcquisition(fits, windows.usage(limits, nowMillis));
        }
    }

    @Override
    public Map<RateTier, WindowUsage> usage(String identifier, Map<RateTier, Integer> limits, long nowMillis) {
        Windows windows = counters.get(identifier);
        if (windows == null) {
            return new Windows().usage(limits, nowMillis);
        }
        synchronized (windows) {
            return windows.usage(limits, nowMillis);
        }
    }

    @Override
    public void reset(String identifier) {
        counters.remove(identifier);
    }

    @Override
    public int purgeStale(long nowMillis) {
        int removed = 0;
        Iterator<Map.Entry<String, Windows>> it = counters.entrySet().iterator();
        while (it.hasNext()) {
            Windows windows = it.next().getValue();
            synchronized (windows) {
                if (windows.allEndedBefore(nowMillis)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    @Override
    public String name() {
        return "local";
    }

    public int trackedIdentifiers() {
        return counters.size();
    }

    private static final class Windows {
        private final Map<RateTier, long[]> byTier = new EnumMap<>(RateTier.class); // {windowStart, count}

        int current(RateTier tier, long nowMillis) {
            long[] window = byTier.get(tier);
            if (window == null || window[0] != tier.windowStartMillis(nowMillis)) {
                return 0;
            }
            return (int) window[1];
        }

        void increment(RateTier tier, long nowMillis) {
            long start = tier.windowStartMillis(nowMillis);
            long[] window = byTier.get(tier);
            if (window == null || window[0] != start) {
                byTier.put(tier, new long[] {start, 1});
            } else {
                window[1]++;
            }
        }

        Map<RateTier, WindowUsage> usage(Map<RateTier, Integer> limits, long nowMillis) {
            Map<RateTier, WindowUsage> usage = new EnumMap<>(RateTier.class);
            limits.forEach((tier, limit) -> usage.put(tier, new WindowUsage(tier, current(tier, nowMillis), limit,
                    tier.windowStartMillis(nowMillis), tier.windowEndMillis(nowMillis))));
            return usage;
        }

        boolean allEndedBefore(long nowMillis) {
            return byTier.entrySet().stream()
                    .allMatch(e -> e.getValue()[0] + e.getKey().getWindow().toMillis() <= nowMillis);
        }
    }
}
