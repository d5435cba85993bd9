package com.osservatorio.client.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.osservatorio.common.util.HashUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tightens an identifier's limits while its calls are slow and relaxes them
 * again once they recover.
 *
 * Response times are kept in a rolling window per (identifier, endpoint). After
 * every sample the identifier counts as slow while any of its endpoint averages
 * exceeds the threshold; its factor is then multiplied by the adjustment factor
 * (down to the minimum ratio). Only when no endpoint is slow is it divided by
 * it, up to the nominal limit.
 *
 * Identifiers idle for longer than the configured expiry are forgotten and run
 * at nominal again.
 */
@Slf4j
public class AdaptiveLimitController {

    private final RateLimitProperties.Adaptive settings;
    private final Cache<String, IdentifierState> states;

    public AdaptiveLimitController(RateLimitProperties.Adaptive settings) {
        this.settings = settings;
        this.states = Caffeine.newBuilder()
                .maximumSize(settings.getMaxTrackedIdentifiers())
                .expireAfterAccess(settings.getIdleExpiry())
                .build();
    }

    public void recordResponseTime(String identifier, String endpoint, Duration responseTime) {
        if (!settings.isEnabled()) {
            return;
        }
        IdentifierState state = states.get(identifier, k -> new IdentifierState());
        double average;
        double previous;
        double updated;
        synchronized (state) {
            average = state.windows
                    .computeIfAbsent(endpoint, k -> new ResponseWindow(settings.getWindowSize()))
                    .add(responseTime.toMillis());
            boolean slow = state.windows.values().stream()
                    .anyMatch(w -> w.average() > settings.getResponseTimeThresholdMs());
            double ceiling = Math.min(1.0, settings.getMaxAdjustmentRatio());

            previous = state.factor;
            state.factor = slow
                    ? Math.max(settings.getMinAdjustmentRatio(), previous * settings.getAdjustmentFactor())
                    : Math.min(ceiling, previous / settings.getAdjustmentFactor());
            updated = state.factor;
        }
        if (Math.abs(previous - updated) > 1e-9) {
            log.debug("[RATE_LIMIT] Adaptive factor changed | identifier={} | endpoint={} | avgMs={} | factor={}",
                    HashUtils.mask(identifier), endpoint, Math.round(average), String.format("%.3f", updated));
        }
    }

    public double factor(String identifier) {
        if (!settings.isEnabled()) {
            return 1.0;
        }
        IdentifierState state = states.getIfPresent(identifier);
        return state == null ? 1.0 : state.factor;
    }

    public OptionalDouble averageResponseTime(String identifier, String endpoint) {
        IdentifierState state = states.getIfPresent(identifier);
        ResponseWindow window = state == null ? null : state.windows.get(endpoint);
        return window == null ? OptionalDouble.empty() : OptionalDouble.of(window.average());
    }

    /**
     * Mean of the per-endpoint averages across every tracked pair.
     */
    public double overallAverageMs() {
        return states.asMap().values().stream()
                .flatMap(s -> s.windows.values().stream())
                .mapToDouble(ResponseWindow::average)
                .average()
                .orElse(0.0);
    }

    public long throttledIdentifiers() {
        return states.asMap().values().stream().filter(s -> s.factor < 1.0).count();
    }

    public long trackedIdentifiers() {
        states.cleanUp();
        return states.estimatedSize();
    }

    public void reset(String identifier) {
        states.invalidate(identifier);
    }

    /**
     * Forget identifiers back at nominal together with their windows.
     */
    public int purgeRecovered() {
        int before = states.asMap().size();
        states.asMap().values().removeIf(s -> s.factor >= 1.0);
        return before - states.asMap().size();
    }

    private static final class IdentifierState {
        private final Map<String, ResponseWindow> windows = new ConcurrentHashMap<>();
        private volatile double factor = 1.0;
    }

    private static final class ResponseWindow {
        private final long[] samples;
        private int size;
        private int next;
        private long sum;

        ResponseWindow(int capacity) {
            this.samples = new long[Math.max(1, capacity)];
        }

        synchronized double add(long millis) {
            if (size == samples.length) {
                sum -= samples[next];
            } else {
                size++;
            }
            samples[next] = millis;
            sum += millis;
            next = (next + 1) % samples.length;
            return (double) sum / size;
        }

        synchronized double average() {
            return size == 0 ? 0.0 : (double) sum / size;
        }
    }
}
