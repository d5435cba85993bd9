package com.osservatorio.client.circuit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one breaker per dependency name. Built once at the composition root and
 * injected wherever a breaker is needed.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final CircuitBreakerSettings defaultSettings;
    private final Clock clock;
    private final CircuitStateStore stateStore;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerSettings defaultSettings, Clock clock, CircuitStateStore stateStore) {
        this.defaultSettings = defaultSettings;
        this.clock = clock;
        this.stateStore = stateStore;
    }

    public CircuitBreaker get(String dependency) {
        return get(dependency, defaultSettings);
    }

    /**
     * Settings only apply when the breaker is created; later calls with other
     * settings return the existing instance.
     */
    public CircuitBreaker get(String dependency, CircuitBreakerSettings settings) {
        return breakers.computeIfAbsent(dependency, name -> {
            log.info("[BREAKER] Registered | dependency={} | threshold={} | recoveryTimeoutMs={}",
                    name, settings.getFailureThreshold(), settings.getRecoveryTimeoutBase().toMillis());
            return new CircuitBreaker(name, settings, clock, stateStore);
        });
    }

    public Collection<CircuitBreaker> all() {
        return Collections.unmodifiableCollection(breakers.values());
    }

    public Map<String, CircuitStats> stats() {
        Map<String, CircuitStats> stats = new TreeMap<>();
        breakers.forEach((name, breaker) -> stats.put(name, breaker.stats()));
        return stats;
    }

    public boolean anyOpen() {
        return breakers.values().stream().anyMatch(b -> b.getState() != CircuitState.CLOSED);
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
