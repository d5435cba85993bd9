package com.osservatorio.common.model;

import java.time.Duration;

/**
 * Fixed rate-limit windows. Window starts are aligned to the epoch so that every
 * process sharing a counter store computes the same window for the same instant.
 */
public enum RateTier {
    BURST(Duration.ofSeconds(1)),
    MINUTE(Duration.ofMinutes(1)),
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1));

    private final Duration window;

    RateTier(Duration window) {
        this.window = window;
    }

    public Duration getWindow() {
        return window;
    }

    public long windowStartMillis(long nowMillis) {
        long size = window.toMillis();
        return Math.floorDiv(nowMillis, size) * size;
    }

    public long windowEndMillis(long nowMillis) {
        return windowStartMillis(nowMillis) + window.toMillis();
    }
}
