package com.osservatorio.client.ratelimit;

import com.osservatorio.common.model.RateTier;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Named set of per-tier limits. A request must fit every tier.
 */
@Value
public class RateLimitProfile {
    String name;
    Map<RateTier, Integer> limits;

    public static RateLimitProfile of(String name, int burst, int perMinute, int perHour, int perDay) {
        Map<RateTier, Integer> limits = new EnumMap<>(RateTier.class);
        limits.put(RateTier.BURST, burst);
        limits.put(RateTier.MINUTE, perMinute);
        limits.put(RateTier.HOUR, perHour);
        limits.put(RateTier.DAY, perDay);
        return new RateLimitProfile(name, Collections.unmodifiableMap(limits));
    }

    public int limit(RateTier tier) {
        return limits.getOrDefault(tier, Integer.MAX_VALUE);
    }

    /**
     * Scale every tier by the factor, never below one request per window and
     * never above the nominal limit.
     */
    public RateLimitProfile scaled(double factor) {
        if (factor >= 1.0) {
            return this;
        }
        Map<RateTier, Integer> scaled = new EnumMap<>(RateTier.class);
        limits.forEach((tier, limit) -> scaled.put(tier, Math.max(1, (int) Math.floor(limit * factor))));
        return new RateLimitProfile(name, Collections.unmodifiableMap(scaled));
    }
}
