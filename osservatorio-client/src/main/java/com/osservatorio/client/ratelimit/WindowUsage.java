package com.osservatorio.client.ratelimit;

import com.osservatorio.common.model.RateTier;
import lombok.Value;

@Value
public class WindowUsage {
    RateTier tier;
    int count;
    int limit;
    long windowStartMillis;
    long windowEndMillis;

    public int remaining() {
        return Math.max(0, limit - count);
    }

    public boolean isExhausted() {
        return count >= limit;
    }

    public double saturation() {
        return limit <= 0 ? 1.0 : Math.min(1.0, (double) count / limit);
    }
}
