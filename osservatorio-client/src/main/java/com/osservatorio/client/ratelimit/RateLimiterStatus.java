package com.osservatorio.client.ratelimit;

import com.osservatorio.client.threat.ThreatLevel;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time view of the limiter, used for repository status and security metrics.
 */
@Value
@Builder
public class RateLimiterStatus {
    String backend;
    boolean backendHealthy;
    long allowed;
    long denied;
    long blockedDenials;
    int activeBlocks;
    long adaptivelyThrottled;
    double averageResponseTimeMs;
    Map<ThreatLevel, Long> threatLevels;

    /**
     * Share of recent decisions that were denials, in [0, 1].
     */
    public double saturation() {
        long total = allowed + denied;
        return total == 0 ? 0.0 : (double) denied / total;
    }
}
