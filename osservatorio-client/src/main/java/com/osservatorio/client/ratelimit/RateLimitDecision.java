package com.osservatorio.client.ratelimit;

import com.osservatorio.client.threat.ThreatLevel;
import com.osservatorio.common.exception.OsservatorioException;
import com.osservatorio.common.exception.RateLimitExceededException;
import com.osservatorio.common.exception.ThreatBlockedException;
import com.osservatorio.common.model.RateTier;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a rate-limit check. An allowed decision carries the remaining quota
 * of the tightest tier; a denial carries what a caller needs to back off.
 */
@Value
@Builder
public class RateLimitDecision {
    boolean allowed;
    String identifier;
    String scope;
    RateTier tier;
    int limit;
    int remaining;
    Instant resetAt;
    Duration retryAfter;
    DenyReason reason;
    String blockReason;
    Instant blockExpiresAt;
    ThreatLevel threatLevel;
    double effectiveFactor;

    public boolean isBlocked() {
        return !allowed && reason == DenyReason.BLOCKED;
    }

    public OsservatorioException toException() {
        if (allowed) {
            throw new IllegalStateException("Allowed decision has no exception");
        }
        if (reason == DenyReason.BLOCKED) {
            return new ThreatBlockedException(identifier, blockReason, blockExpiresAt);
        }
        return new RateLimitExceededException(identifier, tier, retryAfter, resetAt);
    }
}
