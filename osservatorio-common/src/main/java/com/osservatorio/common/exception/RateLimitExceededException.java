package com.osservatorio.common.exception;

import com.osservatorio.common.model.RateTier;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

@Getter
public class RateLimitExceededException extends OsservatorioException {

    private final String identifier;
    private final RateTier tier;
    private final Duration retryAfter;
    private final Instant resetAt;

    public RateLimitExceededException(String identifier, RateTier tier, Duration retryAfter, Instant resetAt) {
        super(String.format("Rate limit exceeded for tier %s, retry after %d ms", tier, retryAfter.toMillis()));
        this.identifier = identifier;
        this.tier = tier;
        this.retryAfter = retryAfter;
        this.resetAt = resetAt;
    }
}
