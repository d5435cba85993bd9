package com.osservatorio.common.exception;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

@Getter
public class CircuitOpenException extends OsservatorioException {

    private final String dependency;
    private final Instant retryAt;

    public CircuitOpenException(String dependency, Instant retryAt) {
        super("Circuit open for dependency '" + dependency + "' until " + retryAt);
        this.dependency = dependency;
        this.retryAt = retryAt;
    }

    public Duration retryAfter(Instant now) {
        Duration remaining = Duration.between(now, retryAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
