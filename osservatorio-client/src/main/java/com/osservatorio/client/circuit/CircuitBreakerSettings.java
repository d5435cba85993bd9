package com.osservatorio.client.circuit;

import com.osservatorio.common.exception.UpstreamRejectedException;
import com.osservatorio.common.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

@Value
@Builder
public class CircuitBreakerSettings {

    /**
     * Caller-input errors say nothing about the health of the dependency.
     */
    public static final Predicate<Throwable> DEFAULT_FAILURE_PREDICATE =
            e -> !(e instanceof ValidationException) && !(e instanceof UpstreamRejectedException);

    @Builder.Default
    int failureThreshold = 5;
    @Builder.Default
    Duration recoveryTimeoutBase = Duration.ofSeconds(60);
    @Builder.Default
    Duration recoveryTimeoutMax = Duration.ofMinutes(10);
    @Builder.Default
    Predicate<Throwable> recordFailure = DEFAULT_FAILURE_PREDICATE;

    public Duration nextRecoveryTimeout(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(recoveryTimeoutMax) > 0 ? recoveryTimeoutMax : doubled;
    }
}
