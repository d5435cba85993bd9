package com.osservatorio.client.circuit;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable state of one breaker. Transitions replace the whole snapshot with a
 * compare-and-set, so readers always see a consistent combination of fields.
 */
@Value
@Builder(toBuilder = true)
public class CircuitSnapshot {
    CircuitState state;
    int failureCount;
    Instant openedAt;
    Duration recoveryTimeout;
    // Only meaningful in HALF_OPEN: the single trial call has been handed out
    boolean trialInFlight;

    public static CircuitSnapshot closed(Duration baseTimeout) {
        return CircuitSnapshot.builder()
                .state(CircuitState.CLOSED)
                .failureCount(0)
                .recoveryTimeout(baseTimeout)
                .build();
    }

    public Instant retryAt() {
        return openedAt != null ? openedAt.plus(recoveryTimeout) : null;
    }
}
