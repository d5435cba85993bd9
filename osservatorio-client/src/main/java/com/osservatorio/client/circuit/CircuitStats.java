package com.osservatorio.client.circuit;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class CircuitStats {
    String dependency;
    CircuitState state;
    int failureCount;
    Duration recoveryTimeout;
    Instant retryAt;
    long totalCalls;
    long successfulCalls;
    long failedCalls;
    long rejectedCalls;
}
