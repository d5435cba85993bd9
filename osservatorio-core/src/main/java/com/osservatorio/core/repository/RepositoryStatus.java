package com.osservatorio.core.repository;

import com.osservatorio.client.circuit.CircuitStats;
import com.osservatorio.client.ratelimit.RateLimiterStatus;
import com.osservatorio.common.model.Subsystem;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class RepositoryStatus {
    RepositoryMode mode;
    Map<Subsystem, SubsystemStatus> subsystems;
    Map<String, CircuitStats> circuits;
    RateLimiterStatus rateLimiter;
    double rateLimiterSaturation;
    Instant checkedAt;
}
