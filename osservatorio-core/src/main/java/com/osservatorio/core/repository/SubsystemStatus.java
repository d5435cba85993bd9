package com.osservatorio.core.repository;

import com.osservatorio.common.model.Subsystem;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SubsystemStatus {
    Subsystem subsystem;
    boolean healthy;
    String lastError;
    Instant degradedSince;
    Instant lastCheck;
}
