package com.osservatorio.data.metadata;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AuditEntry {
    @Builder.Default
    String actor = "system";
    String action;
    String resourceType;
    String resourceId;
    @Builder.Default
    Map<String, Object> details = Map.of();
    @Builder.Default
    boolean success = true;
    String errorMessage;
    Instant createdAt;
}
