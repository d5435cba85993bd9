package com.osservatorio.data.metadata;

import com.osservatorio.common.model.DatasetStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a registry row, detached from the persistence context.
 */
@Value
@Builder
public class DatasetInfo {
    String datasetId;
    String name;
    String category;
    String description;
    String agency;
    int priority;
    Map<String, Object> metadata;
    Double qualityScore;
    DatasetStatus status;
    long recordCount;
    String failureReason;
    String lastBatchId;
    Instant registeredAt;
    Instant updatedAt;

    public boolean isQueryable() {
        return status != null && status.isQueryable();
    }
}
