package com.osservatorio.data.analytics;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ObservationBatch {
    String datasetId;
    @Builder.Default
    String batchId = UUID.randomUUID().toString();
    @Singular
    List<Observation> rows;
    @Builder.Default
    Instant ingestedAt = Instant.now();

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
