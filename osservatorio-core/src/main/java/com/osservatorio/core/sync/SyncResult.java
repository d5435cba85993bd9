package com.osservatorio.core.sync;

import com.osservatorio.core.client.ResponseSource;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncResult {
    String datasetId;
    boolean success;
    long rows;
    Double qualityScore;
    ResponseSource source;
    String error;
    long durationMs;
}
