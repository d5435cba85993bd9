package com.osservatorio.core.sync;

import lombok.Value;

import java.util.List;

@Value
public class BatchSyncResult {
    List<SyncResult> results;
    long durationMs;

    public long successful() {
        return results.stream().filter(SyncResult::isSuccess).count();
    }

    public long failed() {
        return results.size() - successful();
    }

    public long totalRows() {
        return results.stream().mapToLong(SyncResult::getRows).sum();
    }
}
