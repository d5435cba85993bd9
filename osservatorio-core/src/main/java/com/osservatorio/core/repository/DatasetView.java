package com.osservatorio.core.repository;

import com.osservatorio.data.analytics.DatasetStatistics;
import com.osservatorio.data.metadata.DatasetInfo;
import lombok.Builder;
import lombok.Value;

/**
 * Metadata of a dataset merged with its analytics statistics. Statistics are
 * only present for ACTIVE datasets whose analytics store could be read.
 */
@Value
@Builder
public class DatasetView {
    DatasetInfo info;
    DatasetStatistics statistics;
    boolean analyticsAvailable;

    public boolean hasStatistics() {
        return statistics != null;
    }
}
