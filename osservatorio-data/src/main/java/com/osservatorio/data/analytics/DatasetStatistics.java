package com.osservatorio.data.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DatasetStatistics {
    String datasetId;
    long recordCount;
    Integer minYear;
    Integer maxYear;
    long territoryCount;
    long measureCount;
    Double averageValue;
    Double minValue;
    Double maxValue;

    public static DatasetStatistics empty(String datasetId) {
        return DatasetStatistics.builder().datasetId(datasetId).build();
    }
}
