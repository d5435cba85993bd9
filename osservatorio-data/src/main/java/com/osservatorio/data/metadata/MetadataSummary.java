package com.osservatorio.data.metadata;

import com.osservatorio.common.model.DatasetStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class MetadataSummary {
    long totalDatasets;
    Map<DatasetStatus, Long> datasetsByStatus;
    long activeCategories;
}
