package com.osservatorio.data.metadata;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Caller-supplied description of a dataset to register.
 */
@Value
@Builder(toBuilder = true)
public class DatasetDescriptor {
    String datasetId;
    String name;
    String category;
    String description;
    @Builder.Default
    String agency = "IT1";
    @Builder.Default
    int priority = 5;
    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
