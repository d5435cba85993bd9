package com.osservatorio.data.analytics;

import lombok.Builder;
import lombok.Value;

/**
 * One statistical observation: a measure for a territory in a given year.
 */
@Value
@Builder
public class Observation {
    Integer periodYear;
    String territoryCode;
    String territoryName;
    String measureCode;
    String measureName;
    Double value;
    String status;
}
