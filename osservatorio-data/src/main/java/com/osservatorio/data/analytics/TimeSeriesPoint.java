package com.osservatorio.data.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TimeSeriesPoint {
    int year;
    String territoryCode;
    String territoryName;
    String measureCode;
    Double value;
    String status;
}
