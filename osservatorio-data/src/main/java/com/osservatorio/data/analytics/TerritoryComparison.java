package com.osservatorio.data.analytics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TerritoryComparison {
    String territoryCode;
    String territoryName;
    Double value;
    int rank;
}
