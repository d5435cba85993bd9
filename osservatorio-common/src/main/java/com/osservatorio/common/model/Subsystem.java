package com.osservatorio.common.model;

public enum Subsystem {
    METADATA,
    ANALYTICS,
    COUNTERS,
    CACHE
}
