package com.osservatorio.common.model;

/**
 * Lifecycle of a registered dataset. Only ACTIVE datasets are queryable.
 */
public enum DatasetStatus {
    LOADING,
    ACTIVE,
    FAILED,
    INACTIVE;

    public boolean isQueryable() {
        return this == ACTIVE;
    }
}
