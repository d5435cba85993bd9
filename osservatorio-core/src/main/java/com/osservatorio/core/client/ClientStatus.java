package com.osservatorio.core.client;

public enum ClientStatus {
    HEALTHY,
    DEGRADED,
    CIRCUIT_OPEN
}
