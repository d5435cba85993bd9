package com.osservatorio.client.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
