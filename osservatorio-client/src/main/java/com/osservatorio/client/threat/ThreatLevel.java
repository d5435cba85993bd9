package com.osservatorio.client.threat;

public enum ThreatLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
