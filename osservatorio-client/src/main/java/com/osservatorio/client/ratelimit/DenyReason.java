package com.osservatorio.client.ratelimit;

public enum DenyReason {
    QUOTA,
    BLOCKED
}
