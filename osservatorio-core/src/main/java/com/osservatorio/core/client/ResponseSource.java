package com.osservatorio.core.client;

public enum ResponseSource {
    LIVE,
    CACHE,
    STALE_CACHE
}
