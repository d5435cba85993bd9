package com.osservatorio.core.client;

import com.osservatorio.client.circuit.CircuitStats;
import com.osservatorio.core.cache.CacheStats;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ClientMetrics {
    ClientStatus status;
    long totalRequests;
    long successfulRequests;
    long failedRequests;
    long rateLimitedRequests;
    long cacheHits;
    long staleResponses;
    long upstreamAttempts;
    double averageResponseTimeMs;
    CircuitStats circuit;
    CacheStats cache;
}
