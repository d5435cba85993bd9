package com.osservatorio.client.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "osservatorio.upstream")
@Getter
@Setter
public class UpstreamProperties {
    private String name = "istat-sdmx";
    private String baseUrl = "https://sdmx.istat.it/SDMXWS/rest";
    private String userAgent = "Osservatorio-Client/1.0";
    private int connectTimeoutMs = 10_000;
    private int timeoutSeconds = 30; // per attempt
    private int maxConnections = 20;
    private int pendingAcquireTimeoutSeconds = 45;
    private int maxIdleSeconds = 60;
    private int maxInMemorySizeMb = 16; // SDMX payloads can be large
    private int maxConcurrency = 5; // batch fetches in flight per identifier
    private Set<Integer> retryableStatuses = Set.of(429, 500, 502, 503, 504);
    private Map<String, String> headers = new LinkedHashMap<>(Map.of("Accept", "application/xml, application/json"));

    public boolean isRetryable(int statusCode) {
        return retryableStatuses.contains(statusCode);
    }
}
