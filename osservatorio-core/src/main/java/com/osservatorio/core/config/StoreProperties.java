package com.osservatorio.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "osservatorio.store")
@Getter
@Setter
public class StoreProperties {
    private String analyticsUrl = "jdbc:duckdb:data/osservatorio_analytics.duckdb";
    private Duration analyticsLoadTimeout = Duration.ofMinutes(5);
    private int analyticsBatchSize = 1_000;
    private Duration readCacheTtl = Duration.ofMinutes(5);
    private int readCacheMaxEntries = 1_000;
    // last activation per dataset, kept for reads while the metadata store is down
    private int trackedDatasets = 10_000;
    // minimum gap between availability rechecks of a degraded store
    private Duration recheckInterval = Duration.ofSeconds(5);
    private Duration auditRetention = Duration.ofDays(90);
}
