package com.osservatorio.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "osservatorio.cache")
@Getter
@Setter
public class CacheProperties {
    private boolean enabled = true;
    private Duration ttl = Duration.ofHours(1);
    // how long an expired entry stays available as a fallback
    private Duration staleRetention = Duration.ofHours(24);
    private int hotEntries = 500;
}
