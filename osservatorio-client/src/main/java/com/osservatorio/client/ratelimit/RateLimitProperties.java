package com.osservatorio.client.ratelimit;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "osservatorio.rate-limit")
@Getter
@Setter
public class RateLimitProperties {

    public enum Backend {
        LOCAL,
        REDIS,
        DATABASE
    }

    private Backend backend = Backend.LOCAL;
    private String redisKeyPrefix = "rl";
    private Duration sharedRecheckInterval = Duration.ofSeconds(30);
    private String defaultScope = "read";
    private int maxConcurrency = 5;
    private Map<String, Limits> scopes = defaultScopes();
    private Adaptive adaptive = new Adaptive();
    private Threat threat = new Threat();

    public RateLimitProfile profile(String scope) {
        Limits limits = scopes.get(scope != null ? scope : defaultScope);
        if (limits == null) {
            limits = scopes.get(defaultScope);
        }
        if (limits == null) {
            limits = new Limits();
        }
        String name = scope != null && scopes.containsKey(scope) ? scope : defaultScope;
        return RateLimitProfile.of(name, limits.getBurst(), limits.getPerMinute(), limits.getPerHour(), limits.getPerDay());
    }

    private static Map<String, Limits> defaultScopes() {
        Map<String, Limits> scopes = new LinkedHashMap<>();
        scopes.put("read", new Limits(10, 60, 1_000, 10_000));
        scopes.put("write", new Limits(5, 30, 500, 5_000));
        scopes.put("admin", new Limits(20, 120, 2_000, 20_000));
        scopes.put("analytics", new Limits(15, 100, 1_500, 15_000));
        scopes.put("export", new Limits(30, 200, 3_000, 30_000));
        return scopes;
    }

    @Getter
    @Setter
    public static class Limits {
        private int burst = 10;
        private int perMinute = 60;
        private int perHour = 1_000;
        private int perDay = 10_000;

        public Limits() {
        }

        public Limits(int burst, int perMinute, int perHour, int perDay) {
            this.burst = burst;
            this.perMinute = perMinute;
            this.perHour = perHour;
            this.perDay = perDay;
        }
    }

    @Getter
    @Setter
    public static class Adaptive {
        private boolean enabled = true;
        private long responseTimeThresholdMs = 2_000;
        private double adjustmentFactor = 0.8;
        private double minAdjustmentRatio = 0.1;
        // capped at 1.0 when applied: adaptive control never raises a limit above nominal
        private double maxAdjustmentRatio = 1.0;
        private int windowSize = 100;
        private int maxTrackedIdentifiers = 10_000;
        // an identifier idle this long returns to nominal
        private Duration idleExpiry = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Threat {
        private double mediumFactor = 0.7;
        private double highFactor = 0.5;
        private Duration blockDuration = Duration.ofHours(24);
    }
}
