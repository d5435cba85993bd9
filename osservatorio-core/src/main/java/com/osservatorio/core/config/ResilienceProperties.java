package com.osservatorio.core.config;

import com.osservatorio.client.circuit.CircuitBreakerSettings;
import com.osservatorio.client.retry.RetryPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Breaker and retry settings for upstream calls.
 */
@Configuration
@ConfigurationProperties(prefix = "osservatorio")
@Getter
@Setter
public class ResilienceProperties {

    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
        private Duration recoveryTimeoutMax = Duration.ofMinutes(10);
        private boolean persistState = true;

        public CircuitBreakerSettings toSettings() {
            return CircuitBreakerSettings.builder()
                    .failureThreshold(failureThreshold)
                    .recoveryTimeoutBase(recoveryTimeout)
                    .recoveryTimeoutMax(recoveryTimeoutMax)
                    .build();
        }
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 4;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double jitter = 0.1;

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .initialBackoff(initialBackoff)
                    .multiplier(multiplier)
                    .maxBackoff(maxBackoff)
                    .jitter(jitter)
                    .build();
        }
    }
}
