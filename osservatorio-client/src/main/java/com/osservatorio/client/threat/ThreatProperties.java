package com.osservatorio.client.threat;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Signal thresholds and weights for threat scoring. A signal contributes its
 * high weight above the high threshold, its medium weight above the medium one.
 */
@Configuration
@ConfigurationProperties(prefix = "osservatorio.threat")
@Getter
@Setter
public class ThreatProperties {

    private Duration velocityWindow = Duration.ofMinutes(1);
    private int velocityHigh = 100;
    private int velocityMedium = 50;
    private double velocityHighWeight = 0.5;
    private double velocityMediumWeight = 0.25;

    private Duration fanOutWindow = Duration.ofSeconds(10);
    private int fanOutHigh = 10;
    private int fanOutMedium = 5;
    private double fanOutHighWeight = 0.3;
    private double fanOutMediumWeight = 0.15;

    private Duration authFailureWindow = Duration.ofMinutes(10);
    private int authFailuresHigh = 5;
    private int authFailuresMedium = 2;
    private double authFailuresHighWeight = 0.4;
    private double authFailuresMediumWeight = 0.2;

    private Duration errorWindow = Duration.ofMinutes(5);
    private int errorMinSamples = 20;
    private double errorRatioThreshold = 0.5;
    private double errorRatioWeight = 0.2;

    private Duration scoreHalfLife = Duration.ofMinutes(5);
    private double mediumThreshold = 0.3;
    private double highThreshold = 0.5;
    private double criticalThreshold = 0.75;

    private int maxEventsPerIdentifier = 2_000;
    private Duration idleEviction = Duration.ofHours(1);

    public ThreatLevel levelFor(double score) {
        if (score >= criticalThreshold) {
            return ThreatLevel.CRITICAL;
        }
        if (score >= highThreshold) {
            return ThreatLevel.HIGH;
        }
        if (score >= mediumThreshold) {
            return ThreatLevel.MEDIUM;
        }
        return ThreatLevel.LOW;
    }
}
