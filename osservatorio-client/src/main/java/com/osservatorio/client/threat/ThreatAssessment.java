package com.osservatorio.client.threat;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ThreatAssessment {
    String identifier;
    double score;
    ThreatLevel level;
    List<String> evidence;
    Instant lastUpdated;

    public static ThreatAssessment none(String identifier) {
        return ThreatAssessment.builder()
                .identifier(identifier)
                .score(0.0)
                .level(ThreatLevel.LOW)
                .evidence(List.of())
                .build();
    }
}
