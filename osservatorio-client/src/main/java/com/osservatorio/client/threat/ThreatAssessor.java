package com.osservatorio.client.threat;

import java.util.Map;

/**
 * Read-only view of threat scoring. The rate limiter depends on this, never on
 * the event-recording side.
 */
public interface ThreatAssessor {

    ThreatAssessment assess(String identifier);

    Map<ThreatLevel, Long> levelCounts();
}
