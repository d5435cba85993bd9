package com.osservatorio.client.threat;

import com.osservatorio.common.util.HashUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the per-identifier event log and is the single source of threat scores.
 *
 * Each recorded event recomputes the evidence score from four signals: request
 * velocity, endpoint fan-out, authentication failures and upstream error ratio.
 * The stored score is the larger of the new evidence and the decayed previous
 * score, so a burst of abuse keeps an identifier flagged for a while after the
 * burst ends. Without new events the score halves every configured half-life.
 */
@Slf4j
public class ThreatScorer implements ThreatAssessor {

    private final ThreatProperties properties;
    private final Clock clock;
    private final Map<String, Activity> activities = new ConcurrentHashMap<>();

    public ThreatScorer(ThreatProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public ThreatAssessment recordRequest(String identifier, String endpoint) {
        Instant now = clock.instant();
        Activity activity = activity(identifier);
        synchronized (activity) {
            activity.requests.addLast(new RequestEvent(now, endpoint != null ? endpoint : ""));
            trim(activity.requests, properties.getMaxEventsPerIdentifier());
            return rescore(identifier, activity, now);
        }
    }

    public ThreatAssessment recordAuthFailure(String identifier) {
        Instant now = clock.instant();
        Activity activity = activity(identifier);
        synchronized (activity) {
            activity.authFailures.addLast(now);
            trim(activity.authFailures, properties.getMaxEventsPerIdentifier());
            return rescore(identifier, activity, now);
        }
    }

    /**
     * Outcome of an upstream call made on behalf of the identifier.
     */
    public ThreatAssessment recordOutcome(String identifier, boolean success) {
        Instant now = clock.instant();
        Activity activity = activity(identifier);
        synchronized (activity) {
            activity.outcomes.addLast(new Outcome(now, success));
            trim(activity.outcomes, properties.getMaxEventsPerIdentifier());
            return rescore(identifier, activity, now);
        }
    }

    @Override
    public ThreatAssessment assess(String identifier) {
        Activity activity = activities.get(identifier);
        if (activity == null) {
            return ThreatAssessment.none(identifier);
        }
        Instant now = clock.instant();
        synchronized (activity) {
            double score = decayed(activity.score, activity.lastUpdated, now);
            return ThreatAssessment.builder()
                    .identifier(identifier)
                    .score(score)
                    .level(properties.levelFor(score))
                    .evidence(List.copyOf(activity.evidence))
                    .lastUpdated(activity.lastUpdated)
                    .build();
        }
    }

    @Override
    public Map<ThreatLevel, Long> levelCounts() {
        Map<ThreatLevel, Long> counts = new EnumMap<>(ThreatLevel.class);
        for (ThreatLevel level : ThreatLevel.values()) {
            counts.put(level, 0L);
        }
        activities.keySet().forEach(id -> counts.merge(assess(id).getLevel(), 1L, Long::sum));
        return counts;
    }

    public int trackedIdentifiers() {
        return activities.size();
    }

    public void forget(String identifier) {
        activities.remove(identifier);
    }

    /**
     * Drop identifiers without events for the idle period whose score has decayed
     * below the medium band.
     *
     * @return number of identifiers evicted
     */
    public int purgeIdle() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getIdleEviction());
        int removed = 0;
        Iterator<Map.Entry<String, Activity>> it = activities.entrySet().iterator();
        while (it.hasNext()) {
            Activity activity = it.next().getValue();
            synchronized (activity) {
                boolean idle = activity.lastUpdated == null || activity.lastUpdated.isBefore(cutoff);
                if (idle && decayed(activity.score, activity.lastUpdated, now) < properties.getMediumThreshold()) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("[THREAT] Idle identifiers purged | count={}", removed);
        }
        return removed;
    }

    // ---------------------------------------------------------------------

    private Activity activity(String identifier) {
        return activities.computeIfAbsent(identifier, id -> new Activity());
    }

    private ThreatAssessment rescore(String identifier, Activity activity, Instant now) {
        prune(activity, now);
        List<String> evidence = new ArrayList<>();
        double evidenceScore = velocitySignal(activity, now, evidence)
                + fanOutSignal(activity, now, evidence)
                + authFailureSignal(activity, now, evidence)
                + errorRatioSignal(activity, now, evidence);
        evidenceScore = Math.min(1.0, evidenceScore);

        double previous = decayed(activity.score, activity.lastUpdated, now);
        ThreatLevel previousLevel = properties.levelFor(previous);
        if (evidenceScore >= previous) {
            activity.score = evidenceScore;
            activity.evidence = evidence;
        } else {
            activity.score = previous;
        }
        activity.lastUpdated = now;

        ThreatLevel level = properties.levelFor(activity.score);
        if (level.compareTo(previousLevel) > 0 && level.compareTo(ThreatLevel.MEDIUM) >= 0) {
            log.warn("[THREAT] Threat level raised | identifier={} | level={} | score={} | evidence={}",
                    HashUtils.mask(identifier), level, String.format("%.2f", activity.score), activity.evidence);
        }
        return ThreatAssessment.builder()
                .identifier(identifier)
                .score(activity.score)
                .level(level)
                .evidence(List.copyOf(activity.evidence))
                .lastUpdated(now)
                .build();
    }

    private double velocitySignal(Activity activity, Instant now, List<String> evidence) {
        Instant since = now.minus(properties.getVelocityWindow());
        long count = activity.requests.stream().filter(e -> !e.at.isBefore(since)).count();
        return band("velocity=" + count, count, properties.getVelocityHigh(), properties.getVelocityHighWeight(),
                properties.getVelocityMedium(), properties.getVelocityMediumWeight(), evidence);
    }

    private double fanOutSignal(Activity activity, Instant now, List<String> evidence) {
        Instant since = now.minus(properties.getFanOutWindow());
        Set<String> endpoints = new HashSet<>();
        for (RequestEvent event : activity.requests) {
            if (!event.at.isBefore(since)) {
                endpoints.add(event.endpoint);
            }
        }
        return band("fan_out=" + endpoints.size(), endpoints.size(), properties.getFanOutHigh(),
                properties.getFanOutHighWeight(), properties.getFanOutMedium(), properties.getFanOutMediumWeight(), evidence);
    }

    private double authFailureSignal(Activity activity, Instant now, List<String> evidence) {
        Instant since = now.minus(properties.getAuthFailureWindow());
        long count = activity.authFailures.stream().filter(at -> !at.isBefore(since)).count();
        return band("auth_failures=" + count, count, properties.getAuthFailuresHigh(),
                properties.getAuthFailuresHighWeight(), properties.getAuthFailuresMedium(),
                properties.getAuthFailuresMediumWeight(), evidence);
    }

    private double errorRatioSignal(Activity activity, Instant now, List<String> evidence) {
        Instant since = now.minus(properties.getErrorWindow());
        long total = 0;
        long failed = 0;
        for (Outcome outcome : activity.outcomes) {
            if (!outcome.at.isBefore(since)) {
                total++;
                if (!outcome.success) {
                    failed++;
                }
            }
        }
        if (total < properties.getErrorMinSamples()) {
            return 0.0;
        }
        double ratio = (double) failed / total;
        if (ratio > properties.getErrorRatioThreshold()) {
            evidence.add(String.format("error_ratio=%.2f", ratio));
            return properties.getErrorRatioWeight();
        }
        return 0.0;
    }

    private static double band(String label, long value, int high, double highWeight,
                               int medium, double mediumWeight, List<String> evidence) {
        if (value > high) {
            evidence.add(label);
            return highWeight;
        }
        if (value > medium) {
            evidence.add(label);
            return mediumWeight;
        }
        return 0.0;
    }

    private double decayed(double score, Instant lastUpdated, Instant now) {
        if (score <= 0.0 || lastUpdated == null) {
            return 0.0;
        }
        long elapsedMs = Duration.between(lastUpdated, now).toMillis();
        if (elapsedMs <= 0) {
            return score;
        }
        double halfLives = (double) elapsedMs / properties.getScoreHalfLife().toMillis();
        return score * Math.pow(0.5, halfLives);
    }

    private void prune(Activity activity, Instant now) {
        Instant requestHorizon = now.minus(max(properties.getVelocityWindow(), properties.getFanOutWindow()));
        while (!activity.requests.isEmpty() && activity.requests.peekFirst().at.isBefore(requestHorizon)) {
            activity.requests.pollFirst();
        }
        Instant authHorizon = now.minus(properties.getAuthFailureWindow());
        while (!activity.authFailures.isEmpty() && activity.authFailures.peekFirst().isBefore(authHorizon)) {
            activity.authFailures.pollFirst();
        }
        Instant errorHorizon = now.minus(properties.getErrorWindow());
        while (!activity.outcomes.isEmpty() && activity.outcomes.peekFirst().at.isBefore(errorHorizon)) {
            activity.outcomes.pollFirst();
        }
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static void trim(Deque<?> events, int max) {
        while (events.size() > max) {
            events.pollFirst();
        }
    }

    private static final class Activity {
        final Deque<RequestEvent> requests = new ArrayDeque<>();
        final Deque<Instant> authFailures = new ArrayDeque<>();
        final Deque<Outcome> outcomes = new ArrayDeque<>();
        double score;
        Instant lastUpdated;
        List<String> evidence = List.of();
    }

    private record RequestEvent(Instant at, String endpoint) {
    }

    private record Outcome(Instant at, boolean success) {
    }
}
