package com.osservatorio.client.ratelimit;

import com.osservatorio.client.threat.ThreatAssessment;
import com.osservatorio.client.threat.ThreatAssessor;
import com.osservatorio.client.threat.ThreatLevel;
import com.osservatorio.common.exception.ValidationException;
import com.osservatorio.common.model.RateTier;
import com.osservatorio.common.util.HashUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Multi-tier quota check for one identifier.
 *
 * Order of gates:
 * 1. active block: deny, regardless of quota
 * 2. threat assessment: CRITICAL creates a block and denies; HIGH and MEDIUM
 *    shrink the effective limits
 * 3. adaptive factor from observed response times
 * 4. atomic check-and-increment of every tier in the counter store
 *
 * A denial reports the exhausted tier whose window resets last, so waiting
 * {@code retryAfter} is always enough for every denying tier.
 */
@Slf4j
public class RateLimiter {

    private final RateLimitProperties properties;
    private final CounterStore counterStore;
    private final ThreatAssessor threatAssessor;
    private final AdaptiveLimitController adaptive;
    private final BlockList blockList;
    private final Clock clock;
    private final DecisionCounter decisions = new DecisionCounter();

    public RateLimiter(RateLimitProperties properties,
                       CounterStore counterStore,
                       ThreatAssessor threatAssessor,
                       AdaptiveLimitController adaptive,
                       BlockList blockList,
                       Clock clock) {
        this.properties = properties;
        this.counterStore = counterStore;
        this.threatAssessor = threatAssessor;
        this.adaptive = adaptive;
        this.blockList = blockList;
        this.clock = clock;
    }

    public RateLimitDecision check(String identifier, String endpoint) {
        return check(identifier, endpoint, properties.getDefaultScope());
    }

    public RateLimitDecision check(String identifier, String endpoint, String scope) {
        ValidationException.requireNonBlank(identifier, "identifier");
        Instant now = clock.instant();

        Optional<BlockEntry> block = blockList.activeBlock(identifier);
        if (block.isPresent()) {
            return record(blocked(identifier, scope, block.get(), ThreatLevel.CRITICAL));
        }

        ThreatAssessment threat = threatAssessor.assess(identifier);
        if (threat.getLevel() == ThreatLevel.CRITICAL) {
            String reason = String.format("Critical threat score %.2f %s", threat.getScore(), threat.getEvidence());
            BlockEntry entry = blockList.block(identifier, reason, properties.getThreat().getBlockDuration());
            return record(blocked(identifier, scope, entry, threat.getLevel()));
        }

        double factor = effectiveFactor(identifier, threat.getLevel());
        RateLimitProfile profile = properties.profile(scope).scaled(factor);
        long nowMillis = now.toEpochMilli();
        CounterAcquisition acquisition = counterStore.tryAcquire(identifier, profile.getLimits(), nowMillis);

        if (acquisition.isAcquired()) {
            WindowUsage tightest = acquisition.tightest().orElseThrow();
            return record(RateLimitDecision.builder()
                    .allowed(true)
                    .identifier(identifier)
                    .scope(profile.getName())
                    .tier(tightest.getTier())
                    .limit(tightest.getLimit())
                    .remaining(tightest.remaining())
                    .resetAt(Instant.ofEpochMilli(tightest.getWindowEndMillis()))
                    .threatLevel(threat.getLevel())
                    .effectiveFactor(factor)
                    .build());
        }

        WindowUsage binding = acquisition.bindingDenial()
                .orElseGet(() -> acquisition.tightest().orElseThrow());
        long waitMillis = Math.max(1L, binding.getWindowEndMillis() - nowMillis);
        log.debug("[RATE_LIMIT] Denied | identifier={} | endpoint={} | tier={} | limit={} | retryAfterMs={}",
                HashUtils.mask(identifier), endpoint, binding.getTier(), binding.getLimit(), waitMillis);
        return record(RateLimitDecision.builder()
                .allowed(false)
                .identifier(identifier)
                .scope(profile.getName())
                .tier(binding.getTier())
                .limit(binding.getLimit())
                .remaining(0)
                .resetAt(Instant.ofEpochMilli(binding.getWindowEndMillis()))
                .retryAfter(Duration.ofMillis(waitMillis))
                .reason(DenyReason.QUOTA)
                .threatLevel(threat.getLevel())
                .effectiveFactor(factor)
                .build());
    }

    public void recordResponseTime(String identifier, String endpoint, Duration responseTime) {
        adaptive.recordResponseTime(identifier, endpoint, responseTime);
    }

    /**
     * How many calls the identifier may have in flight at once: the configured
     * maximum, reduced to the current effective burst limit.
     */
    public int maxConcurrency(String identifier) {
        return maxConcurrency(identifier, properties.getDefaultScope());
    }

    public int maxConcurrency(String identifier, String scope) {
        ThreatLevel level = threatAssessor.assess(identifier).getLevel();
        RateLimitProfile profile = properties.profile(scope).scaled(effectiveFactor(identifier, level));
        return Math.max(1, Math.min(properties.getMaxConcurrency(), profile.limit(RateTier.BURST)));
    }

    /**
     * Current per-tier usage against the effective limits, without consuming quota.
     */
    public Map<RateTier, WindowUsage> usage(String identifier, String scope) {
        ThreatLevel level = threatAssessor.assess(identifier).getLevel();
        RateLimitProfile profile = properties.profile(scope).scaled(effectiveFactor(identifier, level));
        return counterStore.usage(identifier, profile.getLimits(), clock.millis());
    }

    public BlockEntry block(String identifier, String reason, Duration duration) {
        return blockList.block(identifier, reason, duration);
    }

    public boolean unblock(String identifier) {
        return blockList.unblock(identifier);
    }

    public void reset(String identifier) {
        counterStore.reset(identifier);
        adaptive.reset(identifier);
    }

    /**
     * Drop expired blocks, stale windows and identifiers back at nominal limits.
     */
    public int purgeExpired() {
        int blocks = blockList.purgeExpired();
        int windows = counterStore.purgeStale(clock.millis());
        int recovered = adaptive.purgeRecovered();
        if (blocks + windows + recovered > 0) {
            log.info("[RATE_LIMIT] Purged | expiredBlocks={} | staleWindows={} | recoveredIdentifiers={}",
                    blocks, windows, recovered);
        }
        return blocks + windows + recovered;
    }

    public RateLimiterStatus status() {
        long[] counts = decisions.snapshot(clock.millis());
        return RateLimiterStatus.builder()
                .backend(counterStore.name())
                .backendHealthy(counterStore.isHealthy())
                .allowed(counts[0])
                .denied(counts[1])
                .blockedDenials(counts[2])
                .activeBlocks(blockList.activeBlocks().size())
                .adaptivelyThrottled(adaptive.throttledIdentifiers())
                .averageResponseTimeMs(adaptive.overallAverageMs())
                .threatLevels(threatAssessor.levelCounts())
                .build();
    }

    private double effectiveFactor(String identifier, ThreatLevel level) {
        double factor = adaptive.factor(identifier);
        if (level == ThreatLevel.HIGH) {
            factor *= properties.getThreat().getHighFactor();
        } else if (level == ThreatLevel.MEDIUM) {
            factor *= properties.getThreat().getMediumFactor();
        }
        return factor;
    }

    private RateLimitDecision blocked(String identifier, String scope, BlockEntry entry, ThreatLevel level) {
        Instant now = clock.instant();
        Duration wait = Duration.between(now, entry.getExpiresAt());
        return RateLimitDecision.builder()
                .allowed(false)
                .identifier(identifier)
                .scope(scope)
                .remaining(0)
                .resetAt(entry.getExpiresAt())
                .retryAfter(wait.isNegative() ? Duration.ZERO : wait)
                .reason(DenyReason.BLOCKED)
                .blockReason(entry.getReason())
                .blockExpiresAt(entry.getExpiresAt())
                .threatLevel(level)
                .effectiveFactor(0.0)
                .build();
    }

    private RateLimitDecision record(RateLimitDecision decision) {
        decisions.record(decision, clock.millis());
        return decision;
    }

    /**
     * Allowed / denied / blocked counts for the current minute.
     */
    private static final class DecisionCounter {
        private long minute = -1;
        private long allowed;
        private long denied;
        private long blocked;

        synchronized void record(RateLimitDecision decision, long nowMillis) {
            roll(nowMillis);
            if (decision.isAllowed()) {
                allowed++;
            } else {
                denied++;
                if (decision.isBlocked()) {
                    blocked++;
                }
            }
        }

        synchronized long[] snapshot(long nowMillis) {
            roll(nowMillis);
            return new long[] {allowed, denied, blocked};
        }

        private void roll(long nowMillis) {
            long current = RateTier.MINUTE.windowStartMillis(nowMillis);
            if (current != minute) {
                minute = current;
                allowed = 0;
                denied = 0;
                blocked = 0;
            }
        }
    }
}
