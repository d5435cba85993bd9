package com.osservatorio.app.service;

import com.osservatorio.client.ratelimit.RateLimiter;
import com.osservatorio.client.ratelimit.RateLimiterStatus;
import com.osservatorio.client.threat.ThreatScorer;
import com.osservatorio.core.cache.ResponseCache;
import com.osservatorio.core.client.ClientMetrics;
import com.osservatorio.core.client.ResilientApiClient;
import com.osservatorio.core.config.StoreProperties;
import com.osservatorio.core.repository.RepositoryStatus;
import com.osservatorio.core.repository.UnifiedRepository;
import com.osservatorio.data.metadata.MetadataStoreAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.function.IntSupplier;

/**
 * Periodic housekeeping: expired blocks, stale rate windows, idle threat
 * profiles, expired cache entries and audit rows past retention. Also logs the
 * security and health summary.
 *
 * Every task catches its own failure so one broken store does not stop the
 * others; the next run tries again.
 */
@Service
@ConditionalOnProperty(name = "osservatorio.maintenance.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MaintenanceService {

    private final RateLimiter rateLimiter;
    private final ThreatScorer threatScorer;
    private final ResponseCache responseCache;
    private final MetadataStoreAdapter metadataStore;
    private final UnifiedRepository repository;
    private final ResilientApiClient apiClient;
    private final StoreProperties storeProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${osservatorio.maintenance.cleanup-interval-ms:300000}", initialDelay = 60000)
    public void cleanup() {
        long started = System.currentTimeMillis();
        int limiter = run("rateLimiter", rateLimiter::purgeExpired);
        int threats = run("threatProfiles", threatScorer::purgeIdle);
        int cache = run("responseCache", responseCache::purgeExpired);
        int audit = run("auditLog", () -> metadataStore.purgeAuditOlderThan(
                clock.instant().minus(storeProperties.getAuditRetention())));
        log.info("[MAINTENANCE] Cleanup finished | limiterRows={} | threatProfiles={} | cacheRows={} | auditRows={} | durationMs={}",
                limiter, threats, cache, audit, System.currentTimeMillis() - started);
    }

    @Scheduled(fixedDelayString = "${osservatorio.maintenance.report-interval-ms:60000}", initialDelay = 30000)
    public void report() {
        try {
            RepositoryStatus status = repository.status();
            RateLimiterStatus limiter = status.getRateLimiter();
            ClientMetrics client = apiClient.metrics();
            log.info("[MAINTENANCE] Status | mode={} | client={} | requests={} | failed={} | cacheHits={} | stale={}",
                    status.getMode(), client.getStatus(), client.getTotalRequests(), client.getFailedRequests(),
                    client.getCacheHits(), client.getStaleResponses());
            log.info("[MAINTENANCE] Security | backend={} | healthy={} | allowed={} | denied={} | blocks={} | throttled={} | threatLevels={}",
                    limiter.getBackend(), limiter.isBackendHealthy(), limiter.getAllowed(), limiter.getDenied(),
                    limiter.getActiveBlocks(), limiter.getAdaptivelyThrottled(), limiter.getThreatLevels());
        } catch (RuntimeException e) {
            log.warn("[MAINTENANCE] Status report failed | error={}", e.getMessage());
        }
    }

    private int run(String task, IntSupplier action) {
        try {
            return action.getAsInt();
        } catch (RuntimeException e) {
            log.warn("[MAINTENANCE] Cleanup task failed | task={} | error={}", task, e.getMessage());
            return 0;
        }
    }
}
