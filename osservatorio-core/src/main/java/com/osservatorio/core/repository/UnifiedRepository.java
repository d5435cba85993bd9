package com.osservatorio.core.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.osservatorio.client.circuit.CircuitBreakerRegistry;
import com.osservatorio.client.ratelimit.RateLimiter;
import com.osservatorio.client.ratelimit.RateLimiterStatus;
import com.osservatorio.common.concurrent.CancellationSignal;
import com.osservatorio.common.exception.PersistenceException;
import com.osservatorio.common.exception.ValidationException;
import com.osservatorio.common.model.DatasetStatus;
import com.osservatorio.common.model.Subsystem;
import com.osservatorio.core.config.StoreProperties;
import com.osservatorio.data.analytics.AnalyticsStoreAdapter;
import com.osservatorio.data.analytics.DatasetStatistics;
import com.osservatorio.data.analytics.ObservationBatch;
import com.osservatorio.data.analytics.TerritoryComparison;
import com.osservatorio.data.analytics.TimeSeriesPoint;
import com.osservatorio.data.metadata.AuditEntry;
import com.osservatorio.data.metadata.DatasetDescriptor;
import com.osservatorio.data.metadata.DatasetInfo;
import com.osservatorio.data.metadata.MetadataStoreAdapter;
import com.osservatorio.data.metadata.MetadataSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single entry point over the metadata store (registry, audit, credentials) and
 * the analytics store (observations).
 *
 * Reads are served from a short-lived cache unless the caller asks for fresh
 * data; every write invalidates the entries of the dataset it touches.
 * A {@link PersistenceException} from either store marks that store degraded,
 * which narrows what the repository accepts (see {@link RepositoryMode}) until a
 * recheck finds the store reachable again.
 *
 * Analytics reads only see the last activated batch of an ACTIVE dataset. While
 * the metadata store is degraded the last activation observed by this process
 * stands in for the registry; a dataset with no observed activation reads as
 * empty.
 */
@Service
@Slf4j
public class UnifiedRepository {

    private static final String RESOURCE_DATASET = "dataset";

    private final MetadataStoreAdapter metadataStore;
    private final AnalyticsStoreAdapter analyticsStore;
    private final CircuitBreakerRegistry breakerRegistry;
    private final RateLimiter rateLimiter;
    private final StoreProperties properties;
    private final Clock clock;
    private final SubsystemHealth metadataHealth;
    private final SubsystemHealth analyticsHealth;
    private final Cache<String, Object> readCache;
    private final Cache<String, DatasetInfo> lastActivated;
    private final LoadingCache<String, ReentrantLock> compositeLocks = Caffeine.newBuilder()
            .weakValues()
            .build(datasetId -> new ReentrantLock());

    public UnifiedRepository(MetadataStoreAdapter metadataStore,
                             AnalyticsStoreAdapter analyticsStore,
                             CircuitBreakerRegistry breakerRegistry,
                             RateLimiter rateLimiter,
                             StoreProperties properties,
                             Clock clock) {
        this.metadataStore = metadataStore;
        this.analyticsStore = analyticsStore;
        this.breakerRegistry = breakerRegistry;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.clock = clock;
        this.metadataHealth = new SubsystemHealth(Subsystem.METADATA, metadataStore::ping,
                properties.getRecheckInterval(), clock);
        this.analyticsHealth = new SubsystemHealth(Subsystem.ANALYTICS, analyticsStore::ping,
                properties.getRecheckInterval(), clock);
        this.readCache = Caffeine.newBuilder()
                .maximumSize(properties.getReadCacheMaxEntries())
                .expireAfterWrite(properties.getReadCacheTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
        this.lastActivated = Caffeine.newBuilder()
                .maximumSize(properties.getTrackedDatasets())
                .build();
    }

    // ---------------------------------------------------------------------
    // Composite
    // ---------------------------------------------------------------------

    /**
     * Register a dataset and load its observations as one unit.
     *
     * The registry row is written first with status LOADING, then the batch is
     * loaded into the analytics store, then the row is marked ACTIVE. A failure
     * or cancellation after the first write removes the batch's observations and
     * rethrows; the dataset is marked FAILED, or, when it was ACTIVE before,
     * returned to its previous batch with the failure recorded. A successful
     * re-sync replaces the observations of the previous batch. Calls for the same
     * dataset run one at a time.
     *
     * @throws PersistenceException  a store failed; the subsystem says which
     * @throws CancellationException the signal was cancelled before completion
     */
    public DatasetInfo registerAndLoad(DatasetDescriptor descriptor, ObservationBatch batch,
                                       CancellationSignal cancellation) {
        String datasetId = descriptor.getDatasetId();
        ValidationException.requireNonBlank(datasetId, "datasetId");
        if (!datasetId.equals(batch.getDatasetId())) {
            throw new ValidationException("Batch belongs to dataset " + batch.getDatasetId() + ", not " + datasetId);
        }
        metadataHealth.requireAvailable();
        analyticsHealth.requireAvailable();
        cancellation.throwIfCancelled("dataset registration");

        ReentrantLock lock = compositeLocks.get(datasetId);
        lock.lock();
        try {
            return registerAndLoadLocked(descriptor, batch, cancellation);
        } finally {
            lock.unlock();
        }
    }

    private DatasetInfo registerAndLoadLocked(DatasetDescriptor descriptor, ObservationBatch batch,
                                              CancellationSignal cancellation) {
        String datasetId = descriptor.getDatasetId();
        long started = System.currentTimeMillis();
        DatasetInfo previous = lookupDataset(datasetId).orElse(null);
        String previousBatch = previous != null ? previous.getLastBatchId() : null;
        metadata(() -> metadataStore.registerDataset(descriptor, DatasetStatus.LOADING));
        lastActivated.invalidate(datasetId);
        invalidate(datasetId);

        DatasetInfo active;
        try {
            cancellation.throwIfCancelled("analytics load");
            int rows = analytics(() -> analyticsStore.loadBatch(batch, cancellation));
            cancellation.throwIfCancelled("dataset activation");
            active = metadata(() -> metadataStore.markActive(datasetId, rows, batch.getBatchId()));
        } catch (RuntimeException e) {
            compensate(datasetId, batch.getBatchId(), previous, e);
            invalidate(datasetId);
            audit(AuditEntry.builder()
                    .action("register_and_load")
                    .resourceType(RESOURCE_DATASET)
                    .resourceId(datasetId)
                    .details(Map.of("batchId", batch.getBatchId(), "rows", batch.size()))
                    .success(false)
                    .errorMessage(e.getMessage())
                    .build());
            throw e;
        }
        remember(active);

        if (previousBatch != null && !previousBatch.equals(batch.getBatchId())) {
            removeReplacedBatch(datasetId, previousBatch);
        }
        invalidate(datasetId);
        audit(AuditEntry.builder()
                .action("register_and_load")
                .resourceType(RESOURCE_DATASET)
                .resourceId(datasetId)
                .details(Map.of("batchId", batch.getBatchId(), "rows", active.getRecordCount()))
                .build());
        log.info("[REPOSITORY] Dataset registered and loaded | datasetId={} | batchId={} | rows={} | durationMs={}",
                datasetId, batch.getBatchId(), active.getRecordCount(), System.currentTimeMillis() - started);
        return active;
    }

    // ---------------------------------------------------------------------
    // Metadata
    // ---------------------------------------------------------------------

    /**
     * Register or update a dataset's descriptor without loading data. An existing
     * dataset keeps its status; a new one starts INACTIVE.
     */
    public DatasetInfo registerDataset(DatasetDescriptor descriptor) {
        ValidationException.requireNonBlank(descriptor.getDatasetId(), "datasetId");
        DatasetStatus status = metadata(() -> metadataStore.findDataset(descriptor.getDatasetId()))
                .map(DatasetInfo::getStatus)
                .orElse(DatasetStatus.INACTIVE);
        DatasetInfo info = metadata(() -> metadataStore.registerDataset(descriptor, status));
        remember(info);
        invalidate(descriptor.getDatasetId());
        audit(AuditEntry.builder()
                .action("register")
                .resourceType(RESOURCE_DATASET)
                .resourceId(descriptor.getDatasetId())
                .build());
        return info;
    }

    public Optional<DatasetInfo> getDataset(String datasetId, boolean fresh) {
        return cached("dataset|" + datasetId, fresh, () -> lookupDataset(datasetId));
    }

    /**
     * Metadata merged with analytics statistics. When the analytics store is
     * degraded the metadata is still returned, flagged as analytics unavailable.
     */
    public Optional<DatasetView> getDatasetComplete(String datasetId, boolean fresh) {
        return cached("complete|" + datasetId, fresh, () -> {
            Optional<DatasetInfo> info = lookupDataset(datasetId);
            if (info.isEmpty()) {
                return Optional.<DatasetView>empty();
            }
            DatasetStatistics statistics = null;
            boolean analyticsAvailable = analyticsHealth.checkAvailable(false);
            if (analyticsAvailable && info.get().isQueryable()) {
                String batchId = info.get().getLastBatchId();
                try {
                    statistics = analytics(() -> analyticsStore.getDatasetStatistics(datasetId, batchId));
                } catch (PersistenceException e) {
                    analyticsAvailable = false;
                }
            }
            return Optional.of(DatasetView.builder()
                    .info(info.get())
                    .statistics(statistics)
                    .analyticsAvailable(analyticsAvailable)
                    .build());
        });
    }

    public List<DatasetInfo> listDatasets(String category, boolean activeOnly) {
        return cached("list|" + category + "|" + activeOnly, false,
                () -> metadata(() -> metadataStore.listDatasets(category, activeOnly)));
    }

    public DatasetInfo updateQualityScore(String datasetId, double qualityScore) {
        DatasetInfo info = metadata(() -> metadataStore.updateQualityScore(datasetId, qualityScore));
        invalidate(datasetId);
        return info;
    }

    /**
     * Soft delete: the dataset stops being queryable, its observations stay.
     */
    public DatasetInfo deactivate(String datasetId, String actor) {
        DatasetInfo info = metadata(() -> metadataStore.deactivate(datasetId));
        lastActivated.invalidate(datasetId);
        invalidate(datasetId);
        audit(AuditEntry.builder()
                .actor(actor != null ? actor : "system")
                .action("deactivate")
                .resourceType(RESOURCE_DATASET)
                .resourceId(datasetId)
                .build());
        return info;
    }

    public MetadataSummary summarize() {
        return metadata(metadataStore::summarize);
    }

    public void logAudit(AuditEntry entry) {
        metadata(() -> {
            metadataStore.logAudit(entry);
            return null;
        });
    }

    public List<AuditEntry> findAudit(String resourceType, String resourceId, int limit) {
        return metadata(() -> metadataStore.findAudit(resourceType, resourceId, limit));
    }

    public void storeCredential(String serviceName, String rawKey, String endpointUrl, int rateLimit,
                                Instant expiresAt) {
        metadata(() -> {
            metadataStore.storeCredential(serviceName, rawKey, endpointUrl, rateLimit, expiresAt);
            return null;
        });
        audit(AuditEntry.builder().action("store_credential").resourceType("credential").resourceId(serviceName).build());
    }

    public boolean verifyCredential(String serviceName, String rawKey) {
        return metadata(() -> metadataStore.verifyCredential(serviceName, rawKey));
    }

    public void revokeCredential(String serviceName) {
        metadata(() -> {
            metadataStore.revokeCredential(serviceName);
            return null;
        });
        audit(AuditEntry.builder().action("revoke_credential").resourceType("credential").resourceId(serviceName).build());
    }

    // ---------------------------------------------------------------------
    // Analytics
    // ---------------------------------------------------------------------

    /**
     * @return the active batch's points, empty when the dataset is not queryable
     */
    public List<TimeSeriesPoint> getTimeSeries(String datasetId, String territoryCode, String measureCode,
                                               Integer startYear, Integer endYear, boolean fresh) {
        String key = "series|" + datasetId + "|" + territoryCode + "|" + measureCode + "|" + startYear + "|" + endYear;
        return cached(key, fresh, () -> queryableDataset(datasetId)
                .map(info -> analytics(() -> analyticsStore.getTimeSeries(datasetId, info.getLastBatchId(),
                    territoryCode, measureCode, startYear, endYear)))
                .orElse(List.of()));
    }

    public DatasetStatistics getDatasetStatistics(String datasetId) {
        return queryableDataset(datasetId)
                .map(info -> analytics(() -> analyticsStore.getDatasetStatistics(datasetId, info.getLastBatchId())))
                .orElseGet(() -> DatasetStatistics.empty(datasetId));
    }

    public List<TerritoryComparison> compareTerritories(String datasetId, int year, String measureCode,
                                                        List<String> territoryCodes) {
        return queryableDataset(datasetId)
                .map(info -> analytics(() -> analyticsStore.compareTerritories(datasetId, info.getLastBatchId(),
                    year, measureCode, territoryCodes)))
                .orElse(List.of());
    }

    // ---------------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------------

    /**
     * Recheck degraded stores and report the resulting mode together with breaker
     * and limiter state.
     */
    public RepositoryStatus status() {
        boolean metadataUp = metadataHealth.checkAvailable(true);
        boolean analyticsUp = analyticsHealth.checkAvailable(true);

        Map<Subsystem, SubsystemStatus> subsystems = new EnumMap<>(Subsystem.class);
        subsystems.put(Subsystem.METADATA, metadataHealth.toStatus());
        subsystems.put(Subsystem.ANALYTICS, analyticsHealth.toStatus());

        RateLimiterStatus limiter = rateLimiter.status();
        RepositoryMode mode = RepositoryMode.of(metadataUp, analyticsUp);
        if (mode != RepositoryMode.FULL) {
            log.warn("[REPOSITORY] Running degraded | mode={}", mode);
        }
        return RepositoryStatus.builder()
                .mode(mode)
                .subsystems(subsystems)
                .circuits(breakerRegistry.stats())
                .rateLimiter(limiter)
                .rateLimiterSaturation(limiter.saturation())
                .checkedAt(clock.instant())
                .build();
    }

    public RepositoryMode mode() {
        return RepositoryMode.of(metadataHealth.isHealthy(), analyticsHealth.isHealthy());
    }

    /**
     * Drop every cached read.
     */
    public void clearReadCache() {
        readCache.invalidateAll();
    }

    // ---------------------------------------------------------------------

    private <T> T metadata(Supplier<T> operation) {
        metadataHealth.requireAvailable();
        try {
            return operation.get();
        } catch (PersistenceException e) {
            metadataHealth.markDegraded(e);
            throw e;
        }
    }

    private <T> T analytics(Supplier<T> operation) {
        analyticsHealth.requireAvailable();
        try {
            return operation.get();
        } catch (PersistenceException e) {
            analyticsHealth.markDegraded(e);
            throw e;
        }
    }

    private Optional<DatasetInfo> lookupDataset(String datasetId) {
        Optional<DatasetInfo> info = metadata(() -> metadataStore.findDataset(datasetId));
        info.ifPresentOrElse(this::remember, () -> lastActivated.invalidate(datasetId));
        return info;
    }

    private void remember(DatasetInfo info) {
        if (info.isQueryable()) {
            lastActivated.put(info.getDatasetId(), info);
        } else {
            lastActivated.invalidate(info.getDatasetId());
        }
    }

    /**
     * The dataset if analytics reads may see it. Falls back to the last observed
     * activation while the metadata store cannot be read.
     */
    private Optional<DatasetInfo> queryableDataset(String datasetId) {
        if (metadataHealth.checkAvailable(false)) {
            try {
                return lookupDataset(datasetId).filter(DatasetInfo::isQueryable);
            } catch (PersistenceException e) {
                log.debug("[REPOSITORY] Dataset status unreadable, using last activation | datasetId={}", datasetId);
            }
        }
        return Optional.ofNullable(lastActivated.getIfPresent(datasetId));
    }

    private void compensate(String datasetId, String batchId, DatasetInfo previous, RuntimeException cause) {
        log.error("[REPOSITORY] Registration failed, compensating | datasetId={} | batchId={} | error={}",
                datasetId, batchId, cause.getMessage());
        try {
            analyticsStore.deleteBatch(datasetId, batchId);
        } catch (RuntimeException e) {
            markIfPersistence(analyticsHealth, e);
            log.error("[REPOSITORY] Compensation incomplete, observations of the batch may remain | datasetId={} | batchId={} | error={}",
                    datasetId, batchId, e.getMessage());
        }
        String reason = cause instanceof CancellationException
                ? "Cancelled: " + cause.getMessage()
                : Objects.toString(cause.getMessage(), cause.getClass().getSimpleName());
        boolean restorable = previous != null && previous.isQueryable()
                && previous.getLastBatchId() != null && !previous.getLastBatchId().equals(batchId);
        try {
            if (restorable) {
                DatasetInfo restored = metadataStore.restoreActive(datasetId, previous.getRecordCount(),
                        previous.getLastBatchId(), reason);
                remember(restored);
                log.warn("[REPOSITORY] Re-sync failed, previous batch kept active | datasetId={} | batchId={}",
                        datasetId, previous.getLastBatchId());
            } else {
                metadataStore.markFailed(datasetId, reason);
            }
        } catch (RuntimeException e) {
            markIfPersistence(metadataHealth, e);
            log.error("[REPOSITORY] Compensation incomplete, dataset left in LOADING | datasetId={} | error={}",
                    datasetId, e.getMessage());
        }
    }

    private void removeReplacedBatch(String datasetId, String previousBatch) {
        try {
            int removed = analyticsStore.deleteBatch(datasetId, previousBatch);
            log.info("[REPOSITORY] Replaced batch removed | datasetId={} | batchId={} | rows={}",
                    datasetId, previousBatch, removed);
        } catch (RuntimeException e) {
            markIfPersistence(analyticsHealth, e);
            log.warn("[REPOSITORY] Replaced batch not removed | datasetId={} | batchId={} | error={}",
                    datasetId, previousBatch, e.getMessage());
        }
    }

    private void audit(AuditEntry entry) {
        if (!metadataHealth.isHealthy()) {
            log.warn("[REPOSITORY] Audit entry dropped, metadata store degraded | action={} | resourceId={}",
                    entry.getAction(), entry.getResourceId());
            return;
        }
        try {
            metadataStore.logAudit(entry);
        } catch (RuntimeException e) {
            log.warn("[REPOSITORY] Audit entry not written | action={} | resourceId={} | error={}",
                    entry.getAction(), entry.getResourceId(), e.getMessage());
        }
    }

    private static void markIfPersistence(SubsystemHealth health, RuntimeException e) {
        if (e instanceof PersistenceException) {
            health.markDegraded(e);
        }
    }

    // each key prefix always maps to the same value type
    @SuppressWarnings("unchecked")
    private <T> T cached(String key, boolean fresh, Supplier<T> loader) {
        if (!fresh) {
            Object hit = readCache.getIfPresent(key);
            if (hit != null) {
                return (T) hit;
            }
        }
        T value = loader.get();
        if (value != null) {
            readCache.put(key, value);
        }
        return value;
    }

    private void invalidate(String datasetId) {
        readCache.asMap().keySet().removeIf(key -> key.startsWith("list|") || key.split("\\|")[1].equals(datasetId));
    }
}
