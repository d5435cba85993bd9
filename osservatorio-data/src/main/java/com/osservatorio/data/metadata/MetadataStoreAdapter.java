package com.osservatorio.data.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.osservatorio.common.exception.PersistenceException;
import com.osservatorio.common.exception.ValidationException;
import com.osservatorio.common.model.DatasetStatus;
import com.osservatorio.common.model.Subsystem;
import com.osservatorio.data.entity.ApiCredential;
import com.osservatorio.data.entity.AuditRecord;
import com.osservatorio.data.entity.DatasetRecord;
import com.osservatorio.data.repository.ApiCredentialRepository;
import com.osservatorio.data.repository.AuditRecordRepository;
import com.osservatorio.data.repository.DatasetRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Transactional access to the dataset registry, API credentials and the audit log.
 *
 * Every public operation runs in its own short transaction and translates data
 * access failures into {@link PersistenceException} tagged {@link Subsystem#METADATA},
 * so the repository facade can degrade the subsystem instead of leaking
 * persistence-provider exceptions. Datasets are never hard-deleted.
 */
@Component
@Slf4j
public class MetadataStoreAdapter {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final DatasetRecordRepository datasetRepository;
    private final AuditRecordRepository auditRepository;
    private final ApiCredentialRepository credentialRepository;
    private final TransactionTemplate transactionTemplate;
    private final PasswordEncoder passwordEncoder;
    private final ObjectMapper objectMapper;

    public MetadataStoreAdapter(DatasetRecordRepository datasetRepository,
                                AuditRecordRepository auditRepository,
                                ApiCredentialRepository credentialRepository,
                                @Qualifier("transactionManager") PlatformTransactionManager transactionManager,
                                PasswordEncoder passwordEncoder,
                                ObjectMapper objectMapper) {
        this.datasetRepository = datasetRepository;
        this.auditRepository = auditRepository;
        this.credentialRepository = credentialRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(10);
        this.passwordEncoder = passwordEncoder;
        this.objectMapper = objectMapper;
    }

    // ---------------------------------------------------------------------
    // Dataset registry
    // ---------------------------------------------------------------------

    /**
     * Insert or re-sync a dataset row with the given status. Re-registering an
     * existing dataset updates its descriptor and clears any previous failure.
     */
    public DatasetInfo registerDataset(DatasetDescriptor descriptor, DatasetStatus status) {
        ValidationException.requireNonBlank(descriptor.getDatasetId(), "datasetId");
        ValidationException.requireNonBlank(descriptor.getName(), "name");

        return inTransaction("registerDataset", () -> {
            DatasetRecord record = datasetRepository.findById(descriptor.getDatasetId())
                    .orElseGet(() -> DatasetRecord.builder().datasetId(descriptor.getDatasetId()).build());

            record.setName(descriptor.getName());
            record.setCategory(descriptor.getCategory());
            record.setDescription(descriptor.getDescription());
            record.setAgency(descriptor.getAgency());
            record.setPriority(descriptor.getPriority());
            record.setMetadataJson(toJson(descriptor.getMetadata()));
            record.setStatus(status);
            record.setFailureReason(null);

            DatasetRecord saved = datasetRepository.saveAndFlush(record);
            log.info("[METADATA] Dataset registered | datasetId={} | status={}", saved.getDatasetId(), status);
            return toInfo(saved);
        });
    }

    public DatasetInfo markActive(String datasetId, long recordCount, String batchId) {
        return updateDataset("markActive", datasetId, record -> {
            record.setStatus(DatasetStatus.ACTIVE);
            record.setRecordCount(recordCount);
            record.setLastBatchId(batchId);
            record.setFailureReason(null);
        });
    }

    public DatasetInfo markFailed(String datasetId, String reason) {
        return updateDataset("markFailed", datasetId, record -> {
            record.setStatus(DatasetStatus.FAILED);
            record.setRecordCount(0L);
            record.setFailureReason(truncate(reason, 1000));
        });
    }

    /**
     * Return a dataset to a batch that was active before a failed re-sync. The
     * failure stays visible in the failure reason.
     */
    public DatasetInfo restoreActive(String datasetId, long recordCount, String batchId, String reason) {
        return updateDataset("restoreActive", datasetId, record -> {
            record.setStatus(DatasetStatus.ACTIVE);
            record.setRecordCount(recordCount);
            record.setLastBatchId(batchId);
            record.setFailureReason(truncate("Re-sync failed: " + reason, 1000));
        });
    }

    public DatasetInfo updateQualityScore(String datasetId, double qualityScore) {
        if (qualityScore < 0 || qualityScore > 100) {
            throw new ValidationException("qualityScore must be within [0, 100]");
        }
        return updateDataset("updateQualityScore", datasetId, record -> record.setQualityScore(qualityScore));
    }

    /**
     * Soft delete. The row stays for audit and can be re-activated by registering again.
     */
    public DatasetInfo deactivate(String datasetId) {
        return updateDataset("deactivate", datasetId, record -> record.setStatus(DatasetStatus.INACTIVE));
    }

    public Optional<DatasetInfo> findDataset(String datasetId) {
        return read("findDataset", () -> datasetRepository.findById(datasetId).map(this::toInfo));
    }

    /**
     * @param category   optional category filter
     * @param activeOnly restrict to queryable datasets
     */
    public List<DatasetInfo> listDatasets(String category, boolean activeOnly) {
        return read("listDatasets", () -> {
            List<DatasetRecord> rows;
            if (category != null && activeOnly) {
                rows = datasetRepository.findByCategoryAndStatusOrderByPriorityDescNameAsc(category, DatasetStatus.ACTIVE);
            } else if (category != null) {
                rows = datasetRepository.findByCategoryOrderByPriorityDescNameAsc(category);
            } else if (activeOnly) {
                rows = datasetRepository.findByStatusOrderByPriorityDescNameAsc(DatasetStatus.ACTIVE);
            } else {
                rows = datasetRepository.findAllByOrderByPriorityDescNameAsc();
            }
            return rows.stream().map(this::toInfo).toList();
        });
    }

    public MetadataSummary summarize() {
        return read("summarize", () -> {
            Map<DatasetStatus, Long> byStatus = new EnumMap<>(DatasetStatus.class);
            long total = 0;
            for (Object[] row : datasetRepository.countGroupedByStatus()) {
                long count = ((Number) row[1]).longValue();
                byStatus.put((DatasetStatus) row[0], count);
                total += count;
            }
            return MetadataSummary.builder()
                    .totalDatasets(total)
                    .datasetsByStatus(byStatus)
                    .activeCategories(datasetRepository.countCategoriesByStatus(DatasetStatus.ACTIVE))
                    .build();
        });
    }

    // ---------------------------------------------------------------------
    // Audit log
    // ---------------------------------------------------------------------

    public void logAudit(AuditEntry entry) {
        inTransaction("logAudit", () -> auditRepository.save(AuditRecord.builder()
                .actor(entry.getActor())
                .action(entry.getAction())
                .resourceType(entry.getResourceType())
                .resourceId(entry.getResourceId())
                .detailsJson(toJson(entry.getDetails()))
                .success(entry.isSuccess())
                .errorMessage(truncate(entry.getErrorMessage(), 1000))
                .build()));
    }

    public List<AuditEntry> findAudit(String resourceType, String resourceId, int limit) {
        return read("findAudit", () -> {
            PageRequest page = PageRequest.of(0, Math.max(1, limit));
            List<AuditRecord> rows = resourceType == null
                    ? auditRepository.findAllByOrderByCreatedAtDesc(page)
                    : auditRepository.findByResourceTypeAndResourceIdOrderByCreatedAtDesc(resourceType, resourceId, page);
            return rows.stream().map(this::toAuditEntry).toList();
        });
    }

    public int purgeAuditOlderThan(Instant cutoff) {
        return inTransaction("purgeAudit", () -> auditRepository.deleteOlderThan(cutoff));
    }

    // ---------------------------------------------------------------------
    // API credentials
    // ---------------------------------------------------------------------

    /**
     * Store (or rotate) the key for a service. Only the bcrypt hash is persisted.
     */
    public void storeCredential(String serviceName, String rawKey, String endpointUrl,
                                int rateLimit, Instant expiresAt) {
        ValidationException.requireNonBlank(serviceName, "serviceName");
        ValidationException.requireNonBlank(rawKey, "apiKey");

        inTransaction("storeCredential", () -> {
            ApiCredential credential = credentialRepository.findByServiceName(serviceName)
                    .orElseGet(() -> ApiCredential.builder().serviceName(serviceName).build());
            credential.setKeyHash(passwordEncoder.encode(rawKey));
            credential.setEndpointUrl(endpointUrl);
            credential.setRateLimit(rateLimit);
            credential.setExpiresAt(expiresAt);
            credential.setActive(true);
            credentialRepository.save(credential);
            log.info("[METADATA] Credential stored | service={} | expiresAt={}", serviceName, expiresAt);
            return null;
        });
    }

    /**
     * Check a presented key. A match updates usage statistics; expired or
     * inactive credentials never match.
     */
    public boolean verifyCredential(String serviceName, String rawKey) {
        if (serviceName == null || rawKey == null) {
            return false;
        }
        return inTransaction("verifyCredential", () -> {
            Optional<ApiCredential> found = credentialRepository.findByServiceNameAndActiveTrue(serviceName);
            if (found.isEmpty()) {
                return false;
            }
            ApiCredential credential = found.get();
            Instant now = Instant.now();
            if (credential.getExpiresAt() != null && credential.getExpiresAt().isBefore(now)) {
                log.warn("[METADATA] Credential expired | service={}", serviceName);
                return false;
            }
            if (!passwordEncoder.matches(rawKey, credential.getKeyHash())) {
                return false;
            }
            credential.setLastUsed(now);
            credential.setUsageCount(credential.getUsageCount() + 1);
            return true;
        });
    }

    public void revokeCredential(String serviceName) {
        inTransaction("revokeCredential", () -> {
            credentialRepository.findByServiceName(serviceName).ifPresent(c -> c.setActive(false));
            return null;
        });
    }

    /**
     * Cheap liveness check used by the repository health status.
     */
    public void ping() {
        read("ping", datasetRepository::count);
    }

    // ---------------------------------------------------------------------

    private DatasetInfo updateDataset(String operation, String datasetId, Consumer<DatasetRecord> change) {
        return inTransaction(operation, () -> {
            DatasetRecord record = datasetRepository.findById(datasetId)
                    .orElseThrow(() -> new ValidationException("Unknown dataset: " + datasetId));
            change.accept(record);
            DatasetRecord saved = datasetRepository.saveAndFlush(record);
            log.debug("[METADATA] Dataset updated | datasetId={} | operation={} | status={}",
                    datasetId, operation, saved.getStatus());
            return toInfo(saved);
        });
    }

    private <T> T read(String operation, Supplier<T> action) {
        return inTransaction(operation, action);
    }

    private <T> T inTransaction(String operation, Supplier<T> action) {
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (DataAccessException | TransactionException e) {
            log.warn("[METADATA] Operation failed | operation={} | error={}", operation, e.getMessage());
            throw new PersistenceException(Subsystem.METADATA, operation + " failed: " + e.getMessage(), e);
        }
    }

    private DatasetInfo toInfo(DatasetRecord record) {
        return DatasetInfo.builder()
                .datasetId(record.getDatasetId())
                .name(record.getName())
                .category(record.getCategory())
                .description(record.getDescription())
                .agency(record.getAgency())
                .priority(record.getPriority() != null ? record.getPriority() : 0)
                .metadata(fromJson(record.getMetadataJson()))
                .qualityScore(record.getQualityScore())
                .status(record.getStatus())
                .recordCount(record.getRecordCount() != null ? record.getRecordCount() : 0L)
                .failureReason(record.getFailureReason())
                .lastBatchId(record.getLastBatchId())
                .registeredAt(record.getRegisteredAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }

    private AuditEntry toAuditEntry(AuditRecord record) {
        return AuditEntry.builder()
                .actor(record.getActor())
                .action(record.getAction())
                .resourceType(record.getResourceType())
                .resourceId(record.getResourceId())
                .details(fromJson(record.getDetailsJson()))
                .success(Boolean.TRUE.equals(record.getSuccess()))
                .errorMessage(record.getErrorMessage())
                .createdAt(record.getCreatedAt())
                .build();
    }

    private String toJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Metadata is not serializable: " + e.getOriginalMessage());
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[METADATA] Unreadable metadata json, returning empty map | error={}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
