package com.osservatorio.core.persistence;

import com.osservatorio.client.ratelimit.BlockEntry;
import com.osservatorio.client.ratelimit.BlockStore;
import com.osservatorio.common.exception.PersistenceException;
import com.osservatorio.common.model.Subsystem;
import com.osservatorio.common.util.HashUtils;
import com.osservatorio.data.entity.BlockEntryEntity;
import com.osservatorio.data.metadata.AuditEntry;
import com.osservatorio.data.metadata.MetadataStoreAdapter;
import com.osservatorio.data.repository.BlockEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Blocks in the {@code block_entries} table. Every block and unblock is also
 * written to the audit log; a failed audit write does not undo the block.
 */
@RequiredArgsConstructor
@Slf4j
public class PersistentBlockStore implements BlockStore {

    private static final String RESOURCE_TYPE = "identifier";

    private final BlockEntryRepository repository;
    private final MetadataStoreAdapter metadataStore;

    @Override
    public Optional<BlockEntry> find(String identifier) {
        return translate(() -> repository.findById(identifier).map(PersistentBlockStore::toEntry));
    }

    @Override
    public void save(BlockEntry entry) {
        translate(() -> repository.save(BlockEntryEntity.builder()
                .identifier(entry.getIdentifier())
                .reason(truncate(entry.getReason()))
                .createdAt(entry.getCreatedAt())
                .expiresAt(entry.getExpiresAt())
                .build()));
        audit(AuditEntry.builder()
                .action("security_block")
                .resourceType(RESOURCE_TYPE)
                .resourceId(HashUtils.mask(entry.getIdentifier()))
                .details(Map.of("reason", String.valueOf(entry.getReason()), "expiresAt", entry.getExpiresAt().toString()))
                .build());
    }

    @Override
    public boolean remove(String identifier) {
        boolean removed = translate(() -> {
            if (!repository.existsById(identifier)) {
                return false;
            }
            repository.deleteById(identifier);
            return true;
        });
        if (removed) {
            audit(AuditEntry.builder()
                    .action("security_unblock")
                    .resourceType(RESOURCE_TYPE)
                    .resourceId(HashUtils.mask(identifier))
                    .build());
        }
        return removed;
    }

    @Override
    public List<BlockEntry> active(Instant now) {
        return translate(() -> repository.findByExpiresAtAfter(now).stream()
                .map(PersistentBlockStore::toEntry)
                .toList());
    }

    @Override
    public int purgeExpired(Instant now) {
        return translate(() -> repository.deleteExpired(now));
    }

    private void audit(AuditEntry entry) {
        try {
            metadataStore.logAudit(entry);
        } catch (RuntimeException e) {
            log.warn("[RATE_LIMIT] Block audit not written | action={} | error={}", entry.getAction(), e.getMessage());
        }
    }

    private static BlockEntry toEntry(BlockEntryEntity entity) {
        return new BlockEntry(entity.getIdentifier(), entity.getReason(), entity.getCreatedAt(), entity.getExpiresAt());
    }

    private static String truncate(String reason) {
        return reason != null && reason.length() > 1000 ? reason.substring(0, 1000) : reason;
    }

    private static <T> T translate(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new PersistenceException(Subsystem.COUNTERS, "Block store failed: " + e.getMessage(), e);
        }
    }
}
