package com.osservatorio.core.persistence;

import com.osservatorio.client.ratelimit.BlockEntry;
import com.osservatorio.common.exception.PersistenceException;
import com.osservatorio.common.model.Subsystem;
import com.osservatorio.data.entity.BlockEntryEntity;
import com.osservatorio.data.metadata.AuditEntry;
import com.osservatorio.data.metadata.MetadataStoreAdapter;
import com.osservatorio.data.repository.BlockEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PersistentBlockStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private BlockEntryRepository repository;
    private MetadataStoreAdapter metadataStore;
    private PersistentBlockStore store;

    @BeforeEach
    void setUp() {
        repository = mock(BlockEntryRepository.class);
        metadataStore = mock(MetadataStoreAdapter.class);
        store = new PersistentBlockStore(repository, metadataStore);
    }

    @Test
    void blockIsSavedAndAudited() {
        store.save(new BlockEntry("192.168.1.20", "critical threat score", NOW, NOW.plusSeconds(86_400)));

        ArgumentCaptor<BlockEntryEntity> saved = ArgumentCaptor.forClass(BlockEntryEntity.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getIdentifier()).isEqualTo("192.168.1.20");

        ArgumentCaptor<AuditEntry> audit = ArgumentCaptor.forClass(AuditEntry.class);
        verify(metadataStore).logAudit(audit.capture());
        assertThat(audit.getValue().getAction()).isEqualTo("security_block");
        assertThat(audit.getValue().getResourceId()).startsWith("addr:").doesNotContain("192.168");
        assertThat(audit.getValue().getDetails()).containsEntry("reason", "critical threat score");
    }

    @Test
    void longReasonsAreTruncated() {
        store.save(new BlockEntry("client-1", "x".repeat(1_500), NOW, NOW.plusSeconds(60)));

        ArgumentCaptor<BlockEntryEntity> saved = ArgumentCaptor.forClass(BlockEntryEntity.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getReason()).hasSize(1_000);
    }

    @Test
    void auditFailureDoesNotUndoTheBlock() {
        doThrow(new PersistenceException(Subsystem.METADATA, "down")).when(metadataStore).logAudit(any());

        store.save(new BlockEntry("client-1", "manual", NOW, NOW.plusSeconds(60)));

        verify(repository).save(any(BlockEntryEntity.class));
    }

    @Test
    void unblockIsAuditedOnlyWhenSomethingWasRemoved() {
        when(repository.existsById("client-1")).thenReturn(true);

        assertThat(store.remove("client-1")).isTrue();
        assertThat(store.remove("client-2")).isFalse();

        verify(repository).deleteById("client-1");
        verify(repository, never()).deleteById("client-2");
        ArgumentCaptor<AuditEntry> audit = ArgumentCaptor.forClass(AuditEntry.class);
        verify(metadataStore).logAudit(audit.capture());
        assertThat(audit.getValue().getAction()).isEqualTo("security_unblock");
    }

    @Test
    void storageFailuresBecomeCounterPersistenceErrors() {
        when(repository.findById("client-1")).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> store.find("client-1"))
                .isInstanceOf(PersistenceException.class)
                .satisfies(e -> assertThat(((PersistenceException) e).getSubsystem()).isEqualTo(Subsystem.COUNTERS));
    }
}
