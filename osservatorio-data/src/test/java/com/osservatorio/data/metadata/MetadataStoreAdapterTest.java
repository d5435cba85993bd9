package com.osservatorio.data.metadata;

import com.osservatorio.common.exception.ValidationException;
import com.osservatorio.common.model.DatasetStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({MetadataStoreAdapter.class, MetadataStoreConfig.class})
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@TestPropertySource(properties = "osservatorio.store.credential-hash-strength=4")
class MetadataStoreAdapterTest {

    @Autowired
    private MetadataStoreAdapter adapter;

    private DatasetDescriptor descriptor(String id, String category, int priority) {
        return DatasetDescriptor.builder()
                .datasetId(id)
                .name("Dataset " + id)
                .category(category)
                .description("Test dataset")
                .priority(priority)
                .metadata(Map.of("source", "istat", "frequency", "A"))
                .build();
    }

    @Test
    void registeredDatasetStartsLoadingAndBecomesActive() {
        DatasetInfo loading = adapter.registerDataset(descriptor("101_12", "popolazione", 9), DatasetStatus.LOADING);

        assertThat(loading.getStatus()).isEqualTo(DatasetStatus.LOADING);
        assertThat(loading.isQueryable()).isFalse();
        assertThat(loading.getMetadata()).containsEntry("source", "istat");

        DatasetInfo active = adapter.markActive("101_12", 250, "batch-1");

        assertThat(active.getStatus()).isEqualTo(DatasetStatus.ACTIVE);
        assertThat(active.getRecordCount()).isEqualTo(250);
        assertThat(active.getLastBatchId()).isEqualTo("batch-1");
        assertThat(adapter.findDataset("101_12")).get()
                .extracting(DatasetInfo::isQueryable).isEqualTo(true);
    }

    @Test
    void markFailedRecordsReasonAndResetsCount() {
        adapter.registerDataset(descriptor("22_289", "economia", 5), DatasetStatus.LOADING);

        DatasetInfo failed = adapter.markFailed("22_289", "analytics load timed out");

        assertThat(failed.getStatus()).isEqualTo(DatasetStatus.FAILED);
        assertThat(failed.getFailureReason()).isEqualTo("analytics load timed out");
        assertThat(failed.getRecordCount()).isZero();
    }

    @Test
    void restoreActiveReturnsToThePreviousBatchAndKeepsTheFailure() {
        adapter.registerDataset(descriptor("22_289", "economia", 5), DatasetStatus.LOADING);
        adapter.markActive("22_289", 120, "batch-1");
        adapter.registerDataset(descriptor("22_289", "economia", 5), DatasetStatus.LOADING);

        DatasetInfo restored = adapter.restoreActive("22_289", 120, "batch-1", "disk full");

        assertThat(restored.getStatus()).isEqualTo(DatasetStatus.ACTIVE);
        assertThat(restored.getRecordCount()).isEqualTo(120);
        assertThat(restored.getLastBatchId()).isEqualTo("batch-1");
        assertThat(restored.getFailureReason()).isEqualTo("Re-sync failed: disk full");
    }

    @Test
    void reRegisteringClearsFailureAndUpdatesDescriptor() {
        adapter.registerDataset(descriptor("22_289", "economia", 5), DatasetStatus.LOADING);
        adapter.markFailed("22_289", "boom");

        DatasetInfo again = adapter.registerDataset(
                descriptor("22_289", "economia", 5).toBuilder().name("Renamed").build(), DatasetStatus.LOADING);

        assertThat(again.getName()).isEqualTo("Renamed");
        assertThat(again.getFailureReason()).isNull();
        assertThat(again.getStatus()).isEqualTo(DatasetStatus.LOADING);
    }

    @Test
    void deactivateIsASoftDelete() {
        adapter.registerDataset(descriptor("a", "lavoro", 5), DatasetStatus.LOADING);
        adapter.markActive("a", 10, "b1");

        adapter.deactivate("a");

        assertThat(adapter.findDataset("a")).get()
                .extracting(DatasetInfo::getStatus).isEqualTo(DatasetStatus.INACTIVE);
        assertThat(adapter.listDatasets(null, true)).isEmpty();
        assertThat(adapter.listDatasets(null, false)).hasSize(1);
    }

    @Test
    void listFiltersByCategoryAndOrdersByPriority() {
        adapter.registerDataset(descriptor("low", "lavoro", 1), DatasetStatus.LOADING);
        adapter.registerDataset(descriptor("high", "lavoro", 9), DatasetStatus.LOADING);
        adapter.registerDataset(descriptor("other", "territorio", 5), DatasetStatus.LOADING);
        adapter.markActive("low", 1, "b");
        adapter.markActive("high", 1, "b");

        List<DatasetInfo> lavoro = adapter.listDatasets("lavoro", true);

        assertThat(lavoro).extracting(DatasetInfo::getDatasetId).containsExactly("high", "low");
        assertThat(adapter.listDatasets("territorio", true)).isEmpty();
        assertThat(adapter.listDatasets("territorio", false)).hasSize(1);
    }

    @Test
    void summarizeCountsByStatus() {
        adapter.registerDataset(descriptor("x", "lavoro", 1), DatasetStatus.LOADING);
        adapter.registerDataset(descriptor("y", "economia", 1), DatasetStatus.LOADING);
        adapter.markActive("y", 5, "b");

        MetadataSummary summary = adapter.summarize();

        assertThat(summary.getTotalDatasets()).isEqualTo(2);
        assertThat(summary.getDatasetsByStatus())
                .containsEntry(DatasetStatus.ACTIVE, 1L)
                .containsEntry(DatasetStatus.LOADING, 1L);
        assertThat(summary.getActiveCategories()).isEqualTo(1);
    }

    @Test
    void qualityScoreOutsideRangeIsRejected() {
        adapter.registerDataset(descriptor("q", "lavoro", 1), DatasetStatus.LOADING);

        assertThatThrownBy(() -> adapter.updateQualityScore("q", 120))
                .isInstanceOf(ValidationException.class);
        assertThat(adapter.updateQualityScore("q", 87.5).getQualityScore()).isEqualTo(87.5);
    }

    @Test
    void updatingUnknownDatasetIsAValidationError() {
        assertThatThrownBy(() -> adapter.markActive("missing", 1, "b"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void auditEntriesAreReturnedNewestFirstForAResource() {
        adapter.logAudit(AuditEntry.builder().action("register").resourceType("dataset").resourceId("d1")
                .details(Map.of("rows", 3)).build());
        adapter.logAudit(AuditEntry.builder().action("load_failed").resourceType("dataset").resourceId("d1")
                .success(false).errorMessage("timeout").build());
        adapter.logAudit(AuditEntry.builder().action("register").resourceType("dataset").resourceId("d2").build());

        List<AuditEntry> entries = adapter.findAudit("dataset", "d1", 10);

        assertThat(entries).hasSize(2);
        assertThat(entries).extracting(AuditEntry::getAction).contains("register", "load_failed");
        assertThat(entries).filteredOn(e -> !e.isSuccess()).singleElement()
                .extracting(AuditEntry::getErrorMessage).isEqualTo("timeout");
    }

    @Test
    void credentialsAreHashedAndVerified() {
        adapter.storeCredential("istat", "secret-key", "https://example.org", 60, null);

        assertThat(adapter.verifyCredential("istat", "secret-key")).isTrue();
        assertThat(adapter.verifyCredential("istat", "wrong")).isFalse();
        assertThat(adapter.verifyCredential("unknown", "secret-key")).isFalse();

        adapter.revokeCredential("istat");
        assertThat(adapter.verifyCredential("istat", "secret-key")).isFalse();
    }

    @Test
    void expiredCredentialNeverMatches() {
        adapter.storeCredential("old", "k", null, 10, Instant.now().minus(1, ChronoUnit.DAYS));

        assertThat(adapter.verifyCredential("old", "k")).isFalse();
    }

    @Test
    void blankIdentifierIsRejectedBeforeTouchingTheStore() {
        assertThatThrownBy(() -> adapter.registerDataset(
                DatasetDescriptor.builder().datasetId(" ").name("n").build(), DatasetStatus.LOADING))
                .isInstanceOf(ValidationException.class);
    }
}
