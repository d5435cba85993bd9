package com.osservatorio.data.entity;

import com.osservatorio.common.model.DatasetStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "dataset_registry", indexes = {
    @Index(name = "idx_dataset_category", columnList = "category"),
    @Index(name = "idx_dataset_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatasetRecord {

    @Id
    @Column(name = "dataset_id", length = 128)
    private String datasetId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "category", length = 64)
    private String category;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "agency", length = 64)
    @Builder.Default
    private String agency = "IT1";

    @Column(name = "priority")
    @Builder.Default
    private Integer priority = 5;

    @Column(name = "metadata_json", length = 4000)
    private String metadataJson;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    private DatasetStatus status = DatasetStatus.LOADING;

    @Column(name = "record_count")
    @Builder.Default
    private Long recordCount = 0L;

    @Column(name = "failure_reason", length = 1000)
    private String failureReason;

    @Column(name = "last_batch_id", length = 64)
    private String lastBatchId;

    @CreationTimestamp
    @Column(name = "registered_at", updatable = false)
    private Instant registeredAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
