package com.osservatorio.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "circuit_states")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CircuitStateEntity {

    @Id
    @Column(name = "dependency_name", length = 128)
    private String dependencyName;

    @Column(name = "state", nullable = false, length = 16)
    private String state;

    @Column(name = "failure_count", nullable = false)
    private Integer failureCount;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "recovery_timeout_ms", nullable = false)
    private Long recoveryTimeoutMs;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
