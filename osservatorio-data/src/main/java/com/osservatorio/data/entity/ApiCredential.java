package com.osservatorio.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(name = "api_credentials")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApiCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "service_name", nullable = false, unique = true, length = 128)
    private String serviceName;

    // bcrypt hash, never the raw key
    @Column(name = "key_hash", nullable = false, length = 100)
    private String keyHash;

    @Column(name = "endpoint_url", length = 512)
    private String endpointUrl;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "rate_limit")
    @Builder.Default
    private Integer rateLimit = 100;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "last_used")
    private Instant lastUsed;

    @Column(name = "usage_count")
    @Builder.Default
    private Long usageCount = 0L;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
