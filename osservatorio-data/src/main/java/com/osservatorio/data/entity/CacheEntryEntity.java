package com.osservatorio.data.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "response_cache", indexes = {
    @Index(name = "idx_cache_expires", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CacheEntryEntity {

    @Id
    @Column(name = "cache_key", length = 64)
    private String cacheKey;

    @Lob
    @Column(name = "payload", nullable = false)
    private byte[] payload;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "content_type", length = 128)
    private String contentType;

    @Column(name = "status_code")
    private Integer statusCode;

    @Column(name = "stored_at", nullable = false)
    private Instant storedAt;

    @Column(name = "ttl_seconds", nullable = false)
    private Long ttlSeconds;

    // stored_at + ttl, kept as a column so expiry can be queried
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
