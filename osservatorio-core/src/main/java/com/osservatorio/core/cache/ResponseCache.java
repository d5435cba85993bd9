package com.osservatorio.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.osservatorio.common.util.HashUtils;
import com.osservatorio.core.config.CacheProperties;
import com.osservatorio.data.entity.CacheEntryEntity;
import com.osservatorio.data.repository.CacheEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Two-level cache of upstream responses.
 *
 * Level 1: a bounded in-process Caffeine cache.
 * Level 2: the {@code response_cache} table, which survives restarts and is
 * shared between processes.
 *
 * Keys are the SHA-256 of the method, path and sorted query, so the same logical
 * request always maps to the same entry and a newer write replaces the older one.
 * The table is best effort: if it is unreachable the cache keeps working from
 * memory and the caller never sees the failure.
 */
@Service
@Slf4j
public class ResponseCache {

    private final CacheEntryRepository repository;
    private final CacheProperties properties;
    private final Clock clock;
    private final Cache<String, CachedResponse> hot;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder staleHits = new LongAdder();
    private final LongAdder writes = new LongAdder();

    public ResponseCache(CacheEntryRepository repository, CacheProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
        this.hot = Caffeine.newBuilder()
                .maximumSize(Math.max(1, properties.getHotEntries()))
                .build();
    }

    public static String key(String method, String path, Map<String, String> query) {
        String sortedQuery = query == null ? "" : new TreeMap<>(query).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
        return HashUtils.sha256Hex(method.toUpperCase() + " " + path + "?" + sortedQuery);
    }

    /**
     * Entry that has not expired yet.
     */
    public Optional<CachedResponse> getFresh(String key) {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Optional<CachedResponse> found = lookup(key).filter(entry -> entry.isFresh(now));
        if (found.isPresent()) {
            hits.increment();
            log.debug("[CACHE] Hit | key={}", shortKey(key));
        } else {
            misses.increment();
        }
        return found;
    }

    /**
     * Any retained entry, fresh or expired within the stale retention period.
     * Used as a fallback when the upstream cannot be reached.
     */
    public Optional<CachedResponse> getStale(String key) {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }
        Instant horizon = clock.instant().minus(properties.getStaleRetention());
        Optional<CachedResponse> found = lookup(key).filter(entry -> entry.getExpiresAt().isAfter(horizon));
        found.ifPresent(entry -> {
            staleHits.increment();
            log.info("[CACHE] Serving retained entry | key={} | storedAt={} | expiredAt={}",
                    shortKey(key), entry.getStoredAt(), entry.getExpiresAt());
        });
        return found;
    }

    public CachedResponse put(String key, int statusCode, String contentType, byte[] body) {
        return put(key, statusCode, contentType, body, properties.getTtl());
    }

    public CachedResponse put(String key, int statusCode, String contentType, byte[] body, Duration ttl) {
        Instant now = clock.instant();
        byte[] payload = body.clone();
        CachedResponse entry = CachedResponse.builder()
                .key(key)
                .statusCode(statusCode)
                .contentType(contentType)
                .body(payload)
                .contentHash(HashUtils.sha256Hex(payload))
                .storedAt(now)
                .expiresAt(now.plus(ttl))
                .build();
        if (!properties.isEnabled()) {
            return entry;
        }
        hot.put(key, entry);
        writes.increment();
        try {
            repository.save(CacheEntryEntity.builder()
                    .cacheKey(key)
                    .payload(payload)
                    .contentHash(entry.getContentHash())
                    .contentType(contentType)
                    .statusCode(statusCode)
                    .storedAt(now)
                    .ttlSeconds(ttl.getSeconds())
                    .expiresAt(entry.getExpiresAt())
                    .build());
        } catch (DataAccessException e) {
            log.warn("[CACHE] Write-through failed, entry kept in memory only | key={} | error={}",
                    shortKey(key), e.getMessage());
        }
        return entry;
    }

    public void invalidate(String key) {
        hot.invalidate(key);
        try {
            repository.deleteById(key);
        } catch (DataAccessException e) {
            log.warn("[CACHE] Invalidation not persisted | key={} | error={}", shortKey(key), e.getMessage());
        }
    }

    /**
     * Drop entries past their stale retention, in memory and in the table.
     *
     * @return number of table rows removed
     */
    public int purgeExpired() {
        Instant horizon = clock.instant().minus(properties.getStaleRetention());
        hot.asMap().values().removeIf(entry -> !entry.getExpiresAt().isAfter(horizon));
        int removed = repository.deleteExpiredBefore(horizon);
        if (removed > 0) {
            log.info("[CACHE] Purged expired entries | rows={}", removed);
        }
        return removed;
    }

    public CacheStats stats() {
        hot.cleanUp();
        return CacheStats.builder()
                .hits(hits.sum())
                .misses(misses.sum())
                .staleHits(staleHits.sum())
                .writes(writes.sum())
                .hotEntries((int) hot.estimatedSize())
                .build();
    }

    private Optional<CachedResponse> lookup(String key) {
        CachedResponse cached = hot.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            Optional<CachedResponse> stored = repository.findById(key).map(ResponseCache::toResponse);
            stored.ifPresent(entry -> hot.asMap().putIfAbsent(key, entry));
            return stored;
        } catch (DataAccessException e) {
            log.warn("[CACHE] Table lookup failed, treating as miss | key={} | error={}", shortKey(key), e.getMessage());
            return Optional.empty();
        }
    }

    private static CachedResponse toResponse(CacheEntryEntity entity) {
        return CachedResponse.builder()
                .key(entity.getCacheKey())
                .statusCode(entity.getStatusCode() != null ? entity.getStatusCode() : 200)
                .contentType(entity.getContentType())
                .body(entity.getPayload())
                .contentHash(entity.getContentHash())
                .storedAt(entity.getStoredAt())
                .expiresAt(entity.getExpiresAt())
                .build();
    }

    private static String shortKey(String key) {
        return key.length() > 12 ? key.substring(0, 12) : key;
    }
}
