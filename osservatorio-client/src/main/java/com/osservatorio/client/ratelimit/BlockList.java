package com.osservatorio.client.ratelimit;

import com.osservatorio.common.util.HashUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Blocked identifiers. Entries are mirrored locally and written through to the
 * backing store so other processes sharing it see them; when the store is
 * unreachable the local mirror still enforces blocks created here.
 */
@Slf4j
public class BlockList {

    private final BlockStore store;
    private final Clock clock;
    private final Map<String, BlockEntry> local = new ConcurrentHashMap<>();

    public BlockList(BlockStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Optional<BlockEntry> activeBlock(String identifier) {
        Instant now = clock.instant();
        BlockEntry cached = local.get(identifier);
        if (cached != null) {
            if (cached.isActive(now)) {
                return Optional.of(cached);
            }
            local.remove(identifier, cached);
        }
        try {
            return store.find(identifier).filter(e -> e.isActive(now));
        } catch (RuntimeException e) {
            log.warn("[RATE_LIMIT] Block store lookup failed, using local blocks only | error={}", e.getMessage());
            return Optional.empty();
        }
    }

    public BlockEntry block(String identifier, String reason, Duration duration) {
        Instant now = clock.instant();
        BlockEntry entry = new BlockEntry(identifier, reason, now, now.plus(duration));
        local.put(identifier, entry);
        try {
            store.save(entry);
        } catch (RuntimeException e) {
            log.warn("[RATE_LIMIT] Block not persisted, enforced locally | identifier={} | error={}",
                    HashUtils.mask(identifier), e.getMessage());
        }
        log.warn("[RATE_LIMIT] Identifier blocked | identifier={} | expiresAt={} | reason={}",
                HashUtils.mask(identifier), entry.getExpiresAt(), reason);
        return entry;
    }

    /**
     * Administrative override.
     */
    public boolean unblock(String identifier) {
        boolean removed = local.remove(identifier) != null;
        removed |= store.remove(identifier);
        if (removed) {
            log.info("[RATE_LIMIT] Identifier unblocked | identifier={}", HashUtils.mask(identifier));
        }
        return removed;
    }

    public List<BlockEntry> activeBlocks() {
        Instant now = clock.instant();
        try {
            return store.active(now);
        } catch (RuntimeException e) {
            log.warn("[RATE_LIMIT] Block store listing failed | error={}", e.getMessage());
            return local.values().stream().filter(b -> b.isActive(now)).toList();
        }
    }

    public int purgeExpired() {
        Instant now = clock.instant();
        local.values().removeIf(e -> !e.isActive(now));
        return store.purgeExpired(now);
    }
}
