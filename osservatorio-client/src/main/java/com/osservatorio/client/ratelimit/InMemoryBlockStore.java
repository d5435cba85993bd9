package com.osservatorio.client.ratelimit;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBlockStore implements BlockStore {

    private final Map<String, BlockEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<BlockEntry> find(String identifier) {
        return Optional.ofNullable(entries.get(identifier));
    }

    @Override
    public void save(BlockEntry entry) {
        entries.put(entry.getIdentifier(), entry);
    }

    @Override
    public boolean remove(String identifier) {
        return entries.remove(identifier) != null;
    }

    @Override
    public List<BlockEntry> active(Instant now) {
        return entries.values().stream().filter(e -> e.isActive(now)).toList();
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(e -> !e.isActive(now));
        return before - entries.size();
    }
}
