package com.osservatorio.client.ratelimit;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BlockStore {

    Optional<BlockEntry> find(String identifier);

    void save(BlockEntry entry);

    boolean remove(String identifier);

    List<BlockEntry> active(Instant now);

    int purgeExpired(Instant now);
}
