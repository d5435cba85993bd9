package com.osservatorio.client.ratelimit;

import lombok.Value;

import java.time.Instant;

@Value
public class BlockEntry {
    String identifier;
    String reason;
    Instant createdAt;
    Instant expiresAt;

    public boolean isActive(Instant now) {
        return now.isBefore(expiresAt);
    }
}
