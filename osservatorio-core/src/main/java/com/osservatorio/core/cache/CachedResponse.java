package com.osservatorio.core.cache;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CachedResponse {
    String key;
    int statusCode;
    String contentType;
    byte[] body;
    String contentHash;
    Instant storedAt;
    Instant expiresAt;

    public boolean isFresh(Instant now) {
        return now.isBefore(expiresAt);
    }

    /**
     * A copy; the stored payload never changes once written.
     */
    public byte[] getBody() {
        return body != null ? body.clone() : null;
    }

    public static class CachedResponseBuilder {
        public CachedResponseBuilder body(byte[] body) {
            this.body = body != null ? body.clone() : null;
            return this;
        }
    }
}
