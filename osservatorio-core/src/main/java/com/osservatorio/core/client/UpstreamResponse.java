package com.osservatorio.core.client;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

@Value
@Builder
public class UpstreamResponse {
    int statusCode;
    String contentType;
    byte[] body;
    String contentHash;
    ResponseSource source;
    Instant fetchedAt;
    // upstream attempts made for this response, 0 when served from cache
    int attempts;

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public byte[] getBody() {
        return body != null ? body.clone() : null;
    }

    public int bodyLength() {
        return body != null ? body.length : 0;
    }

    public boolean isFromCache() {
        return source != ResponseSource.LIVE;
    }

    public static class UpstreamResponseBuilder {
        public UpstreamResponseBuilder body(byte[] body) {
            this.body = body != null ? body.clone() : null;
            return this;
        }
    }
}
