package com.osservatorio.common.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * Identifier is on the block list. The identifier is kept on the exception for
 * the caller; the message only carries the reason and expiry.
 */
@Getter
public class ThreatBlockedException extends OsservatorioException {

    private final String identifier;
    private final String reason;
    private final Instant expiresAt;

    public ThreatBlockedException(String identifier, String reason, Instant expiresAt) {
        super("Access blocked until " + expiresAt + ": " + reason);
        this.identifier = identifier;
        this.reason = reason;
        this.expiresAt = expiresAt;
    }
}
