package com.osservatorio.common.exception;

import lombok.Getter;

/**
 * Upstream failure that may succeed on a later attempt: timeouts, connection
 * errors and retryable status codes. Status code is 0 when no response arrived.
 */
@Getter
public class TransientUpstreamException extends OsservatorioException {

    private final int statusCode;
    private final int attempts;

    public TransientUpstreamException(String message, int statusCode, Throwable cause) {
        this(message, statusCode, 1, cause);
    }

    public TransientUpstreamException(String message, int statusCode, int attempts, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public boolean hasStatus() {
        return statusCode > 0;
    }
}
