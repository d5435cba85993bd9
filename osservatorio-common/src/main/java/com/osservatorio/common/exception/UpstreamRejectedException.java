package com.osservatorio.common.exception;

import lombok.Getter;

/**
 * Upstream answered with a status that retrying will not fix (404, 400, 401...).
 * Treated as a caller problem, so it never counts against the circuit breaker.
 */
@Getter
public class UpstreamRejectedException extends OsservatorioException {

    private final int statusCode;

    public UpstreamRejectedException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }
}
