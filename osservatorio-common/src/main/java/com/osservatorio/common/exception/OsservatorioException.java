package com.osservatorio.common.exception;

/**
 * Root of the unchecked exception hierarchy raised by the access core.
 * Callers that translate failures into an outer protocol (HTTP status codes,
 * CLI exit codes) can catch this type and switch on the concrete subclass.
 */
public class OsservatorioException extends RuntimeException {

    public OsservatorioException(String message) {
        super(message);
    }

    public OsservatorioException(String message, Throwable cause) {
        super(message, cause);
    }
}
