package com.osservatorio.common.exception;

/**
 * Invalid caller input. Never retried and never counted as a dependency failure.
 */
public class ValidationException extends OsservatorioException {

    public ValidationException(String message) {
        super(message);
    }

    public static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
        return value;
    }
}
