package dev.sensai.exception;

/**
 * Stable machine-readable error kinds returned in {@link ErrorResponse#getCode()}.
 */
public enum ErrorCode {
    VALIDATION_ERROR,
    NOT_CONFIGURED,
    STORAGE_UNAVAILABLE,
    UPSTREAM_ERROR,
    INTERNAL_ERROR
}
