package dev.sensai.exception;

/**
 * The document store is configured but could not be reached (connection refused, timeout, server selection failure).
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
