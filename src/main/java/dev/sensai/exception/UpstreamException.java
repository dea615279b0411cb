package dev.sensai.exception;

/**
 * The text-generation API answered with an error status, or could not be reached.
 * Messages are truncated by the thrower so error payloads stay bounded.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
