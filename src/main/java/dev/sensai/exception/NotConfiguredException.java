package dev.sensai.exception;

/**
 * Thrown when a collaborator the request needs was not configured for this process.
 * Unlike {@link StorageUnavailableException} this is terminal: retrying will not help until
 * the deployment is fixed.
 */
public class NotConfiguredException extends RuntimeException {

    public enum Component {
        /** {@code DATABASE_URL} / {@code DATABASE_NAME} missing; a server-side fault. */
        DOCUMENT_STORE,
        /** {@code OPENAI_API_KEY} missing; reported to the caller as a bad request. */
        GENERATION_API
    }

    private final Component component;

    public NotConfiguredException(Component component, String message) {
        super(message);
        this.component = component;
    }

    public Component getComponent() {
        return component;
    }
}
