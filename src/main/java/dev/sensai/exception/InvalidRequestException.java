package dev.sensai.exception;

/**
 * A request value that passed binding but violates a rule checked in code rather than by a bean constraint.
 */
public class InvalidRequestException extends RuntimeException {

    private final String field;

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
