package ai.codetrace.patcher.store;

/**
 * Raised when a transformation payload does not satisfy the record schema.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
