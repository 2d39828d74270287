package ai.codetrace.patcher.apply;

/**
 * Raised when patched content cannot be written or a rollback finds content it did not write.
 */
public class ApplyException extends RuntimeException {

    public ApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
