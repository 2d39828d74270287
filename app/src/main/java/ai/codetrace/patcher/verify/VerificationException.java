package ai.codetrace.patcher.verify;

/**
 * Raised when the verification command cannot be started or awaited.
 */
public class VerificationException extends RuntimeException {

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
