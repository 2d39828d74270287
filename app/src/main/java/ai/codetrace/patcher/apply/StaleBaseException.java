package ai.codetrace.patcher.apply;

/**
 * Raised when the live bytes at a record's span no longer hash to the record's checksum.
 */
public class StaleBaseException extends RuntimeException {

    public StaleBaseException(String message) {
        super(message);
    }
}
