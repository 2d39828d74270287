package ai.codetrace.patcher.git;

/**
 * Runtime exception for failures while reading the working tree status.
 */
public class WorkspaceStatusException extends RuntimeException {

    public WorkspaceStatusException(String message, Throwable cause) {
        super(message, cause);
    }
}
