package ai.codetrace.patcher.llm;

/**
 * Runtime exception used to propagate failures of the transformation collaborator.
 */
public class TransformException extends RuntimeException {

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
