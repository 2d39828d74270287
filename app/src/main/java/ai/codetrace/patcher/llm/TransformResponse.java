package ai.codetrace.patcher.llm;

/**
 * Reply of the transformation collaborator for one symbol.
 */
public record TransformResponse(String transformedText, boolean success) {

    public static TransformResponse of(String transformedText) {
        return new TransformResponse(transformedText, true);
    }

    public static TransformResponse failure() {
        return new TransformResponse(null, false);
    }
}
