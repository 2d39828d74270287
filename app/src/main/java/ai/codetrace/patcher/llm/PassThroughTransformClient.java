package ai.codetrace.patcher.llm;

/**
 * Dry-run client: echoes the source so every symbol ends up unchanged and nothing is written.
 */
public class PassThroughTransformClient implements TransformClient {

    @Override
    public TransformResponse transform(String originalText, String instruction) {
        return TransformResponse.of(originalText == null ? "" : originalText);
    }
}
