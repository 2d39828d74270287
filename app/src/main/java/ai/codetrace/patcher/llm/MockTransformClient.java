package ai.codetrace.patcher.llm;

/**
 * Mock client producing a visible, deterministic edit without calling a model.
 */
public class MockTransformClient implements TransformClient {

    @Override
    public TransformResponse transform(String originalText, String instruction) {
        if (originalText == null || originalText.isEmpty()) {
            return TransformResponse.failure();
        }
        return TransformResponse.of("[MOCK] " + originalText);
    }
}
