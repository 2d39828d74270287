package ai.codetrace.patcher.llm;

/**
 * Produces a proposed replacement for a symbol's source text.
 */
@FunctionalInterface
public interface TransformClient {

    TransformResponse transform(String originalText, String instruction);
}
