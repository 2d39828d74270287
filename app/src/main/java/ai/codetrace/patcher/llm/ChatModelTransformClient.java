package ai.codetrace.patcher.llm;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelTransformClient implements TransformClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelTransformClient.class);

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelTransformClient(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public TransformResponse transform(String originalText, String instruction) {
        if (originalText == null || originalText.isBlank()) {
            return TransformResponse.failure();
        }
        String reply;
        try {
            reply = model.chat(buildPrompt(originalText, instruction));
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new TransformException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new TransformException("LangChain transformation request failed", ex);
        }
        Optional<String> body = TransformBlockParser.parse(reply);
        if (body.isEmpty()) {
            LOGGER.warn("Reply from {} did not contain a [start]/[end] block", modelName);
            return TransformResponse.failure();
        }
        return TransformResponse.of(body.get());
    }

    String buildPrompt(String originalText, String instruction) {
        return instruction.strip() + """


Rules:
- Return the complete symbol, not a fragment or a diff.
- Keep the signature, name and indentation of the symbol unless the instruction requires otherwise.
- If nothing needs to change, return the original text unchanged.
- Reply with exactly one block in the format below and nothing else.

[modified whole symbol]: <symbol>
[start]
<complete symbol text>
[end]

Symbol:
[start]
""" + originalText + "\n[end]";
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
