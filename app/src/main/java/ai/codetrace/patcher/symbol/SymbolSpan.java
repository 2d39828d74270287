package ai.codetrace.patcher.symbol;

import java.util.Objects;

/**
 * A named symbol located by the extractor: its file, name, byte span and the text found there.
 */
public record SymbolSpan(String file, String symbolName, ByteRange range, String originalText) {

    public SymbolSpan {
        file = requireNonBlank(file, "file");
        symbolName = requireNonBlank(symbolName, "symbolName");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(originalText, "originalText");
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
