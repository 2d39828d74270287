package ai.codetrace.patcher.llm;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Extracts the replacement body from a model reply of the form
 * <pre>
 * [modified whole symbol]: path
 * [start]
 * ...
 * [end]
 * </pre>
 */
public final class TransformBlockParser {

    static final String START_TAG = "[start]";
    static final String END_TAG = "[end]";

    private TransformBlockParser() {
    }

    public static Optional<String> parse(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        List<String> lines = Arrays.asList(reply.split("\\R", -1));
        int start = -1;
        int end = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).strip().equals(START_TAG)) {
                start = i;
                break;
            }
        }
        for (int i = lines.size() - 1; i > start; i--) {
            if (lines.get(i).strip().equals(END_TAG)) {
                end = i;
                break;
            }
        }
        if (start < 0 || end < 0) {
            return Optional.empty();
        }
        String body = String.join("\n", lines.subList(start + 1, end));
        return Optional.of(stripNewlines(body));
    }

    private static String stripNewlines(String value) {
        int from = 0;
        int to = value.length();
        while (from < to && value.charAt(from) == '\n') {
            from++;
        }
        while (to > from && value.charAt(to - 1) == '\n') {
            to--;
        }
        return value.substring(from, to);
    }
}
