package ai.codetrace.patcher.llm;

/**
 * Mode controlling how transformations are requested.
 */
public enum TransformMode {
    PRODUCTION,
    DRY_RUN,
    MOCK;

    public static TransformMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_');
        for (TransformMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported transform mode: " + raw);
    }
}
