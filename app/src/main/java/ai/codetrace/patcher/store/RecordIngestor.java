package ai.codetrace.patcher.store;

import ai.codetrace.patcher.llm.TransformResponse;
import ai.codetrace.patcher.symbol.ByteRange;
import ai.codetrace.patcher.symbol.SymbolSpan;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns collaborator output and persisted payloads into {@link TransformationRecord}s.
 * Defaulting and type coercion happen here and nowhere else.
 */
public class RecordIngestor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordIngestor.class);

    private final Clock clock;

    public RecordIngestor(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Builds a pending record from a model response for an extracted symbol.
     *
     * @throws ValidationException when the collaborator reported failure or returned no text at all
     */
    public TransformationRecord fromResponse(SymbolSpan span, TransformResponse response, String runId) {
        Objects.requireNonNull(span, "span");
        if (response == null) {
            throw new ValidationException("no response for " + span.symbolName());
        }
        if (!response.success()) {
            throw new ValidationException("model reported failure for " + span.symbolName());
        }
        String transformed = response.transformedText() == null ? "" : response.transformedText();
        boolean changed = !transformed.isBlank() && !transformed.equals(span.originalText());
        return TransformationRecord.pending(span.file(), span.symbolName(), span.originalText(), transformed, changed,
                Checksums.crc32(span.originalText()), span.range(), runId, clock.instant());
    }

    /**
     * Normalizes a persisted payload, keeping its status and run id.
     *
     * @throws ValidationException when identity fields are missing or code fields are not strings
     */
    public TransformationRecord normalize(RawTransformationRecord raw) {
        Objects.requireNonNull(raw, "raw");
        String description = raw.describe();
        if (isBlank(raw.filePath()) || isBlank(raw.symbolName())) {
            throw new ValidationException("missing identity fields: " + description);
        }
        if (!(raw.originalCode() instanceof String originalCode)) {
            throw new ValidationException("original_code must be a string: " + description);
        }
        if (raw.transformedCode() != null && !(raw.transformedCode() instanceof String)) {
            throw new ValidationException("transformed_code must be a string: " + description);
        }
        String transformedCode = raw.transformedCode() == null ? "" : (String) raw.transformedCode();

        boolean changed = coerceChanged(raw.isChanged(), originalCode, transformedCode, description);
        if (transformedCode.isBlank()) {
            changed = false;
        }

        int start = raw.startByte() == null ? TransformationRecord.UNKNOWN_OFFSET : raw.startByte();
        int end = raw.endByte() == null ? TransformationRecord.UNKNOWN_OFFSET : raw.endByte();
        if (start < 0 || end < start) {
            start = TransformationRecord.UNKNOWN_OFFSET;
            end = TransformationRecord.UNKNOWN_OFFSET;
        }

        TransformationStatus status;
        try {
            status = TransformationStatus.from(raw.status());
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ex.getMessage() + ": " + description, ex);
        }
        int appliedOffset = raw.appliedOffset() == null ? TransformationRecord.UNKNOWN_OFFSET : raw.appliedOffset();

        return new TransformationRecord(raw.filePath(), raw.symbolName(), originalCode, transformedCode, changed,
                resolveChecksum(raw.checksum(), originalCode, description), start, end, status, raw.reason(),
                appliedOffset, raw.runId() == null ? "legacy" : raw.runId(), parseTimestamp(raw.timestamp()));
    }

    /**
     * Normalizes a payload and re-issues it as a fresh pending record of the given run, as used for replay.
     */
    public TransformationRecord replay(RawTransformationRecord raw, String runId) {
        TransformationRecord normalized = normalize(raw);
        ByteRange range = normalized.hasSpan() ? normalized.span() : null;
        return TransformationRecord.pending(normalized.filePath(), normalized.symbolName(), normalized.originalCode(),
                normalized.transformedCode(), normalized.changed(), normalized.checksum(), range, runId,
                clock.instant());
    }

    static boolean coerceChanged(Object raw, String originalCode, String transformedCode, String description) {
        if (raw instanceof Boolean flag) {
            return flag;
        }
        if (raw == null) {
            boolean derived = !transformedCode.equals(originalCode);
            LOGGER.warn("is_changed missing for {}; derived {} from code comparison", description, derived);
            return derived;
        }
        if (raw instanceof Number number) {
            boolean coerced = number.doubleValue() != 0.0;
            LOGGER.warn("Coerced numeric is_changed {} to {} for {}", number, coerced, description);
            return coerced;
        }
        if (raw instanceof String text) {
            boolean coerced = switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "y", "on", "1" -> true;
                case "false", "no", "n", "off", "0", "" -> false;
                default -> {
                    LOGGER.warn("Unrecognized is_changed value '{}' for {}; treating as false", text, description);
                    yield false;
                }
            };
            LOGGER.warn("Coerced string is_changed '{}' to {} for {}", text, coerced, description);
            return coerced;
        }
        LOGGER.warn("Unsupported is_changed type {} for {}; treating as false",
                raw.getClass().getSimpleName(), description);
        return false;
    }

    private static long resolveChecksum(Object raw, String originalCode, String description) {
        if (raw instanceof Number number) {
            return number.longValue() & 0xFFFFFFFFL;
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim(), 16) & 0xFFFFFFFFL;
            } catch (NumberFormatException ex) {
                throw new ValidationException("checksum is not a hex value: " + description, ex);
            }
        }
        return Checksums.crc32(originalCode);
    }

    private Instant parseTimestamp(String raw) {
        if (isBlank(raw)) {
            return clock.instant();
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            LOGGER.debug("Ignoring unparseable timestamp '{}'", raw);
            return clock.instant();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
