package ai.codetrace.patcher.store;

import ai.codetrace.patcher.symbol.ByteRange;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Objects;

/**
 * Proposed replacement of one symbol's source span, together with the integrity data needed to apply
 * and revert it. Instances are immutable; status changes produce new instances and are checked
 * against {@link TransformationStatus#canTransitionTo(TransformationStatus)}.
 */
@JsonPropertyOrder({"file_path", "symbol_name", "status", "reason", "is_changed", "checksum", "start_byte",
        "end_byte", "applied_offset", "run_id", "timestamp", "original_code", "transformed_code"})
public record TransformationRecord(
        @JsonProperty("file_path") String filePath,
        @JsonProperty("symbol_name") String symbolName,
        @JsonProperty("original_code") String originalCode,
        @JsonProperty("transformed_code") String transformedCode,
        @JsonProperty("is_changed") boolean changed,
        @JsonProperty("checksum") long checksum,
        @JsonProperty("start_byte") int startByte,
        @JsonProperty("end_byte") int endByte,
        @JsonProperty("status") TransformationStatus status,
        @JsonProperty("reason") String reason,
        @JsonProperty("applied_offset") int appliedOffset,
        @JsonProperty("run_id") String runId,
        @JsonProperty("timestamp") Instant timestamp
) {

    public static final int UNKNOWN_OFFSET = -1;

    public TransformationRecord {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
        if (startByte != UNKNOWN_OFFSET && endByte < startByte) {
            throw new IllegalArgumentException("end_byte must not precede start_byte");
        }
    }

    public static TransformationRecord pending(String filePath, String symbolName, String originalCode,
                                               String transformedCode, boolean changed, long checksum,
                                               ByteRange range, String runId, Instant timestamp) {
        int start = range == null ? UNKNOWN_OFFSET : range.start();
        int end = range == null ? UNKNOWN_OFFSET : range.end();
        return new TransformationRecord(filePath, symbolName, originalCode, transformedCode, changed, checksum,
                start, end, TransformationStatus.PENDING, null, UNKNOWN_OFFSET, runId, timestamp);
    }

    public SymbolKey key() {
        return new SymbolKey(filePath, symbolName);
    }

    public boolean hasSpan() {
        return startByte != UNKNOWN_OFFSET;
    }

    public ByteRange span() {
        if (!hasSpan()) {
            throw new IllegalStateException("No span recorded for " + key());
        }
        return new ByteRange(startByte, endByte);
    }

    public TransformationRecord withSpan(ByteRange range) {
        requireStatus(TransformationStatus.PENDING, "relocate");
        return new TransformationRecord(filePath, symbolName, originalCode, transformedCode, changed, checksum,
                range.start(), range.end(), status, reason, appliedOffset, runId, timestamp);
    }

    public TransformationRecord withRunId(String newRunId) {
        return new TransformationRecord(filePath, symbolName, originalCode, transformedCode, changed, checksum,
                startByte, endByte, status, reason, appliedOffset, newRunId, timestamp);
    }

    public TransformationRecord applied(int offset, Instant at) {
        return transition(TransformationStatus.APPLIED, null, offset, at);
    }

    public TransformationRecord skipped(String why, Instant at) {
        return transition(TransformationStatus.SKIPPED, why, appliedOffset, at);
    }

    public TransformationRecord failed(String why, Instant at) {
        return transition(TransformationStatus.FAILED, why, appliedOffset, at);
    }

    public TransformationRecord rolledBack(String why, Instant at) {
        return transition(TransformationStatus.ROLLED_BACK, why, appliedOffset, at);
    }

    private TransformationRecord transition(TransformationStatus next, String why, int offset, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid transition %s -> %s for %s".formatted(
                    status.wireName(), next.wireName(), key()));
        }
        return new TransformationRecord(filePath, symbolName, originalCode, transformedCode, changed, checksum,
                startByte, endByte, next, why, offset, runId, at);
    }

    private void requireStatus(TransformationStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException("Cannot %s %s record %s".formatted(action, status.wireName(), key()));
        }
    }
}
