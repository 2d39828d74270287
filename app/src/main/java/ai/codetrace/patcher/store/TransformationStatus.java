package ai.codetrace.patcher.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a transformation record. Transitions only move forward:
 * {@code pending -> applied | skipped | failed} and {@code applied -> rolled_back}.
 */
public enum TransformationStatus {
    PENDING,
    APPLIED,
    SKIPPED,
    FAILED,
    ROLLED_BACK;

    @JsonCreator
    public static TransformationStatus from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        for (TransformationStatus status : values()) {
            if (status.wireName().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unsupported transformation status: " + raw);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean canTransitionTo(TransformationStatus next) {
        return switch (this) {
            case PENDING -> next == APPLIED || next == SKIPPED || next == FAILED;
            case APPLIED -> next == ROLLED_BACK;
            case SKIPPED, FAILED, ROLLED_BACK -> false;
        };
    }

    /**
     * Pending and applied records occupy their symbol key for the rest of the run.
     */
    public boolean isActive() {
        return this == PENDING || this == APPLIED;
    }
}
