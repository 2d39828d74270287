package ai.codetrace.patcher.processor;

import ai.codetrace.patcher.store.TransformationRecord;
import ai.codetrace.patcher.store.TransformationStatus;
import java.util.Objects;

/**
 * Final status of one symbol in a run, with the reason when it was not applied.
 */
public record SymbolOutcome(String symbolName, TransformationStatus status, String reason) {

    public SymbolOutcome {
        Objects.requireNonNull(symbolName, "symbolName");
        Objects.requireNonNull(status, "status");
    }

    static SymbolOutcome of(TransformationRecord record) {
        return new SymbolOutcome(record.symbolName(), record.status(), record.reason());
    }

    static SymbolOutcome failed(String symbolName, String reason) {
        return new SymbolOutcome(symbolName, TransformationStatus.FAILED, reason);
    }

    static SymbolOutcome skipped(String symbolName, String reason) {
        return new SymbolOutcome(symbolName, TransformationStatus.SKIPPED, reason);
    }
}
