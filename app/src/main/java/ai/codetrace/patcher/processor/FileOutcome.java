package ai.codetrace.patcher.processor;

import ai.codetrace.patcher.store.TransformationStatus;
import ai.codetrace.patcher.verify.VerificationStatus;
import java.util.List;
import java.util.Objects;

/**
 * Everything that happened to one file in a run.
 *
 * @param verification {@code null} when verification did not run
 * @param fatal        whether the file's pipeline was halted
 * @param note         halt reason, or why the file was not processed at all
 */
public record FileOutcome(String filePath, List<SymbolOutcome> symbols, VerificationStatus verification,
                          boolean fatal, String note) {

    public static final String CANCELLED = "cancelled";

    public FileOutcome {
        Objects.requireNonNull(filePath, "filePath");
        symbols = List.copyOf(Objects.requireNonNull(symbols, "symbols"));
    }

    static FileOutcome cancelled(String filePath) {
        return new FileOutcome(filePath, List.of(), null, false, CANCELLED);
    }

    static FileOutcome halted(String filePath, List<SymbolOutcome> symbols, String reason) {
        return new FileOutcome(filePath, symbols, null, true, reason);
    }

    public long count(TransformationStatus status) {
        return symbols.stream().filter(symbol -> symbol.status() == status).count();
    }

    public boolean isCancelled() {
        return CANCELLED.equals(note) && !fatal;
    }
}
