package ai.codetrace.patcher.verify;

import ai.codetrace.patcher.store.TransformationRecord;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of verifying a set of files.
 *
 * @param attempts   command executions, recovery run included
 * @param implicated files rolled back after the failure, empty when nothing failed
 * @param rolledBack records reverted by the rollback
 * @param output     output of the last command execution
 * @param message    failure description, {@code null} on success
 */
public record VerificationReport(VerificationStatus status, int attempts, List<String> implicated,
                                 List<TransformationRecord> rolledBack, String output, String message) {

    public VerificationReport {
        Objects.requireNonNull(status, "status");
        implicated = List.copyOf(Objects.requireNonNull(implicated, "implicated"));
        rolledBack = List.copyOf(Objects.requireNonNull(rolledBack, "rolledBack"));
        output = output == null ? "" : output;
    }

    static VerificationReport skipped() {
        return new VerificationReport(VerificationStatus.SKIPPED, 0, List.of(), List.of(), "", null);
    }

    static VerificationReport passed(int attempts, String output) {
        return new VerificationReport(VerificationStatus.PASSED, attempts, List.of(), List.of(), output, null);
    }

    public boolean isFatal() {
        return status == VerificationStatus.FATAL;
    }
}
