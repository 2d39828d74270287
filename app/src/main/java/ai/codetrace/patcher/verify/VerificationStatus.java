package ai.codetrace.patcher.verify;

public enum VerificationStatus {
    /** The command passed, possibly after a retry. */
    PASSED,
    /** The command failed, the implicated files were rolled back and the command then passed. */
    RECOVERED,
    /** The command still failed after rollback, or the rollback itself failed. */
    FATAL,
    /** No command configured. */
    SKIPPED;

    public boolean isSuccessful() {
        return this != FATAL;
    }
}
