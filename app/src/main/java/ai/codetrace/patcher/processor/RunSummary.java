package ai.codetrace.patcher.processor;

import ai.codetrace.patcher.store.TransformationStatus;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate of every file outcome of a run.
 */
public record RunSummary(String runId, List<FileOutcome> files) {

    public RunSummary {
        Objects.requireNonNull(runId, "runId");
        files = List.copyOf(Objects.requireNonNull(files, "files"));
    }

    public long applied() {
        return count(TransformationStatus.APPLIED);
    }

    public long skipped() {
        return count(TransformationStatus.SKIPPED);
    }

    public long failed() {
        return count(TransformationStatus.FAILED);
    }

    public long rolledBack() {
        return count(TransformationStatus.ROLLED_BACK);
    }

    public List<FileOutcome> fatalHalts() {
        return files.stream().filter(FileOutcome::fatal).toList();
    }

    public boolean hasFatalHalts() {
        return files.stream().anyMatch(FileOutcome::fatal);
    }

    public long cancelled() {
        return files.stream().filter(FileOutcome::isCancelled).count();
    }

    private long count(TransformationStatus status) {
        return files.stream().mapToLong(file -> file.count(status)).sum();
    }
}
