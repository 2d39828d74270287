package ai.codetrace.patcher.apply;

import ai.codetrace.patcher.store.FileTransformationBundle;
import ai.codetrace.patcher.store.SymbolKey;
import ai.codetrace.patcher.store.TransformationRecord;
import ai.codetrace.patcher.store.TransformationStatus;
import java.util.List;
import java.util.Objects;

/**
 * Result of one apply pass over a file's bundle.
 *
 * @param bundle   the bundle as persisted after the pass
 * @param rejected keys of records that were not pending and therefore left untouched
 * @param written  whether the source file was rewritten
 * @param error    write failure message, {@code null} when the write succeeded or nothing was written
 */
public record ApplyReport(FileTransformationBundle bundle, List<SymbolKey> rejected, boolean written, String error) {

    public ApplyReport {
        Objects.requireNonNull(bundle, "bundle");
        rejected = List.copyOf(Objects.requireNonNull(rejected, "rejected"));
    }

    public String filePath() {
        return bundle.filePath();
    }

    public List<TransformationRecord> applied() {
        return bundle.withStatus(TransformationStatus.APPLIED);
    }

    public boolean hasApplied() {
        return !applied().isEmpty();
    }

    public long count(TransformationStatus status) {
        return bundle.records().stream().filter(record -> record.status() == status).count();
    }
}
