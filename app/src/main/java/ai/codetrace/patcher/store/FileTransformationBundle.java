package ai.codetrace.patcher.store;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered transformation records of the current run for one file.
 */
public record FileTransformationBundle(String filePath, List<TransformationRecord> records) {

    public FileTransformationBundle {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("filePath must not be blank");
        }
        records = List.copyOf(Objects.requireNonNull(records, "records"));
    }

    public FileTransformationBundle withRecords(List<TransformationRecord> replacement) {
        return new FileTransformationBundle(filePath, replacement);
    }

    public List<TransformationRecord> withStatus(TransformationStatus status) {
        return records.stream()
                .filter(record -> record.status() == status)
                .toList();
    }

    public Optional<TransformationRecord> find(SymbolKey key) {
        return records.stream()
                .filter(record -> record.key().equals(key))
                .reduce((first, second) -> second);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
