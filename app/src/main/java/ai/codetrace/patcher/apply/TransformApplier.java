package ai.codetrace.patcher.apply;

import ai.codetrace.patcher.io.AtomicFileWriter;
import ai.codetrace.patcher.store.Checksums;
import ai.codetrace.patcher.store.FileTransformationBundle;
import ai.codetrace.patcher.store.SymbolKey;
import ai.codetrace.patcher.store.TransformationRecord;
import ai.codetrace.patcher.store.TransformationStatus;
import ai.codetrace.patcher.store.TransformationStore;
import ai.codetrace.patcher.symbol.ByteRange;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies pending transformations of one file in a single atomic write and reverts them on request.
 *
 * <p>All work on a file happens under the lock the store hands out for it, so content writes and
 * bundle writes for the same file never interleave.
 */
public class TransformApplier {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformApplier.class);

    private final TransformationStore store;
    private final AtomicFileWriter writer;
    private final Clock clock;

    public TransformApplier(TransformationStore store, AtomicFileWriter writer, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ApplyReport apply(FileTransformationBundle bundle, SkipSet skipSet) {
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(skipSet, "skipSet");
        Path file = store.resolve(bundle.filePath());
        return store.lockTable().withLock(file, () -> applyLocked(file, bundle, skipSet));
    }

    private ApplyReport applyLocked(Path file, FileTransformationBundle bundle, SkipSet skipSet) {
        Instant now = clock.instant();
        Map<SymbolKey, TransformationRecord> results = new LinkedHashMap<>();
        List<SymbolKey> rejected = new ArrayList<>();
        List<TransformationRecord> accepted = new ArrayList<>();

        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException ex) {
            LOGGER.error("Cannot read {}: {}", file, ex.getMessage());
            content = null;
        }

        for (TransformationRecord record : bundle.records()) {
            if (record.status() != TransformationStatus.PENDING) {
                LOGGER.debug("Ignoring {} record {}", record.status().wireName(), record.key());
                rejected.add(record.key());
                continue;
            }
            String reason = skipReason(record, skipSet);
            if (reason != null) {
                LOGGER.info("Skipping {}: {}", record.key(), reason);
                results.put(record.key(), record.skipped(reason, now));
                continue;
            }
            if (content == null) {
                results.put(record.key(), record.failed("apply error: source file unreadable", now));
                continue;
            }
            try {
                TransformationRecord located = locate(record, content);
                verifyBase(located, content);
                ByteRange span = located.span();
                boolean overlapping = accepted.stream().anyMatch(other -> other.span().overlaps(span));
                if (overlapping) {
                    LOGGER.warn("Span {}-{} of {} overlaps an accepted transformation", span.start(), span.end(),
                            record.key());
                    results.put(record.key(), located.failed("overlapping span", now));
                    continue;
                }
                accepted.add(located);
                results.put(record.key(), located);
            } catch (StaleBaseException ex) {
                LOGGER.warn("Stale base for {}: {}", record.key(), ex.getMessage());
                results.put(record.key(), record.failed("stale base: " + ex.getMessage(), now));
            } catch (SpanException ex) {
                LOGGER.warn("Cannot place {}: {}", record.key(), ex.getMessage());
                results.put(record.key(), record.failed(ex.getMessage(), now));
            }
        }

        boolean written = false;
        String error = null;
        if (!accepted.isEmpty()) {
            try {
                Map<SymbolKey, Integer> offsets = patch(file, content, accepted);
                for (TransformationRecord record : accepted) {
                    results.put(record.key(), record.applied(offsets.get(record.key()), now));
                }
                written = true;
                LOGGER.info("Applied {} transformation(s) to {}", accepted.size(), bundle.filePath());
            } catch (ApplyException ex) {
                error = ex.getMessage();
                LOGGER.error("Failed to write {}: {}", file, error, ex);
                for (TransformationRecord record : accepted) {
                    results.put(record.key(), record.failed("apply error: " + error, now));
                }
            }
        }

        if (results.isEmpty()) {
            return new ApplyReport(store.getBundle(bundle.filePath()), rejected, false, null);
        }
        FileTransformationBundle updated = store.update(bundle.withRecords(List.copyOf(results.values())));
        return new ApplyReport(updated, rejected, written, error);
    }

    /**
     * Restores the original text of every applied record of the current run.
     *
     * @return the records that were rolled back
     * @throws ApplyException when the file no longer holds the applied text or cannot be written
     */
    public List<TransformationRecord> rollback(String filePath, String reason) {
        Path file = store.resolve(filePath);
        return store.lockTable().withLock(file, () -> rollbackLocked(file, filePath, reason));
    }

    private List<TransformationRecord> rollbackLocked(Path file, String filePath, String reason) {
        List<TransformationRecord> applied = new ArrayList<>(
                store.getBundle(filePath).withStatus(TransformationStatus.APPLIED));
        if (applied.isEmpty()) {
            return List.of();
        }
        applied.sort(Comparator.comparingInt(TransformationRecord::appliedOffset).reversed());
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new ApplyException("Cannot read " + file + " for rollback", ex);
        }
        for (TransformationRecord record : applied) {
            byte[] expected = bytes(record.transformedCode());
            int offset = record.appliedOffset();
            int end = offset + expected.length;
            if (offset < 0 || end > content.length
                    || !Arrays.equals(content, offset, end, expected, 0, expected.length)) {
                throw new ApplyException("Content of %s drifted at offset %d for %s".formatted(
                        filePath, offset, record.symbolName()), null);
            }
            content = splice(content, new ByteRange(offset, end), bytes(record.originalCode()));
        }
        try {
            writer.write(file, content);
        } catch (IOException ex) {
            throw new ApplyException("Failed to write rollback of " + file, ex);
        }
        Instant now = clock.instant();
        List<TransformationRecord> rolledBack = applied.stream()
                .map(record -> record.rolledBack(reason, now))
                .toList();
        store.update(new FileTransformationBundle(filePath, rolledBack));
        LOGGER.warn("Rolled back {} transformation(s) in {}: {}", rolledBack.size(), filePath, reason);
        return rolledBack;
    }

    private static String skipReason(TransformationRecord record, SkipSet skipSet) {
        Optional<String> rule = skipSet.match(record);
        if (rule.isPresent()) {
            return "skip rule " + rule.get();
        }
        if (!record.changed()) {
            return "unchanged";
        }
        if (record.transformedCode() == null || record.transformedCode().isEmpty()) {
            return "empty";
        }
        return null;
    }

    private static TransformationRecord locate(TransformationRecord record, byte[] content) {
        if (record.hasSpan()) {
            if (record.endByte() > content.length) {
                throw new SpanException("span %d-%d out of range (file has %d bytes)".formatted(
                        record.startByte(), record.endByte(), content.length));
            }
            return record;
        }
        byte[] needle = bytes(record.originalCode());
        int first = indexOf(content, needle, 0);
        if (first < 0 || needle.length == 0) {
            throw new SpanException("span not found");
        }
        if (indexOf(content, needle, first + 1) >= 0) {
            throw new SpanException("ambiguous span");
        }
        return record.withSpan(new ByteRange(first, first + needle.length));
    }

    private static void verifyBase(TransformationRecord record, byte[] content) {
        ByteRange span = record.span();
        long live = Checksums.crc32(content, span.start(), span.length());
        if (live != record.checksum()) {
            throw new StaleBaseException("expected %s, found %s".formatted(
                    Checksums.toHex(record.checksum()), Checksums.toHex(live)));
        }
    }

    private Map<SymbolKey, Integer> patch(Path file, byte[] content, List<TransformationRecord> accepted) {
        List<TransformationRecord> descending = new ArrayList<>(accepted);
        descending.sort(Comparator.comparingInt(TransformationRecord::startByte).reversed());
        byte[] patched = content;
        for (TransformationRecord record : descending) {
            patched = splice(patched, record.span(), bytes(record.transformedCode()));
        }
        try {
            writer.write(file, patched);
        } catch (IOException ex) {
            throw new ApplyException(ex.getClass().getSimpleName() + ": " + ex.getMessage(), ex);
        }

        Map<SymbolKey, Integer> offsets = new LinkedHashMap<>();
        int shift = 0;
        for (int i = descending.size() - 1; i >= 0; i--) {
            TransformationRecord record = descending.get(i);
            offsets.put(record.key(), record.startByte() + shift);
            shift += bytes(record.transformedCode()).length - record.span().length();
        }
        return offsets;
    }

    private static byte[] splice(byte[] content, ByteRange range, byte[] replacement) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(content.length - range.length() + replacement.length);
        out.write(content, 0, range.start());
        out.write(replacement, 0, replacement.length);
        out.write(content, range.end(), content.length - range.end());
        return out.toByteArray();
    }

    private static int indexOf(byte[] haystack, byte[] needle, int from) {
        outer:
        for (int i = from; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static final class SpanException extends RuntimeException {
        private SpanException(String message) {
            super(message);
        }
    }
}
