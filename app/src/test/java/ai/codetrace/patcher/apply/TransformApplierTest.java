package ai.codetrace.patcher.apply;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.codetrace.patcher.io.AtomicFileWriter;
import ai.codetrace.patcher.store.Checksums;
import ai.codetrace.patcher.store.FileTransformationBundle;
import ai.codetrace.patcher.store.StateLayout;
import ai.codetrace.patcher.store.SymbolKey;
import ai.codetrace.patcher.store.TransformationRecord;
import ai.codetrace.patcher.store.TransformationStatus;
import ai.codetrace.patcher.store.TransformationStore;
import ai.codetrace.patcher.symbol.ByteRange;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.assertj.core.groups.Tuple;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TransformApplierTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final String FILE = "pkg/mod.py";

    @TempDir
    Path projectRoot;

    private TransformationStore store;
    private TransformApplier applier;
    private SkipSet noSkips;

    @BeforeEach
    void setUp() {
        store = new TransformationStore(StateLayout.defaults(projectRoot), "run-1", CLOCK);
        applier = new TransformApplier(store, new AtomicFileWriter(), CLOCK);
        noSkips = SkipSet.empty(projectRoot);
    }

    @Test
    void appliesValidTransformation() throws IOException {
        write("def a():\n    return 1\n");
        put("a", "def a():\n    return 1", "def a():\n    return 2", 0);

        ApplyReport report = applier.apply(store.getBundle(FILE), noSkips);

        assertThat(read()).isEqualTo("def a():\n    return 2\n");
        assertThat(report.written()).isTrue();
        assertThat(report.applied()).singleElement()
                .satisfies(record -> assertThat(record.appliedOffset()).isZero());
        assertThat(store.getBundle(FILE).records()).extracting(TransformationRecord::status)
                .containsExactly(TransformationStatus.APPLIED);
    }

    @Test
    void failsStaleRecordAndLeavesFileUntouched() throws IOException {
        write("def a():\n    return 1\n");
        put("a", "def a():\n    return 1", "def a():\n    return 2", 0);
        write("def a():\n    return 9\n");

        ApplyReport report = applier.apply(store.getBundle(FILE), noSkips);

        assertThat(read()).isEqualTo("def a():\n    return 9\n");
        assertThat(report.written()).isFalse();
        TransformationRecord record = store.getBundle(FILE).records().get(0);
        assertThat(record.status()).isEqualTo(TransformationStatus.FAILED);
        assertThat(record.reason()).startsWith("stale base");
    }

    @Test
    void reapplyingAppliedBundleIsNoOp() throws IOException {
        write("def a():\n    return 1\n");
        put("a", "def a():\n    return 1", "def a():\n    return 2", 0);
        FileTransformationBundle first = applier.apply(store.getBundle(FILE), noSkips).bundle();

        ApplyReport second = applier.apply(first, noSkips);

        assertThat(read()).isEqualTo("def a():\n    return 2\n");
        assertThat(second.written()).isFalse();
        assertThat(second.rejected()).containsExactly(new SymbolKey(FILE, "a"));
        assertThat(store.getBundle(FILE).records()).extracting(TransformationRecord::status)
                .containsExactly(TransformationStatus.APPLIED);
    }

    @Test
    void rollbackRestoresOriginalBytes() throws IOException {
        String original = "header\ndef a(): pass\nmiddle\ndef b(): pass\nfooter\n";
        write(original);
        put("a", "def a(): pass", "def a():\n    return 'longer body'", 7);
        put("b", "def b(): pass", "b=1", 28);
        applier.apply(store.getBundle(FILE), noSkips);
        assertThat(read()).isEqualTo("header\ndef a():\n    return 'longer body'\nmiddle\nb=1\nfooter\n");

        List<TransformationRecord> rolledBack = applier.rollback(FILE, "verification failed");

        assertThat(read()).isEqualTo(original);
        assertThat(rolledBack).hasSize(2);
        assertThat(store.getBundle(FILE).records()).extracting(TransformationRecord::status)
                .containsOnly(TransformationStatus.ROLLED_BACK);
    }

    @Test
    void rollbackRefusesDriftedContent() throws IOException {
        write("def a(): pass\n");
        put("a", "def a(): pass", "def a(): return 1", 0);
        applier.apply(store.getBundle(FILE), noSkips);
        write("something else entirely\n");

        assertThatThrownBy(() -> applier.rollback(FILE, "verification failed"))
                .isInstanceOf(ApplyException.class)
                .hasMessageContaining("drifted");
        assertThat(read()).isEqualTo("something else entirely\n");
    }

    @Test
    void skipRuleMatchesBeforeApplying() throws IOException {
        write("def a(): pass\n");
        put("a", "def a(): pass", "def a(): return 1", 0);

        applier.apply(store.getBundle(FILE), SkipSet.of(projectRoot, List.of("a"), List.of()));

        assertThat(read()).isEqualTo("def a(): pass\n");
        TransformationRecord record = store.getBundle(FILE).records().get(0);
        assertThat(record.status()).isEqualTo(TransformationStatus.SKIPPED);
        assertThat(record.reason()).isEqualTo("skip rule a");
    }

    @Test
    void skipsUnchangedRecords() throws IOException {
        write("def a(): pass\n");
        put("a", "def a(): pass", "def a(): pass", 0);

        applier.apply(store.getBundle(FILE), noSkips);

        assertThat(store.getBundle(FILE).records().get(0).reason()).isEqualTo("unchanged");
    }

    @Test
    void appliesTwoSpansInOneAtomicWrite() throws IOException {
        String content = "0123456789AAAAA012345678901234BBBBB789";
        write(content);
        put("first", "AAAAA", "aaaaaaa", 10);
        put("second", "BBBBB", "bb", 30);

        ApplyReport report = applier.apply(store.getBundle(FILE), noSkips);

        assertThat(read()).isEqualTo("0123456789aaaaaaa012345678901234bb789");
        assertThat(report.applied()).extracting(TransformationRecord::symbolName, TransformationRecord::appliedOffset)
                .containsExactlyInAnyOrder(
                        Tuple.tuple("first", 10),
                        Tuple.tuple("second", 32));
    }

    @Test
    void equalLengthEditsMatchSplicingEachIntoTheOriginal() throws IOException {
        String content = "0123456789AAAAA012345678901234BBBBB789";
        write(content);
        put("first", "AAAAA", "aaaaa", 10);
        put("second", "BBBBB", "bbbbb", 30);

        ApplyReport report = applier.apply(store.getBundle(FILE), noSkips);

        String expected = content.substring(0, 10) + "aaaaa" + content.substring(15, 30) + "bbbbb"
                + content.substring(35);
        assertThat(read()).isEqualTo(expected).isEqualTo("0123456789aaaaa012345678901234bbbbb789");
        assertThat(report.written()).isTrue();
        assertThat(report.applied()).extracting(TransformationRecord::symbolName, TransformationRecord::appliedOffset)
                .containsExactlyInAnyOrder(
                        Tuple.tuple("first", 10),
                        Tuple.tuple("second", 30));
    }

    @Test
    void failsSecondOfTwoOverlappingSpans() throws IOException {
        write("abcdefghij");
        put("outer", "abcdef", "ABCDEF", 0);
        put("inner", "defg", "DEFG", 3);

        applier.apply(store.getBundle(FILE), noSkips);

        assertThat(read()).isEqualTo("ABCDEFghij");
        assertThat(store.getBundle(FILE).records())
                .filteredOn(record -> record.symbolName().equals("inner"))
                .singleElement()
                .satisfies(record -> assertThat(record.reason()).isEqualTo("overlapping span"));
    }

    @Test
    void locatesRecordWithoutSpanByUniqueOccurrence() throws IOException {
        write("x = 1\ndef a(): pass\n");
        store.put(TransformationRecord.pending(FILE, "a", "def a(): pass", "def a(): return 1", true,
                Checksums.crc32("def a(): pass"), null, "run-1", CLOCK.instant()));

        applier.apply(store.getBundle(FILE), noSkips);

        assertThat(read()).isEqualTo("x = 1\ndef a(): return 1\n");
        assertThat(store.getBundle(FILE).records().get(0).startByte()).isEqualTo(6);
    }

    @Test
    void failsRecordWithoutSpanWhenTextIsAmbiguous() throws IOException {
        write("pass\npass\n");
        store.put(TransformationRecord.pending(FILE, "p", "pass", "return", true,
                Checksums.crc32("pass"), null, "run-1", CLOCK.instant()));

        applier.apply(store.getBundle(FILE), noSkips);

        assertThat(store.getBundle(FILE).records().get(0).reason()).isEqualTo("ambiguous span");
        assertThat(read()).isEqualTo("pass\npass\n");
    }

    @Test
    void writeFailureFailsEveryAcceptedRecord() throws IOException {
        write("def a(): pass\n");
        put("a", "def a(): pass", "def a(): return 1", 0);
        AtomicFileWriter brokenWriter = new AtomicFileWriter() {
            @Override
            public void write(Path target, byte[] content) throws IOException {
                throw new IOException("disk full");
            }
        };
        TransformApplier failing = new TransformApplier(store, brokenWriter, CLOCK);

        ApplyReport report = failing.apply(store.getBundle(FILE), noSkips);

        assertThat(report.error()).contains("disk full");
        assertThat(store.getBundle(FILE).records().get(0).reason()).startsWith("apply error:");
        assertThat(read()).isEqualTo("def a(): pass\n");
    }

    private void put(String symbol, String original, String transformed, int start) {
        int end = start + original.getBytes(StandardCharsets.UTF_8).length;
        store.put(TransformationRecord.pending(FILE, symbol, original, transformed, !original.equals(transformed),
                Checksums.crc32(original), new ByteRange(start, end), "run-1", CLOCK.instant()));
    }

    private void write(String content) throws IOException {
        Path file = projectRoot.resolve(FILE);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private String read() throws IOException {
        return Files.readString(projectRoot.resolve(FILE), StandardCharsets.UTF_8);
    }
}
