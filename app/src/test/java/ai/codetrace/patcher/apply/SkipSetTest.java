package ai.codetrace.patcher.apply;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codetrace.patcher.store.Checksums;
import ai.codetrace.patcher.store.TransformationRecord;
import ai.codetrace.patcher.symbol.ByteRange;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SkipSetTest {

    private final Path root = Path.of("/work/project");

    @Test
    void nameRuleMatchesSymbolInAnyFile() {
        SkipSet skipSet = SkipSet.of(root, List.of("helper"), List.of());

        assertThat(skipSet.match(record("src/a.py", "helper"))).contains("helper");
        assertThat(skipSet.match(record("lib/deep/b.py", "helper"))).contains("helper");
        assertThat(skipSet.match(record("src/a.py", "helper2"))).isEmpty();
    }

    @Test
    void fullPathRuleMatchesOnlyThatFile() {
        SkipSet skipSet = SkipSet.of(root, List.of("src/a.py/helper"), List.of());

        assertThat(skipSet.match(record("src/a.py", "helper"))).contains("src/a.py/helper");
        assertThat(skipSet.match(record("lib/a.py", "helper"))).isEmpty();
    }

    @Test
    void absoluteRuleAndWildcards() {
        SkipSet skipSet = SkipSet.of(root, List.of("/work/project/src/*.py/test_*", "Cls.?et"), List.of());

        assertThat(skipSet.match(record("src/a.py", "test_one"))).isPresent();
        assertThat(skipSet.match(record("src/a.py", "Cls.get"))).contains("Cls.?et");
        assertThat(skipSet.match(record("src/a.py", "run"))).isEmpty();
    }

    @Test
    void blankAndMalformedRulesNeverMatch() {
        SkipSet skipSet = SkipSet.of(root, List.of(" ", "[abc"), List.of());

        assertThat(skipSet.isEmpty()).isTrue();
        assertThat(skipSet.match(record("src/a.py", "[abc"))).isEmpty();
    }

    @Test
    void checksumRuleMatchesHexOfOriginalText() {
        String hex = Checksums.toHex(Checksums.crc32("body of f"));
        SkipSet skipSet = SkipSet.of(root, List.of(), List.of("0x" + hex.toUpperCase()));

        assertThat(skipSet.match(record("src/a.py", "f"))).contains("crc32:" + hex);
    }

    @Test
    void characterClassesFollowShellSemantics() {
        SkipSet skipSet = SkipSet.of(root, List.of("f[0-9]", "g[!x]"), List.of());

        assertThat(skipSet.match(record("a.py", "f7"))).isPresent();
        assertThat(skipSet.match(record("a.py", "fx"))).isEmpty();
        assertThat(skipSet.match(record("a.py", "gy"))).isPresent();
        assertThat(skipSet.match(record("a.py", "gx"))).isEmpty();
    }

    private static TransformationRecord record(String file, String symbol) {
        return TransformationRecord.pending(file, symbol, "body of f", "new", true, Checksums.crc32("body of f"),
                new ByteRange(0, 9), "run-1", Instant.EPOCH);
    }
}
