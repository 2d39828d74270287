package ai.codetrace.patcher.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.codetrace.patcher.store.StateLayout;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SymbolIndexExtractorTest {

    @TempDir
    Path projectRoot;

    @Test
    void slicesSymbolsInOffsetOrder() throws IOException {
        Path file = write("pkg/mod.py", "def a():\n    pass\n\ndef b():\n    pass\n");
        index(file, """
                [
                  {"symbol_name": "b", "start_byte": 19, "end_byte": 36, "kind": "function"},
                  {"symbol_name": "a", "start_byte": 0, "end_byte": 17}
                ]
                """);

        List<SymbolSpan> spans = new SymbolIndexExtractor(layout()).extract(file);

        assertThat(spans).extracting(SymbolSpan::symbolName).containsExactly("a", "b");
        assertThat(spans.get(0).file()).isEqualTo("pkg/mod.py");
        assertThat(spans.get(0).originalText()).isEqualTo("def a():\n    pass");
        assertThat(spans.get(1).originalText()).isEqualTo("def b():\n    pass");
        assertThat(spans.get(1).range()).isEqualTo(new ByteRange(19, 36));
    }

    @Test
    void dropsOutOfRangeAndOverlappingEntries() throws IOException {
        Path file = write("mod.py", "def a():\n    pass\n");
        index(file, """
                [
                  {"symbol_name": "a", "start_byte": 0, "end_byte": 17},
                  {"symbol_name": "inner", "start_byte": 4, "end_byte": 8},
                  {"symbol_name": "ghost", "start_byte": 10, "end_byte": 400}
                ]
                """);

        List<SymbolSpan> spans = new SymbolIndexExtractor(layout()).extract(file);

        assertThat(spans).extracting(SymbolSpan::symbolName).containsExactly("a");
    }

    @Test
    void multiByteTextIsSlicedByBytes() throws IOException {
        Path file = write("mod.py", "# é\nx = 'ü'\n");
        index(file, "[{\"symbol_name\": \"x\", \"start_byte\": 5, \"end_byte\": 13}]");

        List<SymbolSpan> spans = new SymbolIndexExtractor(layout()).extract(file);

        assertThat(spans).singleElement().satisfies(span -> assertThat(span.originalText()).isEqualTo("x = 'ü'"));
    }

    @Test
    void missingIndexYieldsNoSymbols() throws IOException {
        Path file = write("mod.py", "x = 1\n");

        assertThat(new SymbolIndexExtractor(layout()).extract(file)).isEmpty();
    }

    @Test
    void corruptIndexIsAnExtractionFailure() throws IOException {
        Path file = write("mod.py", "x = 1\n");
        index(file, "{not json");

        assertThatThrownBy(() -> new SymbolIndexExtractor(layout()).extract(file))
                .isInstanceOf(SymbolExtractionException.class)
                .hasMessageContaining("mod.py");
    }

    private StateLayout layout() {
        return StateLayout.defaults(projectRoot);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = projectRoot.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private void index(Path file, String json) throws IOException {
        Path index = layout().symbolIndexFile(file);
        Files.createDirectories(index.getParent());
        Files.writeString(index, json, StandardCharsets.UTF_8);
    }
}
