package ai.codetrace.patcher.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codetrace.patcher.config.ConfigLoader;
import ai.codetrace.patcher.config.EnvironmentReader;
import ai.codetrace.patcher.store.StateLayout;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final String SOURCE = "def f():\n    return 1\n";

    @TempDir
    Path projectRoot;

    @BeforeEach
    void writeSourceAndIndex() throws IOException {
        Path file = projectRoot.resolve("a.py");
        Files.writeString(file, SOURCE, StandardCharsets.UTF_8);
        Path index = StateLayout.defaults(projectRoot).symbolIndexFile(file);
        Files.createDirectories(index.getParent());
        Files.writeString(index, "[{\"symbol_name\": \"f\", \"start_byte\": 0, \"end_byte\": 21}]",
                StandardCharsets.UTF_8);
    }

    @Test
    void mockRunEditsFileAndWritesReport() throws IOException {
        int exitCode = application(Map.of()).run(new String[] {
                "--project-root", projectRoot.toString(),
                "--file", "a.py",
                "--transform-mode", "mock",
                "--workers", "1"
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(projectRoot.resolve("a.py"))).isEqualTo("[MOCK] " + SOURCE);
        assertThat(StateLayout.defaults(projectRoot).reportFile()).exists();
        assertThat(StateLayout.defaults(projectRoot).bundleFile(projectRoot.resolve("a.py"))).exists();
    }

    @Test
    void dryRunLeavesFileUntouched() throws IOException {
        int exitCode = application(Map.of()).run(new String[] {
                "--project-root", projectRoot.toString(),
                "--file", "a.py",
                "--transform-mode", "dry-run"
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(Files.readString(projectRoot.resolve("a.py"))).isEqualTo(SOURCE);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void fatalVerificationFailureExitsNonZeroAndRestoresFile() throws IOException {
        int exitCode = application(Map.of()).run(new String[] {
                "--project-root", projectRoot.toString(),
                "--file", "a.py",
                "--transform-mode", "mock",
                "--verify-cmd", "exit 1",
                "--verify-timeout", "10"
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FATAL_HALT);
        assertThat(Files.readString(projectRoot.resolve("a.py"))).isEqualTo(SOURCE);
    }

    @Test
    void invalidArgumentsReturnUsageError() {
        int exitCode = application(Map.of()).run(new String[] {"--workers", "many"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void unknownTransformModeReturnsUsageError() {
        int exitCode = application(Map.of()).run(new String[] {
                "--project-root", projectRoot.toString(),
                "--file", "a.py",
                "--transform-mode", "fast"
        });

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void missingInputReturnsUsageError() {
        int exitCode = application(Map.of()).run(new String[] {"--project-root", projectRoot.toString()});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void missingGeminiKeyIsASetupFailure() {
        int exitCode = application(Map.of("LLM_PROVIDER", "gemini")).run(new String[] {
                "--project-root", projectRoot.toString(),
                "--file", "a.py"
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_SETUP_FAILURE);
    }

    private static CliApplication application(Map<String, String> env) {
        EnvironmentReader reader = key -> Optional.ofNullable(env.get(key));
        return new CliApplication(new ConfigLoader(reader), CLOCK);
    }
}
