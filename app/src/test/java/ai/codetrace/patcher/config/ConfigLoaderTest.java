package ai.codetrace.patcher.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.codetrace.patcher.cli.CliArguments;
import ai.codetrace.patcher.llm.TransformMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ConfigLoaderTest {

    @TempDir
    Path projectRoot;

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments arguments = CommandLine.populateCommand(new CliArguments(),
                "--project-root", projectRoot.toString(),
                "--file", "src/a.py",
                "--file", "src/b.py",
                "--skip-symbols", "helper,src/a.py/main",
                "--skip-crc32", "DEADBEEF",
                "--verify-cmd", "python -m py_compile {files}",
                "--verify-timeout", "30",
                "--workers", "3",
                "--transform-mode", "mock",
                "--log-format", "json",
                "--instruction", "Add type hints.");

        Config config = new ConfigLoader(key -> Optional.empty()).load(arguments);

        assertThat(config.projectRoot()).isEqualTo(projectRoot.toAbsolutePath().normalize());
        assertThat(config.files()).containsExactly("src/a.py", "src/b.py");
        assertThat(config.skipSymbols()).containsExactly("helper", "src/a.py/main");
        assertThat(config.skipCrc32()).containsExactly("DEADBEEF");
        assertThat(config.verifyCommand()).isEqualTo("python -m py_compile {files}");
        assertThat(config.verifyTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.workers()).isEqualTo(3);
        assertThat(config.transformMode()).isEqualTo(TransformMode.MOCK);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.instruction()).isEqualTo("Add type hints.");
        assertThat(config.isReplay()).isFalse();
        assertThat(config.modelConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.modelConfig().baseUrl()).contains("http://localhost:11434");
        assertThat(config.secrets().geminiApiKey()).isEmpty();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_VERIFY_CMD, "make check",
                ConfigLoader.ENV_VERIFY_TIMEOUT_SECONDS, "45",
                ConfigLoader.ENV_TRANSFORM_WORKERS, "2",
                ConfigLoader.ENV_TRANSFORM_MODE, "dry-run",
                ConfigLoader.ENV_LLM_PROVIDER, "gemini",
                ConfigLoader.ENV_GEMINI_API_KEY, "secret",
                ConfigLoader.ENV_TRACE_STATE_DIR, ".trace");
        CliArguments arguments = CommandLine.populateCommand(new CliArguments(),
                "--project-root", projectRoot.toString(), "--file", "a.py");

        Config config = new ConfigLoader(environment(env)).load(arguments);

        assertThat(config.verifyCommand()).isEqualTo("make check");
        assertThat(config.verifyTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(config.workers()).isEqualTo(2);
        assertThat(config.transformMode()).isEqualTo(TransformMode.DRY_RUN);
        assertThat(config.stateDirectory()).isEqualTo(Path.of(".trace"));
        assertThat(config.modelConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(config.modelConfig().modelName()).isEqualTo(LlmProvider.GEMINI.defaultModel());
        assertThat(config.modelConfig().baseUrl()).isEmpty();
        assertThat(config.secrets().geminiApiKey()).contains("secret");
        assertThat(config.instruction()).isEqualTo(ConfigLoader.DEFAULT_INSTRUCTION);
    }

    @Test
    void yamlConfigSitsBetweenCliAndEnvironment() throws IOException {
        Files.writeString(projectRoot.resolve("trace.yaml"), """
                source_files:
                  - "src/**/*.py"
                verify_cmd: pytest -q
                verify_timeout_seconds: 120
                skip_symbols: legacy_entry
                skip_crc32:
                  - 0a0b0c0d
                instruction: Remove dead code.
                """);
        CliArguments arguments = CommandLine.populateCommand(new CliArguments(),
                "--project-root", projectRoot.toString(),
                "--config", "trace.yaml",
                "--verify-timeout", "10",
                "--skip-symbols", "other");

        Config config = new ConfigLoader(environment(Map.of(ConfigLoader.ENV_VERIFY_CMD, "make check"))).load(arguments);

        assertThat(config.sourcePatterns()).containsExactly("src/**/*.py");
        assertThat(config.verifyCommand()).isEqualTo("pytest -q");
        assertThat(config.verifyTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.skipSymbols()).containsExactly("legacy_entry", "other");
        assertThat(config.skipCrc32()).containsExactly("0a0b0c0d");
        assertThat(config.instruction()).isEqualTo("Remove dead code.");
    }

    @Test
    void replayNeedsNoSourceFiles() {
        CliArguments arguments = CommandLine.populateCommand(new CliArguments(),
                "--project-root", projectRoot.toString(),
                "--apply-transform", "trace_debug/file_transformations/a.py_transformations.json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(arguments);

        assertThat(config.isReplay()).isTrue();
        assertThat(config.applyTransform())
                .contains(projectRoot.resolve("trace_debug/file_transformations/a.py_transformations.json"));
    }

    @Test
    void nothingToProcessIsRejected() {
        CliArguments arguments = CommandLine.populateCommand(new CliArguments(),
                "--project-root", projectRoot.toString());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(arguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Nothing to do");
    }

    @Test
    void invalidEnvironmentNumberIsRejected() {
        CliArguments arguments = CommandLine.populateCommand(new CliArguments(),
                "--project-root", projectRoot.toString(), "--file", "a.py");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(
                environment(Map.of(ConfigLoader.ENV_TRANSFORM_WORKERS, "many"))).load(arguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_TRANSFORM_WORKERS);
    }

    private static EnvironmentReader environment(Map<String, String> values) {
        return key -> Optional.ofNullable(values.get(key));
    }
}
