package ai.codetrace.patcher.config;

import ai.codetrace.patcher.cli.CliArguments;
import ai.codetrace.patcher.llm.TransformMode;
import ai.codetrace.patcher.store.StateLayout;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} from CLI arguments, the optional YAML trace config, environment variables and
 * defaults, in that order of precedence.
 */
public class ConfigLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_TRANSFORM_MODE = "TRANSFORM_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERIFY_CMD = "VERIFY_CMD";
    static final String ENV_VERIFY_TIMEOUT_SECONDS = "VERIFY_TIMEOUT_SECONDS";
    static final String ENV_TRANSFORM_WORKERS = "TRANSFORM_WORKERS";
    static final String ENV_TRACE_STATE_DIR = "TRACE_STATE_DIR";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_VERIFY_TIMEOUT_SECONDS = 300;
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 6;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 60;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;
    static final String DEFAULT_INSTRUCTION = "Improve the following symbol without changing its behavior.";

    private final EnvironmentReader environmentReader;
    private final TraceConfigReader traceConfigReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, new TraceConfigReader());
    }

    public ConfigLoader(EnvironmentReader environmentReader, TraceConfigReader traceConfigReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.traceConfigReader = Objects.requireNonNull(traceConfigReader, "traceConfigReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path projectRoot = arguments.projectRoot() != null
                ? arguments.projectRoot()
                : Path.of(System.getProperty("user.dir"));
        projectRoot = projectRoot.toAbsolutePath().normalize();
        TraceConfigFile file = arguments.configFile() == null
                ? TraceConfigFile.empty()
                : traceConfigReader.read(projectRoot.resolve(arguments.configFile()));

        Path stateDirectory = arguments.stateDirectory() != null
                ? arguments.stateDirectory()
                : Path.of(environmentReader.find(ENV_TRACE_STATE_DIR).orElse(StateLayout.DEFAULT_STATE_DIRECTORY));

        Optional<Path> applyTransform = Optional.ofNullable(arguments.applyTransform())
                .map(projectRoot::resolve);

        String verifyCommand = firstNonBlank(arguments.verifyCommand(), file.verifyCommand(), ENV_VERIFY_CMD)
                .orElse("");

        int timeoutSeconds = firstPresent(arguments.verifyTimeoutSeconds(), file.verifyTimeoutSeconds(),
                ENV_VERIFY_TIMEOUT_SECONDS).orElse(DEFAULT_VERIFY_TIMEOUT_SECONDS);
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("verify timeout must be at least one second");
        }

        int workers = firstPresent(arguments.workers(), file.workers(), ENV_TRANSFORM_WORKERS)
                .orElse(Runtime.getRuntime().availableProcessors());
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }

        List<String> skipSymbols = new ArrayList<>(file.skipSymbols());
        skipSymbols.addAll(splitList(arguments.skipSymbols()));
        List<String> skipCrc32 = new ArrayList<>(file.skipCrc32());
        skipCrc32.addAll(splitList(arguments.skipCrc32()));

        String instruction = firstNonBlank(arguments.instruction(), file.instruction(), null)
                .orElse(DEFAULT_INSTRUCTION);

        return new Config(projectRoot, stateDirectory, file.sourceFiles(), arguments.files(), applyTransform,
                skipSymbols, skipCrc32, verifyCommand, Duration.ofSeconds(timeoutSeconds), workers, instruction,
                resolveTransformMode(arguments), resolveLogFormat(arguments), resolveModelConfig(), resolveSecrets());
    }

    private ModelConfig resolveModelConfig() {
        LlmProvider provider = environmentReader.find(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = environmentReader.find(ENV_LLM_MODEL).orElse(provider.defaultModel());
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(environmentReader.find(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }
        return new ModelConfig(provider, modelName, baseUrl,
                environmentReader.find(ENV_LLM_MAX_RETRY_ATTEMPTS)
                        .map(value -> parseInteger(value, ENV_LLM_MAX_RETRY_ATTEMPTS))
                        .orElse(DEFAULT_LLM_MAX_RETRY_ATTEMPTS),
                environmentReader.find(ENV_LLM_INITIAL_BACKOFF_SECONDS)
                        .map(value -> parseInteger(value, ENV_LLM_INITIAL_BACKOFF_SECONDS))
                        .orElse(DEFAULT_LLM_INITIAL_BACKOFF_SECONDS),
                environmentReader.find(ENV_LLM_MAX_BACKOFF_SECONDS)
                        .map(value -> parseInteger(value, ENV_LLM_MAX_BACKOFF_SECONDS))
                        .orElse(DEFAULT_LLM_MAX_BACKOFF_SECONDS),
                environmentReader.find(ENV_LLM_RETRY_JITTER_FACTOR)
                        .map(ConfigLoader::parseDouble)
                        .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR));
    }

    private Secrets resolveSecrets() {
        return new Secrets(environmentReader.find(ENV_GEMINI_API_KEY));
    }

    private TransformMode resolveTransformMode(CliArguments arguments) {
        if (arguments.transformMode() != null) {
            return arguments.transformMode();
        }
        return environmentReader.find(ENV_TRANSFORM_MODE)
                .map(TransformMode::from)
                .orElse(TransformMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        if (arguments.logFormat() != null) {
            return arguments.logFormat();
        }
        return environmentReader.find(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<String> firstNonBlank(String cliValue, String fileValue, String envKey) {
        if (isNotBlank(cliValue)) {
            return Optional.of(cliValue.trim());
        }
        if (isNotBlank(fileValue)) {
            return Optional.of(fileValue.trim());
        }
        return envKey == null ? Optional.empty() : environmentReader.find(envKey);
    }

    private Optional<Integer> firstPresent(Integer cliValue, Integer fileValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        if (fileValue != null) {
            return Optional.of(fileValue);
        }
        return environmentReader.find(envKey).map(value -> parseInteger(value, envKey));
    }

    private static List<String> splitList(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .toList();
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInteger(String raw, String name) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }
}
