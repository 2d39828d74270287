package ai.codetrace.patcher.config;

import ai.codetrace.patcher.llm.TransformMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, the trace config file and the environment.
 */
public record Config(
        Path projectRoot,
        Path stateDirectory,
        List<String> sourcePatterns,
        List<String> files,
        Optional<Path> applyTransform,
        List<String> skipSymbols,
        List<String> skipCrc32,
        String verifyCommand,
        Duration verifyTimeout,
        int workers,
        String instruction,
        TransformMode transformMode,
        LogFormat logFormat,
        ModelConfig modelConfig,
        Secrets secrets
) {

    public Config {
        projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        Objects.requireNonNull(stateDirectory, "stateDirectory");
        sourcePatterns = sourcePatterns == null ? List.of() : List.copyOf(sourcePatterns);
        files = files == null ? List.of() : List.copyOf(files);
        applyTransform = applyTransform == null ? Optional.empty() : applyTransform;
        skipSymbols = skipSymbols == null ? List.of() : List.copyOf(skipSymbols);
        skipCrc32 = skipCrc32 == null ? List.of() : List.copyOf(skipCrc32);
        verifyCommand = verifyCommand == null ? "" : verifyCommand.trim();
        Objects.requireNonNull(verifyTimeout, "verifyTimeout");
        if (verifyTimeout.isNegative() || verifyTimeout.isZero()) {
            throw new IllegalArgumentException("verifyTimeout must be positive");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
        instruction = instruction == null ? "" : instruction;
        Objects.requireNonNull(transformMode, "transformMode");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(modelConfig, "modelConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
        if (applyTransform.isEmpty() && sourcePatterns.isEmpty() && files.isEmpty()) {
            throw new IllegalArgumentException("Nothing to do: pass --file, source_files in --config, or --apply-transform");
        }
    }

    public boolean isReplay() {
        return applyTransform.isPresent();
    }
}
