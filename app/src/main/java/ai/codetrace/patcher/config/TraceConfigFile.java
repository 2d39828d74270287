package ai.codetrace.patcher.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Contents of the optional YAML trace configuration. Absent keys are {@code null} or empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TraceConfigFile(
        @JsonProperty("source_files") List<String> sourceFiles,
        @JsonProperty("verify_cmd") String verifyCommand,
        @JsonProperty("verify_timeout_seconds") Integer verifyTimeoutSeconds,
        @JsonProperty("skip_symbols") List<String> skipSymbols,
        @JsonProperty("skip_crc32") List<String> skipCrc32,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("instruction") String instruction
) {

    public TraceConfigFile {
        sourceFiles = sourceFiles == null ? List.of() : List.copyOf(sourceFiles);
        skipSymbols = skipSymbols == null ? List.of() : List.copyOf(skipSymbols);
        skipCrc32 = skipCrc32 == null ? List.of() : List.copyOf(skipCrc32);
    }

    public static TraceConfigFile empty() {
        return new TraceConfigFile(List.of(), null, null, List.of(), List.of(), null, null);
    }
}
