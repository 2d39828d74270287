package ai.codetrace.patcher.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Loosely typed transformation payload as it arrives from disk or from upstream tooling.
 * Every field is optional here; {@link RecordIngestor} decides what is acceptable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawTransformationRecord(
        @JsonProperty("file_path") String filePath,
        @JsonProperty("symbol_name") String symbolName,
        @JsonProperty("original_code") Object originalCode,
        @JsonProperty("transformed_code") Object transformedCode,
        @JsonProperty("is_changed") Object isChanged,
        @JsonProperty("checksum") Object checksum,
        @JsonProperty("start_byte") Integer startByte,
        @JsonProperty("end_byte") Integer endByte,
        @JsonProperty("status") String status,
        @JsonProperty("reason") String reason,
        @JsonProperty("applied_offset") Integer appliedOffset,
        @JsonProperty("run_id") String runId,
        @JsonProperty("timestamp") String timestamp
) {

    public String describe() {
        return (filePath == null ? "<no file>" : filePath) + "/" + (symbolName == null ? "<no symbol>" : symbolName);
    }
}
