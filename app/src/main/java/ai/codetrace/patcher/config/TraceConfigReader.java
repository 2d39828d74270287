package ai.codetrace.patcher.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link TraceConfigFile}s from YAML.
 */
public class TraceConfigReader {

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    public TraceConfigFile read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Config file not found: " + file);
        }
        try {
            if (Files.size(file) == 0) {
                return TraceConfigFile.empty();
            }
            TraceConfigFile parsed = mapper.readValue(file.toFile(), TraceConfigFile.class);
            return parsed == null ? TraceConfigFile.empty() : parsed;
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid config file " + file + ": " + ex.getMessage(), ex);
        }
    }
}
