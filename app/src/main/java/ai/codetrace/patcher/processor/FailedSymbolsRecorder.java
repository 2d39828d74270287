package ai.codetrace.patcher.processor;

import ai.codetrace.patcher.io.AtomicFileWriter;
import ai.codetrace.patcher.store.Checksums;
import ai.codetrace.patcher.store.JsonMappers;
import ai.codetrace.patcher.store.StateLayout;
import ai.codetrace.patcher.store.TransformationRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the symbols of a halted file, with their CRC32 values, so a later run can skip them
 * through {@code --skip-crc32}.
 */
public class FailedSymbolsRecorder {

    private static final Logger LOGGER = LoggerFactory.getLogger(FailedSymbolsRecorder.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final StateLayout layout;
    private final AtomicFileWriter writer;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMappers.create();

    public FailedSymbolsRecorder(StateLayout layout, AtomicFileWriter writer, Clock clock) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return the written file, empty when there was nothing to record or the write failed
     */
    public Optional<Path> record(String filePath, List<TransformationRecord> records) {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Path target = layout.failedSymbolsFile(layout.resolve(filePath), FILE_STAMP.format(now));
        ObjectNode root = mapper.createObjectNode();
        root.put("file_path", filePath);
        ArrayNode symbols = root.putArray("failed_symbols");
        ArrayNode checksums = root.putArray("crc32_list");
        for (TransformationRecord record : records) {
            symbols.add(record.symbolName());
            checksums.add(Checksums.toHex(record.checksum()));
        }
        root.put("timestamp", now.toString());
        try {
            writer.write(target, mapper.writeValueAsBytes(root));
            LOGGER.info("Recorded {} failed symbol(s) of {} in {}", records.size(), filePath, target);
            return Optional.of(target);
        } catch (IOException ex) {
            LOGGER.error("Could not record failed symbols of {}: {}", filePath, ex.getMessage(), ex);
            return Optional.empty();
        }
    }
}
