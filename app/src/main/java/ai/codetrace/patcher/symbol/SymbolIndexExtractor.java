package ai.codetrace.patcher.symbol;

import ai.codetrace.patcher.store.JsonMappers;
import ai.codetrace.patcher.store.StateLayout;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads symbol boundaries from the index written by the external parser under
 * {@code <state-dir>/symbol_index/} and slices each symbol's text out of the live file.
 */
public class SymbolIndexExtractor implements SymbolExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SymbolIndexExtractor.class);

    private final StateLayout layout;
    private final ObjectMapper mapper;

    public SymbolIndexExtractor(StateLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.mapper = JsonMappers.create();
    }

    @Override
    public List<SymbolSpan> extract(Path file) {
        Path indexFile = layout.symbolIndexFile(file);
        if (!Files.exists(indexFile)) {
            LOGGER.info("No symbol index for {} at {}", file, indexFile);
            return List.of();
        }
        List<IndexEntry> entries;
        byte[] content;
        try {
            entries = mapper.readValue(indexFile.toFile(), new TypeReference<List<IndexEntry>>() { });
            content = Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new SymbolExtractionException("Failed to read symbol index for " + file, ex);
        }

        String relative = layout.relativize(file);
        List<IndexEntry> sorted = new ArrayList<>(entries);
        sorted.removeIf(Objects::isNull);
        sorted.sort(Comparator.comparingInt(IndexEntry::startByte));
        List<SymbolSpan> spans = new ArrayList<>();
        ByteRange previous = null;
        for (IndexEntry entry : sorted) {
            if (entry.symbolName() == null || entry.symbolName().isBlank()
                    || entry.startByte() < 0 || entry.endByte() < entry.startByte()
                    || entry.endByte() > content.length) {
                LOGGER.warn("Dropping out-of-range symbol {} ({}-{}) in {}", entry.symbolName(), entry.startByte(),
                        entry.endByte(), relative);
                continue;
            }
            ByteRange range = new ByteRange(entry.startByte(), entry.endByte());
            if (previous != null && previous.overlaps(range)) {
                LOGGER.warn("Dropping symbol {} overlapping an earlier symbol in {}", entry.symbolName(), relative);
                continue;
            }
            String text = new String(content, range.start(), range.length(), StandardCharsets.UTF_8);
            spans.add(new SymbolSpan(relative, entry.symbolName(), range, text));
            previous = range;
        }
        LOGGER.debug("Extracted {} symbol(s) from {}", spans.size(), relative);
        return spans;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IndexEntry(
            @JsonProperty("symbol_name") String symbolName,
            @JsonProperty("start_byte") int startByte,
            @JsonProperty("end_byte") int endByte
    ) {
    }
}
