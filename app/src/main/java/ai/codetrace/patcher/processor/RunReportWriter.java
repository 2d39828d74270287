package ai.codetrace.patcher.processor;

import ai.codetrace.patcher.io.AtomicFileWriter;
import ai.codetrace.patcher.store.JsonMappers;
import ai.codetrace.patcher.store.StateLayout;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the run summary and writes it to {@code run_report.json} in the state directory.
 */
public class RunReportWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunReportWriter.class);

    private final StateLayout layout;
    private final AtomicFileWriter writer;
    private final ObjectMapper mapper = JsonMappers.create();

    public RunReportWriter(StateLayout layout, AtomicFileWriter writer) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public Path write(RunSummary summary) {
        log(summary);
        Path target = layout.reportFile();
        try {
            writer.write(target, mapper.writeValueAsBytes(toJson(summary)));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write run report " + target, ex);
        }
        return target;
    }

    ObjectNode toJson(RunSummary summary) {
        ObjectNode root = mapper.createObjectNode();
        root.put("run_id", summary.runId());
        ObjectNode counts = root.putObject("counts");
        counts.put("applied", summary.applied());
        counts.put("skipped", summary.skipped());
        counts.put("failed", summary.failed());
        counts.put("rolled_back", summary.rolledBack());
        counts.put("cancelled_files", summary.cancelled());
        ArrayNode files = root.putArray("files");
        for (FileOutcome outcome : summary.files()) {
            ObjectNode file = files.addObject();
            file.put("file_path", outcome.filePath());
            file.put("verification", outcome.verification() == null ? null : outcome.verification().name().toLowerCase(Locale.ROOT));
            file.put("fatal", outcome.fatal());
            file.put("note", outcome.note());
            ArrayNode symbols = file.putArray("symbols");
            for (SymbolOutcome symbol : outcome.symbols()) {
                symbols.addObject()
                        .put("symbol_name", symbol.symbolName())
                        .put("status", symbol.status().wireName())
                        .put("reason", symbol.reason());
            }
        }
        ArrayNode halts = root.putArray("fatal_halts");
        summary.fatalHalts().forEach(halt -> halts.addObject()
                .put("file_path", halt.filePath())
                .put("reason", halt.note()));
        return root;
    }

    private void log(RunSummary summary) {
        LOGGER.info("Run {}: {} applied, {} skipped, {} failed, {} rolled back across {} file(s)",
                summary.runId(), summary.applied(), summary.skipped(), summary.failed(), summary.rolledBack(),
                summary.files().size());
        for (FileOutcome outcome : summary.files()) {
            for (SymbolOutcome symbol : outcome.symbols()) {
                if (symbol.reason() != null) {
                    LOGGER.info("  {}/{}: {} ({})", outcome.filePath(), symbol.symbolName(),
                            symbol.status().wireName(), symbol.reason());
                }
            }
        }
        summary.fatalHalts().forEach(halt -> LOGGER.error("Fatal halt in {}: {}", halt.filePath(), halt.note()));
        if (summary.cancelled() > 0) {
            LOGGER.warn("{} file(s) were not started because the run was cancelled", summary.cancelled());
        }
    }
}
