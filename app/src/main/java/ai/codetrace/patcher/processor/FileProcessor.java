package ai.codetrace.patcher.processor;

import ai.codetrace.patcher.apply.ApplyReport;
import ai.codetrace.patcher.apply.TransformApplier;
import ai.codetrace.patcher.llm.TransformClient;
import ai.codetrace.patcher.llm.TransformException;
import ai.codetrace.patcher.llm.TransformResponse;
import ai.codetrace.patcher.logging.LoggingConfigurator;
import ai.codetrace.patcher.store.FileTransformationBundle;
import ai.codetrace.patcher.store.JsonMappers;
import ai.codetrace.patcher.store.PutResult;
import ai.codetrace.patcher.store.RawTransformationRecord;
import ai.codetrace.patcher.store.RecordIngestor;
import ai.codetrace.patcher.store.SymbolKey;
import ai.codetrace.patcher.store.TransformationRecord;
import ai.codetrace.patcher.store.TransformationStore;
import ai.codetrace.patcher.store.ValidationException;
import ai.codetrace.patcher.symbol.SymbolExtractionException;
import ai.codetrace.patcher.symbol.SymbolExtractor;
import ai.codetrace.patcher.symbol.SymbolSpan;
import ai.codetrace.patcher.verify.VerificationGate;
import ai.codetrace.patcher.verify.VerificationReport;
import ai.codetrace.patcher.verify.Verifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the extract, transform, record, apply and verify pipeline for many files on a bounded pool.
 * A failure inside one file's task halts that file only.
 */
public class FileProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileProcessor.class);

    private final SymbolExtractor extractor;
    private final TransformClient client;
    private final TransformationStore store;
    private final RecordIngestor ingestor;
    private final TransformApplier applier;
    private final Verifier verifier;
    private final FailedSymbolsRecorder failedSymbolsRecorder;
    private final RunCancellation cancellation;
    private final ObjectMapper mapper = JsonMappers.create();

    public FileProcessor(SymbolExtractor extractor, TransformClient client, TransformationStore store,
                         RecordIngestor ingestor, TransformApplier applier, Verifier verifier,
                         FailedSymbolsRecorder failedSymbolsRecorder, RunCancellation cancellation) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.client = Objects.requireNonNull(client, "client");
        this.store = Objects.requireNonNull(store, "store");
        this.ingestor = Objects.requireNonNull(ingestor, "ingestor");
        this.applier = Objects.requireNonNull(applier, "applier");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.failedSymbolsRecorder = Objects.requireNonNull(failedSymbolsRecorder, "failedSymbolsRecorder");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
    }

    public RunSummary run(List<Path> files, RunOptions options) {
        Objects.requireNonNull(options, "options");
        List<String> relative = files.stream().map(file -> store.layout().relativize(file)).distinct().toList();
        VerificationGate gate = VerificationGate.forCommand(options.verifyCommand());
        LOGGER.info("Processing {} file(s) with {} worker(s), run {}", relative.size(), options.workers(),
                store.runId());
        return execute(relative, options, file -> processFile(file, options, gate));
    }

    /**
     * Re-applies the transformations stored in a bundle file or a legacy keyed transformation file.
     * Every record is re-issued as pending in this run, so content that already carries an edit fails
     * its checksum instead of being patched twice.
     */
    public RunSummary replay(Path transformFile, RunOptions options) {
        Objects.requireNonNull(options, "options");
        Map<SymbolKey, RawTransformationRecord> latest = readTransformFile(transformFile);
        Map<String, List<SymbolOutcome>> perFile = new LinkedHashMap<>();
        for (RawTransformationRecord raw : latest.values()) {
            String filePath = raw.filePath();
            try {
                TransformationRecord record = ingestor.replay(raw, store.runId());
                PutResult result = store.put(record);
                if (!result.accepted()) {
                    perFile.computeIfAbsent(filePath, key -> new ArrayList<>())
                            .add(rejectionOutcome(record.symbolName(), result.reason()));
                } else {
                    perFile.computeIfAbsent(filePath, key -> new ArrayList<>());
                }
            } catch (ValidationException ex) {
                LOGGER.warn("Ignoring transformation {}: {}", raw.describe(), ex.getMessage());
                if (filePath != null && !filePath.isBlank() && raw.symbolName() != null) {
                    perFile.computeIfAbsent(filePath, key -> new ArrayList<>())
                            .add(SymbolOutcome.failed(raw.symbolName(), "invalid record: " + ex.getMessage()));
                }
            }
        }
        VerificationGate gate = VerificationGate.forCommand(options.verifyCommand());
        LOGGER.info("Replaying {} transformation(s) across {} file(s) from {}", latest.size(), perFile.size(),
                transformFile);
        return execute(List.copyOf(perFile.keySet()), options,
                file -> gate.run(() -> applyAndVerify(file, options, perFile.get(file))));
    }

    private RunSummary execute(List<String> files, RunOptions options, Function<String, FileOutcome> task) {
        ExecutorService executor = Executors.newFixedThreadPool(options.workers());
        List<Future<FileOutcome>> futures = new ArrayList<>();
        try {
            for (String file : files) {
                futures.add(executor.submit(() -> guarded(file, task)));
            }
        } finally {
            executor.shutdown();
        }
        List<FileOutcome> outcomes = new ArrayList<>();
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            String file = files.get(i);
            while (true) {
                try {
                    outcomes.add(futures.get(i).get());
                    break;
                } catch (InterruptedException ex) {
                    // tasks still queued see the flag and finish as cancelled; running ones are awaited
                    if (!interrupted) {
                        LOGGER.warn("Interrupted while waiting for {}; cancelling the run", file);
                        cancellation.cancel();
                    }
                    interrupted = true;
                } catch (ExecutionException ex) {
                    outcomes.add(FileOutcome.halted(file, List.of(), "unexpected error: " + ex.getCause()));
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return new RunSummary(store.runId(), outcomes);
    }

    private FileOutcome guarded(String file, Function<String, FileOutcome> task) {
        if (cancellation.isCancelled()) {
            LOGGER.info("Not starting {}: run cancelled", file);
            return FileOutcome.cancelled(file);
        }
        LoggingConfigurator.enterFile(file);
        try {
            return task.apply(file);
        } catch (RuntimeException ex) {
            LOGGER.error("Halting {}: {}", file, ex.getMessage(), ex);
            return FileOutcome.halted(file, outcomesOf(file), "unexpected error: " + ex);
        } finally {
            LoggingConfigurator.leaveFile();
        }
    }

    private FileOutcome processFile(String file, RunOptions options, VerificationGate gate) {
        List<SymbolSpan> spans;
        try {
            spans = extractor.extract(store.resolve(file));
        } catch (SymbolExtractionException ex) {
            LOGGER.error("Symbol extraction failed for {}: {}", file, ex.getMessage());
            return new FileOutcome(file, List.of(), null, false, "symbol extraction failed: " + ex.getMessage());
        }
        List<SymbolOutcome> early = new ArrayList<>();
        for (SymbolSpan span : spans) {
            LoggingConfigurator.enterSymbol(span.symbolName());
            try {
                TransformResponse response = client.transform(span.originalText(), options.instruction());
                TransformationRecord record = ingestor.fromResponse(span, response, store.runId());
                PutResult result = store.put(record);
                if (!result.accepted()) {
                    early.add(rejectionOutcome(span.symbolName(), result.reason()));
                }
            } catch (TransformException ex) {
                LOGGER.warn("Transformation of {} failed: {}", span.symbolName(), ex.getMessage());
                early.add(SymbolOutcome.failed(span.symbolName(), "transform error: " + ex.getMessage()));
            } catch (ValidationException ex) {
                LOGGER.warn("Discarding response for {}: {}", span.symbolName(), ex.getMessage());
                early.add(SymbolOutcome.failed(span.symbolName(), "invalid response: " + ex.getMessage()));
            } finally {
                LoggingConfigurator.leaveSymbol();
            }
        }
        return gate.run(() -> applyAndVerify(file, options, early));
    }

    private FileOutcome applyAndVerify(String file, RunOptions options, List<SymbolOutcome> early) {
        FileTransformationBundle bundle = store.getBundle(file);
        if (bundle.isEmpty()) {
            return new FileOutcome(file, early, null, false, null);
        }
        ApplyReport report = applier.apply(bundle, options.skipSet());
        VerificationReport verification = null;
        if (report.hasApplied()) {
            verification = verifier.run(List.of(file), options.verifyCommand(), options.verifyTimeout());
        }
        List<SymbolOutcome> symbols = new ArrayList<>(early);
        symbols.addAll(outcomesOf(file));
        if (verification != null && verification.isFatal()) {
            failedSymbolsRecorder.record(file, verification.rolledBack().isEmpty()
                    ? report.applied()
                    : verification.rolledBack());
            return new FileOutcome(file, symbols, verification.status(), true, verification.message());
        }
        return new FileOutcome(file, symbols, verification == null ? null : verification.status(), false,
                report.error());
    }

    private List<SymbolOutcome> outcomesOf(String file) {
        try {
            return store.getBundle(file).records().stream().map(SymbolOutcome::of).toList();
        } catch (RuntimeException ex) {
            LOGGER.debug("Cannot read outcomes of {}: {}", file, ex.getMessage());
            return List.of();
        }
    }

    private static SymbolOutcome rejectionOutcome(String symbolName, String reason) {
        if ("empty".equals(reason)) {
            return SymbolOutcome.skipped(symbolName, reason);
        }
        return SymbolOutcome.failed(symbolName, "rejected: " + reason);
    }

    Map<SymbolKey, RawTransformationRecord> readTransformFile(Path transformFile) {
        JsonNode root;
        try {
            root = mapper.readTree(transformFile.toFile());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read transformation file " + transformFile, ex);
        }
        List<JsonNode> entries = new ArrayList<>();
        if (root != null && root.isArray()) {
            root.forEach(entries::add);
        } else if (root != null && root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isObject()) {
                    entries.add(withKeyIdentity(field.getKey(), (ObjectNode) field.getValue()));
                }
            }
        } else {
            throw new IllegalArgumentException("Transformation file must hold a JSON array or object: " + transformFile);
        }

        Map<SymbolKey, RawTransformationRecord> latest = new LinkedHashMap<>();
        for (JsonNode entry : entries) {
            try {
                RawTransformationRecord raw = mapper.treeToValue(entry, RawTransformationRecord.class);
                if (raw.filePath() == null || raw.symbolName() == null) {
                    LOGGER.warn("Ignoring transformation without identity: {}", raw.describe());
                    continue;
                }
                latest.remove(new SymbolKey(raw.filePath(), raw.symbolName()));
                latest.put(new SymbolKey(raw.filePath(), raw.symbolName()), raw);
            } catch (JsonProcessingException ex) {
                LOGGER.warn("Ignoring malformed transformation entry: {}", ex.getOriginalMessage());
            }
        }
        return latest;
    }

    // Legacy files are keyed by "<file path>/<symbol name>".
    private static JsonNode withKeyIdentity(String key, ObjectNode value) {
        int slash = key.lastIndexOf('/');
        if (slash > 0 && slash < key.length() - 1) {
            if (!value.hasNonNull("file_path")) {
                value.put("file_path", key.substring(0, slash));
            }
            if (!value.hasNonNull("symbol_name")) {
                value.put("symbol_name", key.substring(slash + 1));
            }
        }
        return value;
    }
}
