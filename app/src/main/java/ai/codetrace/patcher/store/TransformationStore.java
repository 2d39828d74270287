package ai.codetrace.patcher.store;

import ai.codetrace.patcher.io.AtomicFileWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists transformation records per source file under
 * {@code <state-dir>/file_transformations/<sanitized-path>_transformations.json}.
 *
 * <p>Each file's records are guarded by the lock the store's {@link FileLockTable} hands out for that
 * file. Entries already present in a bundle file from earlier runs are kept verbatim and written back
 * ahead of the current run's records.
 */
public class TransformationStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformationStore.class);

    private final StateLayout layout;
    private final String runId;
    private final FileLockTable lockTable;
    private final RecordIngestor ingestor;
    private final AtomicFileWriter writer;
    private final ObjectMapper mapper;
    private final ConcurrentMap<Path, FileState> files = new ConcurrentHashMap<>();

    public TransformationStore(StateLayout layout, String runId, Clock clock) {
        this(layout, runId, new FileLockTable(), new RecordIngestor(clock), new AtomicFileWriter());
    }

    public TransformationStore(StateLayout layout, String runId, FileLockTable lockTable,
                               RecordIngestor ingestor, AtomicFileWriter writer) {
        this.layout = Objects.requireNonNull(layout, "layout");
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        this.runId = runId;
        this.lockTable = Objects.requireNonNull(lockTable, "lockTable");
        this.ingestor = Objects.requireNonNull(ingestor, "ingestor");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.mapper = JsonMappers.create();
    }

    /**
     * Records a pending transformation for the current run. Invalid records are logged and rejected;
     * this method does not throw for bad input.
     */
    public PutResult put(TransformationRecord record) {
        if (record == null) {
            LOGGER.warn("Rejected null transformation record");
            return PutResult.rejected("missing record", null);
        }
        String problem = validate(record);
        if (problem != null) {
            LOGGER.warn("Rejected transformation {}: {}", record.key(), problem);
            return PutResult.rejected(problem, record);
        }
        Path file = layout.resolve(record.filePath());
        return lockTable.withLock(file, () -> {
            FileState state = stateFor(file);
            boolean duplicate = state.current.stream()
                    .anyMatch(existing -> existing.key().equals(record.key()) && existing.status().isActive());
            if (duplicate) {
                LOGGER.warn("Rejected transformation {}: an active transformation already exists in run {}",
                        record.key(), runId);
                return PutResult.rejected("duplicate active transformation", record);
            }
            TransformationRecord stored = runId.equals(record.runId()) ? record : record.withRunId(runId);
            state.current.add(stored);
            persist(file, state);
            LOGGER.debug("Recorded transformation {} (changed={})", stored.key(), stored.changed());
            return PutResult.accepted(stored);
        });
    }

    public FileTransformationBundle getBundle(String filePath) {
        Path file = layout.resolve(filePath);
        return lockTable.withLock(file, () -> new FileTransformationBundle(filePath, stateFor(file).current));
    }

    /**
     * Replaces current-run records with the bundle's versions and persists the file.
     *
     * @throws IllegalStateException when a record is unknown or its status change is not a valid transition
     */
    public FileTransformationBundle update(FileTransformationBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        Path file = layout.resolve(bundle.filePath());
        return lockTable.withLock(file, () -> {
            FileState state = stateFor(file);
            Map<SymbolKey, Integer> positions = new HashMap<>();
            for (int i = 0; i < state.current.size(); i++) {
                positions.put(state.current.get(i).key(), i);
            }
            for (TransformationRecord replacement : bundle.records()) {
                Integer index = positions.get(replacement.key());
                if (index == null) {
                    throw new IllegalStateException("Unknown transformation " + replacement.key() + " in run " + runId);
                }
                TransformationRecord existing = state.current.get(index);
                if (existing.status() != replacement.status()
                        && !existing.status().canTransitionTo(replacement.status())) {
                    throw new IllegalStateException("Invalid transition %s -> %s for %s".formatted(
                            existing.status().wireName(), replacement.status().wireName(), replacement.key()));
                }
                state.current.set(index, replacement);
            }
            persist(file, state);
            return new FileTransformationBundle(bundle.filePath(), state.current);
        });
    }

    /**
     * Every readable record persisted for the file, earlier runs first.
     */
    public List<TransformationRecord> history(String filePath) {
        Path file = layout.resolve(filePath);
        return lockTable.withLock(file, () -> {
            FileState state = stateFor(file);
            List<TransformationRecord> records = new ArrayList<>();
            for (JsonNode node : state.previousRuns) {
                try {
                    records.add(ingestor.normalize(mapper.treeToValue(node, RawTransformationRecord.class)));
                } catch (JsonProcessingException | ValidationException ex) {
                    LOGGER.debug("Skipping unreadable history entry in {}: {}", file, ex.getMessage());
                }
            }
            records.addAll(state.current);
            return records;
        });
    }

    /**
     * Files that received records in this run.
     */
    public Set<Path> files() {
        return Collections.unmodifiableSet(files.keySet());
    }

    public Path resolve(String filePath) {
        return layout.resolve(filePath);
    }

    public FileLockTable lockTable() {
        return lockTable;
    }

    public StateLayout layout() {
        return layout;
    }

    public String runId() {
        return runId;
    }

    private static String validate(TransformationRecord record) {
        if (isBlank(record.filePath()) || isBlank(record.symbolName())) {
            return "missing identity fields";
        }
        if (record.originalCode() == null) {
            return "missing original_code";
        }
        if (record.transformedCode() == null || record.transformedCode().isBlank()) {
            return "empty";
        }
        if (record.status() != TransformationStatus.PENDING) {
            return "only pending transformations can be recorded";
        }
        return null;
    }

    // Callers hold the file's lock, so the load below happens once per file.
    private FileState stateFor(Path file) {
        FileState state = files.get(file);
        if (state == null) {
            state = loadPreviousRuns(file);
            files.put(file, state);
        }
        return state;
    }

    private FileState loadPreviousRuns(Path file) {
        FileState state = new FileState();
        Path bundleFile = layout.bundleFile(file);
        if (!Files.exists(bundleFile)) {
            return state;
        }
        try {
            JsonNode root = mapper.readTree(bundleFile.toFile());
            if (root instanceof ArrayNode array) {
                array.forEach(state.previousRuns::add);
                LOGGER.debug("Loaded {} earlier records from {}", state.previousRuns.size(), bundleFile);
                return state;
            }
            LOGGER.warn("Bundle file {} is not a JSON array; setting it aside", bundleFile);
        } catch (IOException ex) {
            LOGGER.warn("Bundle file {} is unreadable ({}); setting it aside", bundleFile, ex.getMessage());
        }
        setAside(bundleFile);
        return state;
    }

    private void setAside(Path bundleFile) {
        Path target = bundleFile.resolveSibling(bundleFile.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(bundleFile, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to set aside unreadable bundle " + bundleFile, ex);
        }
    }

    private void persist(Path file, FileState state) {
        Path bundleFile = layout.bundleFile(file);
        ArrayNode array = mapper.createArrayNode();
        state.previousRuns.forEach(array::add);
        state.current.forEach(record -> array.add(mapper.valueToTree(record)));
        try {
            writer.write(bundleFile, mapper.writeValueAsBytes(array));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to persist transformations to " + bundleFile, ex);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class FileState {
        private final List<JsonNode> previousRuns = new ArrayList<>();
        private final List<TransformationRecord> current = new ArrayList<>();
    }
}
