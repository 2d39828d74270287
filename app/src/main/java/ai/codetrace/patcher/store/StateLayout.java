package ai.codetrace.patcher.store;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Locations of everything the pipeline persists for a project, rooted at the state directory
 * ({@code trace_debug} by default).
 */
public record StateLayout(Path projectRoot, Path stateDirectory) {

    public static final String DEFAULT_STATE_DIRECTORY = "trace_debug";

    public StateLayout {
        projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        stateDirectory = projectRoot.resolve(Objects.requireNonNull(stateDirectory, "stateDirectory"))
                .toAbsolutePath()
                .normalize();
    }

    public static StateLayout defaults(Path projectRoot) {
        return new StateLayout(projectRoot, Path.of(DEFAULT_STATE_DIRECTORY));
    }

    public Path resolve(String filePath) {
        return projectRoot.resolve(filePath).toAbsolutePath().normalize();
    }

    public String relativize(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path shown = absolute.startsWith(projectRoot) ? projectRoot.relativize(absolute) : absolute;
        return shown.toString().replace('\\', '/');
    }

    public Path bundleFile(Path sourceFile) {
        return stateDirectory.resolve("file_transformations")
                .resolve(sanitize(relativize(sourceFile)) + "_transformations.json");
    }

    public Path symbolIndexFile(Path sourceFile) {
        return stateDirectory.resolve("symbol_index").resolve(sanitize(relativize(sourceFile)) + "_symbols.json");
    }

    public Path failedSymbolsFile(Path sourceFile, String timestamp) {
        return stateDirectory.resolve("failed_symbols_" + sanitize(relativize(sourceFile)) + "_" + timestamp + ".json");
    }

    public Path reportFile() {
        return stateDirectory.resolve("run_report.json");
    }

    static String sanitize(String path) {
        String sanitized = path.replaceAll("[\\\\/:]+", "_");
        while (sanitized.startsWith("_")) {
            sanitized = sanitized.substring(1);
        }
        return sanitized;
    }
}
