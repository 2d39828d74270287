package ai.codetrace.patcher.processor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands configured glob patterns and explicit file arguments into the sorted set of files to process.
 * Patterns are relative to the project root; a leading {@code **}{@code /} also matches top-level files.
 */
public class SourceFileResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceFileResolver.class);

    private final Path projectRoot;
    private final Path stateDirectory;

    public SourceFileResolver(Path projectRoot, Path stateDirectory) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        this.stateDirectory = Objects.requireNonNull(stateDirectory, "stateDirectory").toAbsolutePath().normalize();
    }

    public List<Path> resolve(List<String> patterns, List<String> explicitFiles) {
        TreeSet<Path> files = new TreeSet<>();
        for (String explicit : explicitFiles) {
            Path file = projectRoot.resolve(explicit).toAbsolutePath().normalize();
            if (Files.isRegularFile(file)) {
                files.add(file);
            } else {
                LOGGER.warn("Ignoring {}: not a regular file", explicit);
            }
        }
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            String glob = pattern.trim().replace('\\', '/');
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            if (glob.startsWith("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
            }
        }
        if (!matchers.isEmpty()) {
            try (Stream<Path> walk = Files.walk(projectRoot)) {
                walk.filter(Files::isRegularFile)
                        .filter(path -> !path.startsWith(stateDirectory))
                        .filter(path -> !projectRoot.relativize(path).startsWith(".git"))
                        .filter(path -> {
                            Path relative = projectRoot.relativize(path);
                            return matchers.stream().anyMatch(matcher -> matcher.matches(relative));
                        })
                        .forEach(files::add);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to scan " + projectRoot, ex);
            }
        }
        LOGGER.debug("Resolved {} source file(s)", files.size());
        return List.copyOf(files);
    }
}
