package ai.codetrace.patcher.git;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports files with uncommitted modifications so a run does not overwrite work in progress.
 */
public class WorkspaceStatusService {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceStatusService.class);

    private final Path projectRoot;

    public WorkspaceStatusService(Path projectRoot) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
    }

    /**
     * Absolute paths of modified or staged files, empty when the project is not inside a git work tree.
     */
    public Set<Path> dirtyFiles() {
        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(projectRoot.toFile());
        if (builder.getGitDir() == null) {
            LOGGER.debug("{} is not inside a git repository", projectRoot);
            return Set.of();
        }
        try (Repository repository = builder.build(); Git git = new Git(repository)) {
            if (repository.isBare()) {
                return Set.of();
            }
            Path workTree = repository.getWorkTree().toPath().toAbsolutePath().normalize();
            Status status = git.status().call();
            Set<Path> dirty = new LinkedHashSet<>();
            status.getModified().forEach(path -> dirty.add(workTree.resolve(path).normalize()));
            status.getChanged().forEach(path -> dirty.add(workTree.resolve(path).normalize()));
            return dirty;
        } catch (IOException | GitAPIException ex) {
            throw new WorkspaceStatusException("Failed to read git status for " + projectRoot, ex);
        }
    }

    /**
     * Drops candidates with uncommitted modifications, logging each one.
     */
    public List<Path> excludeDirty(List<Path> candidates) {
        Set<Path> dirty = dirtyFiles();
        if (dirty.isEmpty()) {
            return List.copyOf(candidates);
        }
        List<Path> clean = new ArrayList<>();
        for (Path candidate : candidates) {
            Path absolute = candidate.toAbsolutePath().normalize();
            if (dirty.contains(absolute)) {
                LOGGER.warn("Skipping {}: it has uncommitted changes", candidate);
            } else {
                clean.add(candidate);
            }
        }
        return clean;
    }
}
