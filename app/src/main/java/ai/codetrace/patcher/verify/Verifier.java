package ai.codetrace.patcher.verify;

import ai.codetrace.patcher.apply.ApplyException;
import ai.codetrace.patcher.apply.TransformApplier;
import ai.codetrace.patcher.store.TransformationRecord;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the project's verification command after edits and rolls back the files it blames.
 *
 * <p>The initial check is retried per {@link RetryPolicy}. When it still fails, the implicated files
 * are rolled back and the command runs once more: a pass means the tree recovered, a failure is fatal
 * for the implicated files.
 */
public class Verifier {

    public static final String FILES_PLACEHOLDER = "{files}";

    private static final Logger LOGGER = LoggerFactory.getLogger(Verifier.class);

    private final CommandRunner runner;
    private final TransformApplier applier;
    private final Path projectRoot;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public Verifier(CommandRunner runner, TransformApplier applier, Path projectRoot) {
        this(runner, applier, projectRoot, RetryPolicy.defaults(), Sleeper.SYSTEM);
    }

    public Verifier(CommandRunner runner, TransformApplier applier, Path projectRoot,
                    RetryPolicy retryPolicy, Sleeper sleeper) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.applier = Objects.requireNonNull(applier, "applier");
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public VerificationReport run(List<String> files, String verifyCommand, Duration timeout) {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(timeout, "timeout");
        if (verifyCommand == null || verifyCommand.isBlank()) {
            LOGGER.debug("No verification command configured");
            return VerificationReport.skipped();
        }
        String command = expand(verifyCommand, files);

        int attempts = 0;
        CommandResult result = null;
        while (attempts < retryPolicy.maxAttempts()) {
            attempts++;
            result = execute(command, timeout);
            if (result.succeeded()) {
                LOGGER.info("Verification passed for {} file(s) (attempt {})", files.size(), attempts);
                return VerificationReport.passed(attempts, result.output());
            }
            LOGGER.warn("Verification attempt {}/{} failed ({})", attempts, retryPolicy.maxAttempts(),
                    result.describe());
            if (attempts < retryPolicy.maxAttempts() && !pause()) {
                break;
            }
        }

        List<String> implicated = ErrorLocationParser.implicated(result.output(), files, projectRoot);
        LOGGER.error("Verification failed ({}); rolling back {}", result.describe(), implicated);
        List<TransformationRecord> rolledBack = new ArrayList<>();
        for (String file : implicated) {
            try {
                rolledBack.addAll(applier.rollback(file, "verification failed: " + result.describe()));
            } catch (ApplyException ex) {
                LOGGER.error("Rollback of {} failed: {}", file, ex.getMessage(), ex);
                return new VerificationReport(VerificationStatus.FATAL, attempts, implicated, rolledBack,
                        result.output(), "rollback failed: " + ex.getMessage());
            }
        }

        attempts++;
        CommandResult recovery = execute(command, timeout);
        if (recovery.succeeded()) {
            LOGGER.info("Verification recovered after rolling back {}", implicated);
            return new VerificationReport(VerificationStatus.RECOVERED, attempts, implicated, rolledBack,
                    recovery.output(), null);
        }
        LOGGER.error("Verification still failing after rollback ({}); {} halted", recovery.describe(), implicated);
        return new VerificationReport(VerificationStatus.FATAL, attempts, implicated, rolledBack, recovery.output(),
                "verification failed after rollback: " + recovery.describe());
    }

    private CommandResult execute(String command, Duration timeout) {
        try {
            return runner.run(command, projectRoot, timeout);
        } catch (VerificationException ex) {
            LOGGER.error("Verification command could not run: {}", ex.getMessage());
            return new CommandResult(-1, false, ex.getMessage());
        }
    }

    private boolean pause() {
        try {
            sleeper.sleep(retryPolicy.delay());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Verification retry interrupted");
            return false;
        }
    }

    String expand(String verifyCommand, List<String> files) {
        if (!verifyCommand.contains(FILES_PLACEHOLDER)) {
            return verifyCommand;
        }
        String joined = files.stream()
                .map(file -> quote(projectRoot.resolve(file).toAbsolutePath().normalize().toString()))
                .collect(Collectors.joining(" "));
        return verifyCommand.replace(FILES_PLACEHOLDER, joined);
    }

    private static String quote(String path) {
        if (ProcessCommandRunner.isWindows()) {
            return "\"" + path + "\"";
        }
        return "'" + path.replace("'", "'\\''") + "'";
    }
}
