package ai.codetrace.patcher.verify;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs a shell command line in a working directory.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @throws VerificationException when the command could not be started or waiting was interrupted
     */
    CommandResult run(String command, Path workingDirectory, Duration timeout);
}
