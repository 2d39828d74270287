package ai.codetrace.patcher.verify;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs commands through the platform shell ({@code /bin/sh -c}, or {@code cmd.exe /c} on Windows)
 * with stdin closed and stdout/stderr merged. Output is read on a thread owned by the call, and a timeout
 * destroys the shell together with everything it started.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);
    private static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofSeconds(2);
    private static final String ANSI_ESCAPE_PATTERN = "\\x1B(?:\\[[;\\d]*[ -/]*[@-~]|\\]\\d+;[^\\x07]*\\x07)";

    @Override
    public CommandResult run(String command, Path workingDirectory, Duration timeout) {
        LOGGER.debug("Running `{}` in `{}`", command, workingDirectory);
        String[] shellCommand = isWindows()
                ? new String[]{"cmd.exe", "/c", command}
                : new String[]{"/bin/sh", "-c", command};
        ProcessBuilder builder = new ProcessBuilder(shellCommand)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .redirectInput(ProcessBuilder.Redirect.from(new File(isWindows() ? "NUL" : "/dev/null")));

        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new VerificationException("Unable to start `%s` in %s".formatted(command, workingDirectory), ex);
        }

        StringBuffer captured = new StringBuffer();
        Thread reader = new Thread(() -> drain(process.getInputStream(), captured),
                "verify-output-" + process.pid());
        reader.setDaemon(true);
        reader.start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroyTree(process);
                LOGGER.warn("`{}` did not complete within {} s; process tree destroyed", command, timeout.toSeconds());
                awaitReader(reader, command);
                return new CommandResult(-1, true, clean(captured.toString()));
            }
            awaitReader(reader, command);
        } catch (InterruptedException ex) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new VerificationException("Interrupted while waiting for `%s`".formatted(command), ex);
        }
        return new CommandResult(process.exitValue(), false, clean(captured.toString()));
    }

    // Children of the shell inherit the output pipe, so they go first or the reader never sees EOF.
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static void awaitReader(Thread reader, String command) throws InterruptedException {
        reader.join(OUTPUT_DRAIN_TIMEOUT.toMillis());
        if (reader.isAlive()) {
            LOGGER.warn("Output of `{}` is still open after {} ms; keeping what was read", command,
                    OUTPUT_DRAIN_TIMEOUT.toMillis());
        }
    }

    private static void drain(InputStream in, StringBuffer captured) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                captured.append(line).append('\n');
            }
        } catch (IOException ex) {
            LOGGER.debug("Stopped reading command output: {}", ex.getMessage());
        }
    }

    private static String clean(String output) {
        return output.strip().replaceAll(ANSI_ESCAPE_PATTERN, "");
    }

    static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
