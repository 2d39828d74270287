package ai.codetrace.patcher.verify;

/**
 * Exit status and combined stdout/stderr of one command execution.
 */
public record CommandResult(int exitCode, boolean timedOut, String output) {

    public CommandResult {
        output = output == null ? "" : output;
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    public String describe() {
        return timedOut ? "timed out" : "exit code " + exitCode;
    }
}
