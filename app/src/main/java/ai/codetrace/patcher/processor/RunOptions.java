package ai.codetrace.patcher.processor;

import ai.codetrace.patcher.apply.SkipSet;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-run settings of the file processor.
 */
public record RunOptions(String instruction, String verifyCommand, Duration verifyTimeout, int workers,
                         SkipSet skipSet) {

    public RunOptions {
        instruction = instruction == null ? "" : instruction;
        Objects.requireNonNull(verifyTimeout, "verifyTimeout");
        Objects.requireNonNull(skipSet, "skipSet");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
    }
}
