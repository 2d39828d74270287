package ai.codetrace.patcher.verify;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class ProcessCommandRunnerTest {

    @TempDir
    Path workingDirectory;

    private final ProcessCommandRunner runner = new ProcessCommandRunner();

    @Test
    void capturesOutputAndExitCode() {
        CommandResult result = runner.run("echo out; echo err 1>&2; exit 3", workingDirectory, Duration.ofSeconds(10));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.timedOut()).isFalse();
        assertThat(result.output()).contains("out").contains("err");
    }

    @Test
    void timeoutDestroysCommand() {
        CommandResult result = runner.run("sleep 10", workingDirectory, Duration.ofMillis(200));

        assertThat(result.timedOut()).isTrue();
        assertThat(result.succeeded()).isFalse();
    }

    @Test
    void timeoutAlsoStopsChildrenHoldingTheOutputPipe() {
        long started = System.nanoTime();

        CommandResult result = runner.run("echo before; sleep 20; true", workingDirectory, Duration.ofSeconds(1));

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertThat(result.timedOut()).isTrue();
        assertThat(result.output()).contains("before");
        assertThat(elapsedMillis).isLessThan(5_000);
    }

    @Test
    void largeOutputIsReadWhileTheCommonPoolIsBusy() throws InterruptedException {
        int parallelism = ForkJoinPool.getCommonPoolParallelism();
        CountDownLatch busy = new CountDownLatch(parallelism);
        CountDownLatch release = new CountDownLatch(1);
        List<CompletableFuture<Void>> blockers = new ArrayList<>();
        for (int i = 0; i < parallelism; i++) {
            blockers.add(CompletableFuture.runAsync(() -> {
                busy.countDown();
                awaitQuietly(release);
            }));
        }
        try {
            assertThat(busy.await(5, TimeUnit.SECONDS)).isTrue();

            CommandResult result = runner.run("head -c 300000 /dev/zero | tr '\\000' x", workingDirectory,
                    Duration.ofSeconds(10));

            assertThat(result.succeeded()).isTrue();
            assertThat(result.output()).hasSize(300_000);
        } finally {
            release.countDown();
            blockers.forEach(CompletableFuture::join);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(30, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
