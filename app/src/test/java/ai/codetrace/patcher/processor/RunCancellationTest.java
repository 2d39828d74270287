package ai.codetrace.patcher.processor;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RunCancellationTest {

    @Test
    void drainIsSignalledOnlyAfterMarking() throws InterruptedException {
        RunCancellation cancellation = new RunCancellation();
        cancellation.cancel();

        assertThat(cancellation.isCancelled()).isTrue();
        assertThat(cancellation.awaitDrained(Duration.ofMillis(50))).isFalse();

        cancellation.markDrained();

        assertThat(cancellation.awaitDrained(Duration.ofMillis(50))).isTrue();
    }
}
