package org.javai.decorator.async;

import org.javai.decorator.Failure;
import org.javai.decorator.FailureType;
import org.javai.decorator.Outcome;
import org.javai.decorator.RecordingReporter;
import org.javai.decorator.timeout.TimeoutConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class AsyncDeadlineTest {

    private RecordingReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = new RecordingReporter();
    }

    @Test
    void execute_fastOperation_returnsItsOutcomeVerbatim() {
        Outcome<String> ok = Outcome.ok("quick");

        Outcome<String> result = await(deadline(500).execute("Op", () -> CompletableFuture.completedFuture(ok)));

        assertThat(result).isSameAs(ok);
        assertThat(reporter.failures).isEmpty();
    }

    @Test
    void execute_slowStage_timesOutNearTheDeadline() {
        CompletableFuture<Outcome<String>> never = new CompletableFuture<>();

        long start = System.nanoTime();
        Outcome<String> result = await(deadline(50).execute("Slow.op", () -> never));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.TIMEOUT);
        assertThat(failure.message()).isEqualTo("Function timed out after 50ms");
        assertThat(elapsedMs).isGreaterThanOrEqualTo(50).isLessThan(400);
        assertThat(reporter.failures).containsExactly(failure);
    }

    @Test
    void execute_blockingInvoke_doesNotHoldUpTheDeadline() {
        AtomicBoolean finished = new AtomicBoolean(false);

        Outcome<String> result = await(deadline(10).execute("Op", () -> {
            sleep(50);
            finished.set(true);
            return CompletableFuture.completedFuture(Outcome.ok("late"));
        }));

        assertThat(result.isFail()).isTrue();
        assertThat(finished.get()).isFalse();
    }

    @Test
    void execute_doesNotBlockCaller() {
        long start = System.nanoTime();
        CompletionStage<Outcome<String>> stage = deadline(200).execute("Op", () -> new CompletableFuture<>());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(elapsedMs).isLessThan(150);
        assertThat(await(stage).isFail()).isTrue();
    }

    @Test
    void execute_stageFailsExceptionally_yieldsChannelFailure() {
        IllegalStateException boom = new IllegalStateException("boom");

        Outcome<String> result = await(deadline(500).execute("Op",
                () -> CompletableFuture.failedFuture(boom)));

        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.type()).isEqualTo(FailureType.CHANNEL);
        assertThat(failure.exception()).isSameAs(boom);
        assertThat(reporter.failures).containsExactly(failure);
    }

    @Test
    void execute_invokeThrows_yieldsChannelFailure() {
        Outcome<String> result = await(deadline(500).<String>execute("Op", () -> {
            throw new IllegalArgumentException("bad");
        }));

        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.isChannel()).isTrue();
        assertThat(failure.exception()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void execute_nullOutcome_yieldsChannelFailure() {
        Outcome<String> result = await(deadline(500).execute("Op",
                () -> CompletableFuture.<Outcome<String>>completedFuture(null)));

        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.message()).isEqualTo("Channel error: operation returned no outcome");
    }

    @Test
    void execute_durationBeyondNanosecondRange_waitsForTheOperation() {
        AsyncDeadline deadline = AsyncDeadline.builder()
                .config(TimeoutConfig.of(Duration.ofDays(365L * 400)))
                .reporter(reporter)
                .build();

        Outcome<String> result = await(deadline.execute("Op", () -> CompletableFuture.completedFuture(Outcome.ok("x"))));

        assertThat(result.getOrThrow()).isEqualTo("x");
    }

    private AsyncDeadline deadline(long millis) {
        return AsyncDeadline.builder()
                .config(TimeoutConfig.ofMillis(millis))
                .reporter(reporter)
                .build();
    }

    private static <T> T await(CompletionStage<T> stage) {
        return stage.toCompletableFuture().orTimeout(5, TimeUnit.SECONDS).join();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
