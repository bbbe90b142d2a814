package org.javai.decorator.async;

import org.javai.decorator.CompositionException;
import org.javai.decorator.Decorators;
import org.javai.decorator.Failure;
import org.javai.decorator.Operation;
import org.javai.decorator.Outcome;
import org.javai.decorator.RecordingReporter;
import org.javai.decorator.callback.CallbackRef;
import org.javai.decorator.callback.CallbackRegistry;
import org.javai.decorator.dispatch.DispatchConfig;
import org.javai.decorator.hook.HookConfig;
import org.javai.decorator.retry.RetryConfig;
import org.javai.decorator.timeout.TimeoutConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class AsyncDecoratorsTest {

    private List<String> events;
    private RecordingReporter reporter;
    private CallbackRegistry registry;
    private ExecutorService executor;
    private AsyncDecorators decorators;

    @BeforeEach
    void setUp() {
        events = new CopyOnWriteArrayList<>();
        reporter = new RecordingReporter();
        registry = CallbackRegistry.builder()
                .register("pre", () -> events.add("pre"))
                .register("post", () -> events.add("post"))
                .register("ok", () -> events.add("ok"))
                .register("err", () -> events.add("err"))
                .build();
        executor = Executors.newCachedThreadPool();
        decorators = AsyncDecorators.builder()
                .registry(registry)
                .reporter(reporter)
                .executor(executor)
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void onOk_unknownName_failsAtComposition() {
        assertThatThrownBy(() -> decorators.onOk(CallbackRef.named("ghost")))
                .isInstanceOf(CompositionException.class)
                .hasMessage("Unresolved callback: ghost");
        assertThatThrownBy(() -> decorators.onOk(null))
                .isInstanceOf(CompositionException.class)
                .hasMessage("Missing callback");
    }

    @Test
    void hookOutsideRetry_matchesBlockingBehavior() {
        AtomicInteger asyncCalls = new AtomicInteger();
        AtomicInteger blockingCalls = new AtomicInteger();
        List<String> blockingEvents = new CopyOnWriteArrayList<>();
        HookConfig hooks = HookConfig.of(CallbackRef.named("pre"), CallbackRef.named("post"));

        AsyncOperation<String> asyncOp = () -> CompletableFuture.completedFuture(flaky(asyncCalls));
        Outcome<String> asyncResult = await(asyncOp
                .decorate(decorators.retry(RetryConfig.ofMillis(3, 5)))
                .decorate(decorators.hook(hooks))
                .invoke());

        Decorators blocking = Decorators.builder()
                .registry(CallbackRegistry.builder()
                        .register("pre", () -> blockingEvents.add("pre"))
                        .register("post", () -> blockingEvents.add("post"))
                        .build())
                .build();
        Operation<String> blockingOp = () -> flaky(blockingCalls);
        Outcome<String> blockingResult = blockingOp
                .decorate(blocking.retry(RetryConfig.ofMillis(3, 5)))
                .decorate(blocking.hook(hooks))
                .invoke();

        assertThat(asyncResult).isEqualTo(blockingResult);
        assertThat(asyncCalls.get()).isEqualTo(blockingCalls.get()).isEqualTo(3);
        assertThat(events).containsExactlyElementsOf(blockingEvents).containsExactly("pre", "post");
    }

    @Test
    void onResult_dispatchesByOutcome() {
        AsyncDecorator<String> dispatch = decorators.onResult(
                DispatchConfig.of(CallbackRef.named("ok"), CallbackRef.named("err")));

        AsyncOperation<String> ok = () -> CompletableFuture.completedFuture(Outcome.ok("v"));
        AsyncOperation<String> fail = () -> CompletableFuture.completedFuture(Outcome.fail("test", "x", "x"));
        await(ok.decorate(dispatch).invoke());
        await(fail.decorate(dispatch).invoke());

        assertThat(events).containsExactly("ok", "err");
    }

    @Test
    void timeoutOverRetry_boundsTheWholeLoop() {
        AsyncOperation<String> alwaysFails = () -> CompletableFuture.completedFuture(Outcome.fail("test", "down", "down"));

        Outcome<String> result = await(alwaysFails
                .decorate(decorators.retry("Down", RetryConfig.ofMillis(10, 100)))
                .decorate(decorators.timeout("Down", TimeoutConfig.ofMillis(150)))
                .invoke());

        Failure failure = ((Outcome.Fail<String>) result).failure();
        assertThat(failure.isTimeout()).isTrue();
        assertThat(failure.operation()).isEqualTo("Down");
        assertThat(reporter.failures).contains(failure);
    }

    @Test
    void fromBlockingOperation_runsOnExecutor() {
        List<String> threads = new CopyOnWriteArrayList<>();
        Operation<String> blocking = () -> {
            threads.add(Thread.currentThread().getName());
            return Outcome.ok("v");
        };

        Outcome<String> result = await(AsyncOperation.from(blocking, executor).invoke());

        assertThat(result.getOrThrow()).isEqualTo("v");
        assertThat(threads).hasSize(1);
        assertThat(threads.get(0)).isNotEqualTo(Thread.currentThread().getName());
    }

    private static Outcome<String> flaky(AtomicInteger calls) {
        return calls.incrementAndGet() < 3
                ? Outcome.fail("test", "flaky", "attempt " + calls.get())
                : Outcome.ok("done");
    }

    private static <T> T await(CompletionStage<T> stage) {
        return stage.toCompletableFuture().orTimeout(5, TimeUnit.SECONDS).join();
    }
}
