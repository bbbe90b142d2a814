package org.javai.decorator.async;

import org.javai.decorator.Outcome;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Cooperative form of {@link org.javai.decorator.hook.HookController}.
 * {@code pre} completes before the operation is started; {@code post} is awaited
 * after the operation completes and before the outcome is released.
 */
public final class AsyncHookController {

    private AsyncHookController() {}

    public static <T> CompletionStage<Outcome<T>> invoke(
            AsyncOperation<T> operation,
            AsyncCallback pre,
            AsyncCallback post
    ) {
        Objects.requireNonNull(operation, "operation must not be null");

        return run(pre)
                .thenCompose(ignored -> AsyncOperation.start(operation))
                .thenCompose(result -> run(post).thenApply(ignored -> result));
    }

    public static <T> AsyncOperation<T> wrap(AsyncOperation<T> operation, AsyncCallback pre, AsyncCallback post) {
        Objects.requireNonNull(operation, "operation must not be null");
        return () -> invoke(operation, pre, post);
    }

    private static CompletableFuture<Void> run(AsyncCallback callback) {
        CompletableFuture<Void> start = CompletableFuture.completedFuture(null);
        if (callback == null) {
            return start;
        }
        return start.thenCompose(ignored -> callback.run());
    }
}
