package org.javai.decorator.async;

import org.javai.decorator.CompositionException;
import org.javai.decorator.Outcome;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Cooperative form of {@link org.javai.decorator.dispatch.OutcomeDispatcher}.
 * The chosen callback is awaited before the outcome is released; a callback that
 * fails completes the returned stage exceptionally.
 */
public final class AsyncOutcomeDispatcher {

    private AsyncOutcomeDispatcher() {}

    /**
     * @param operation the operation to run once
     * @param onSuccess awaited on Ok (may be null)
     * @param onFailure awaited on Fail (may be null)
     * @return a stage completing with the operation's outcome, unchanged
     */
    public static <T> CompletionStage<Outcome<T>> invoke(
            AsyncOperation<T> operation,
            AsyncCallback onSuccess,
            AsyncCallback onFailure
    ) {
        Objects.requireNonNull(operation, "operation must not be null");

        return AsyncOperation.start(operation).thenCompose(result -> {
            AsyncCallback callback = result.isOk() ? onSuccess : onFailure;
            if (callback == null) {
                return CompletableFuture.completedFuture(result);
            }
            return callback.run().thenApply(ignored -> result);
        });
    }

    /**
     * @throws CompositionException if no success callback is given
     */
    public static <T> AsyncOperation<T> onOk(AsyncOperation<T> operation, AsyncCallback onSuccess) {
        Objects.requireNonNull(operation, "operation must not be null");
        if (onSuccess == null) {
            throw new CompositionException("Missing callback");
        }
        return () -> invoke(operation, onSuccess, null);
    }

    public static <T> AsyncOperation<T> onResult(AsyncOperation<T> operation, AsyncCallback onOk, AsyncCallback onErr) {
        Objects.requireNonNull(operation, "operation must not be null");
        return () -> invoke(operation, onOk, onErr);
    }
}
