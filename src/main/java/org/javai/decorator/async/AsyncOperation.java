package org.javai.decorator.async;

import org.javai.decorator.Operation;
import org.javai.decorator.Outcome;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * A fallible unit of work that completes asynchronously.
 * The cooperative counterpart of {@link Operation}: callers compose on the returned
 * stage instead of blocking a thread.
 *
 * @param <T> The type of the successful value
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    CompletionStage<Outcome<T>> invoke();

    default AsyncOperation<T> decorate(AsyncDecorator<T> decorator) {
        Objects.requireNonNull(decorator, "decorator must not be null");
        return decorator.apply(this);
    }

    /**
     * Runs a blocking operation on the given executor.
     */
    static <T> AsyncOperation<T> from(Operation<T> operation, Executor executor) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        return () -> CompletableFuture.supplyAsync(operation::invoke, executor);
    }

    /**
     * Starts the operation as a dependent stage, so an exception thrown by
     * {@link #invoke()} itself completes the returned future instead of escaping.
     */
    static <T> CompletableFuture<Outcome<T>> start(AsyncOperation<T> operation) {
        return CompletableFuture.<Void>completedFuture(null)
                .thenCompose(ignored -> operation.invoke())
                .thenApply(outcome -> Objects.requireNonNull(outcome, "operation returned a null outcome"));
    }
}
