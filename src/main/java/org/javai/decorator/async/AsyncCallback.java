package org.javai.decorator.async;

import org.javai.decorator.callback.Callback;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A side-effecting callback that completes asynchronously.
 */
@FunctionalInterface
public interface AsyncCallback {

    CompletionStage<Void> run();

    /**
     * Lifts a blocking callback; it runs on the thread that completes the preceding stage.
     */
    static AsyncCallback of(Callback callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        return () -> {
            callback.run();
            return CompletableFuture.completedFuture(null);
        };
    }
}
