package org.javai.decorator.dispatch;

import org.javai.decorator.CompositionException;
import org.javai.decorator.Operation;
import org.javai.decorator.Outcome;
import org.javai.decorator.callback.Callback;

import java.util.Objects;

/**
 * Runs an operation once and invokes a callback chosen by the outcome.
 *
 * <p>On {@code Ok} only the success callback runs; on {@code Fail} only the failure
 * callback runs. The original outcome is returned whatever the callback did.
 * A callback that throws is not caught: the exception reaches the caller and
 * the outcome is lost with it.</p>
 */
public final class OutcomeDispatcher {

    private OutcomeDispatcher() {}

    /**
     * Runs the operation and dispatches on its outcome.
     *
     * @param operation the operation to run
     * @param onSuccess invoked on Ok (may be null)
     * @param onFailure invoked on Fail (may be null)
     * @return the operation's outcome, unchanged
     */
    public static <T> Outcome<T> invoke(Operation<T> operation, Callback onSuccess, Callback onFailure) {
        Objects.requireNonNull(operation, "operation must not be null");

        Outcome<T> result = operation.invoke();
        Objects.requireNonNull(result, "operation returned a null outcome");

        Callback callback = result.isOk() ? onSuccess : onFailure;
        if (callback != null) {
            callback.run();
        }
        return result;
    }

    /**
     * Wraps an operation so that a success callback runs after every Ok outcome.
     *
     * @param operation the operation to wrap
     * @param onSuccess the success callback (required)
     * @return the wrapped operation
     * @throws CompositionException if no success callback is given
     */
    public static <T> Operation<T> onOk(Operation<T> operation, Callback onSuccess) {
        Objects.requireNonNull(operation, "operation must not be null");
        if (onSuccess == null) {
            throw new CompositionException("Missing callback");
        }
        return () -> invoke(operation, onSuccess, null);
    }

    /**
     * Wraps an operation with optional success and failure callbacks.
     * An absent callback is a silent no-op for its branch.
     *
     * @param operation the operation to wrap
     * @param onOk invoked on Ok (may be null)
     * @param onErr invoked on Fail (may be null)
     * @return the wrapped operation
     */
    public static <T> Operation<T> onResult(Operation<T> operation, Callback onOk, Callback onErr) {
        Objects.requireNonNull(operation, "operation must not be null");
        return () -> invoke(operation, onOk, onErr);
    }
}
