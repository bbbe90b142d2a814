package org.javai.decorator.hook;

import org.javai.decorator.Operation;
import org.javai.decorator.Outcome;
import org.javai.decorator.callback.Callback;

import java.util.Objects;

/**
 * Runs optional callbacks before and after an operation.
 * The order is total: {@code pre}, then the operation, then {@code post}.
 */
public final class HookController {

    private HookController() {}

    /**
     * @param operation the operation to run once
     * @param pre runs before the operation (may be null)
     * @param post runs after the operation on both Ok and Fail (may be null)
     * @return the operation's outcome, unchanged
     */
    public static <T> Outcome<T> invoke(Operation<T> operation, Callback pre, Callback post) {
        Objects.requireNonNull(operation, "operation must not be null");

        if (pre != null) {
            pre.run();
        }
        Outcome<T> result = Objects.requireNonNull(operation.invoke(), "operation returned a null outcome");
        if (post != null) {
            post.run();
        }
        return result;
    }

    public static <T> Operation<T> wrap(Operation<T> operation, Callback pre, Callback post) {
        Objects.requireNonNull(operation, "operation must not be null");
        return () -> invoke(operation, pre, post);
    }
}
