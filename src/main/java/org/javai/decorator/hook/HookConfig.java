package org.javai.decorator.hook;

import org.javai.decorator.callback.CallbackRef;

import java.util.Objects;
import java.util.Optional;

/**
 * Callback references run around an operation. Each is optional.
 *
 * @param pre runs to completion before the operation starts
 * @param post runs after the operation completes, whatever its outcome
 */
public record HookConfig(Optional<CallbackRef> pre, Optional<CallbackRef> post) {

    private static final HookConfig NONE = new HookConfig(Optional.empty(), Optional.empty());

    public HookConfig {
        Objects.requireNonNull(pre, "pre must not be null, use Optional.empty()");
        Objects.requireNonNull(post, "post must not be null, use Optional.empty()");
    }

    public static HookConfig none() {
        return NONE;
    }

    public static HookConfig of(CallbackRef pre, CallbackRef post) {
        return new HookConfig(Optional.ofNullable(pre), Optional.ofNullable(post));
    }

    public static HookConfig pre(CallbackRef pre) {
        return of(Objects.requireNonNull(pre, "pre must not be null"), null);
    }

    public static HookConfig post(CallbackRef post) {
        return of(null, Objects.requireNonNull(post, "post must not be null"));
    }
}
