package org.javai.decorator.dispatch;

import org.javai.decorator.callback.CallbackRef;

import java.util.Objects;
import java.util.Optional;

/**
 * Callback references for an {@code on_result} wrapper. Both are optional.
 *
 * @param onOk invoked when the operation succeeds
 * @param onErr invoked when the operation fails
 */
public record DispatchConfig(Optional<CallbackRef> onOk, Optional<CallbackRef> onErr) {

    public DispatchConfig {
        Objects.requireNonNull(onOk, "onOk must not be null, use Optional.empty()");
        Objects.requireNonNull(onErr, "onErr must not be null, use Optional.empty()");
    }

    public static DispatchConfig of(CallbackRef onOk, CallbackRef onErr) {
        return new DispatchConfig(Optional.ofNullable(onOk), Optional.ofNullable(onErr));
    }

    public static DispatchConfig onOk(CallbackRef onOk) {
        return of(Objects.requireNonNull(onOk, "onOk must not be null"), null);
    }

    public static DispatchConfig onErr(CallbackRef onErr) {
        return of(null, Objects.requireNonNull(onErr, "onErr must not be null"));
    }
}
