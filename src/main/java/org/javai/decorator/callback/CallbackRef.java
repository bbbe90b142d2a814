package org.javai.decorator.callback;

import java.util.Objects;

/**
 * An opaque handle to a callback, resolved by a {@link CallbackRegistry} at composition time.
 * Either a symbolic name or an already bound callback.
 */
public sealed interface CallbackRef permits CallbackRef.Named, CallbackRef.Bound {

    /**
     * A reference by name, looked up in the registry.
     *
     * @param name the registered name
     */
    record Named(String name) implements CallbackRef {
        public Named {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A reference that already holds its callback.
     *
     * @param callback the callback
     */
    record Bound(Callback callback) implements CallbackRef {
        public Bound {
            Objects.requireNonNull(callback, "callback must not be null");
        }
    }

    static CallbackRef named(String name) {
        return new Named(name);
    }

    static CallbackRef of(Callback callback) {
        return new Bound(callback);
    }
}
