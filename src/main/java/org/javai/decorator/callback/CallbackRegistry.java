package org.javai.decorator.callback;

import org.javai.decorator.CompositionException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves symbolic callback names to callables.
 *
 * <p>The registry is immutable once built. Resolution happens when a wrapper is
 * composed, so an unknown name fails fast with a {@link CompositionException}
 * instead of surfacing on the first invocation.
 *
 * <pre>{@code
 * CallbackRegistry registry = CallbackRegistry.builder()
 *     .register("audit", auditLog::recordSuccess)
 *     .register("alert", pager::notifyOnCall)
 *     .build();
 * }</pre>
 */
public final class CallbackRegistry {

    private static final CallbackRegistry EMPTY = new CallbackRegistry(Map.of());

    private final Map<String, Callback> callbacks;

    private CallbackRegistry(Map<String, Callback> callbacks) {
        this.callbacks = Map.copyOf(callbacks);
    }

    /**
     * A registry with no names. Only bound references resolve against it.
     */
    public static CallbackRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a reference to its callback.
     *
     * @param ref the reference to resolve
     * @return the callback
     * @throws CompositionException if a named reference is not registered
     */
    public Callback resolve(CallbackRef ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        if (ref instanceof CallbackRef.Bound bound) {
            return bound.callback();
        }
        String name = ((CallbackRef.Named) ref).name();
        Callback callback = callbacks.get(name);
        if (callback == null) {
            throw new CompositionException("Unresolved callback: " + name);
        }
        return callback;
    }

    /**
     * Resolves an optional reference; an absent reference resolves to null.
     */
    public Callback resolveOptional(Optional<CallbackRef> ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        return ref.map(this::resolve).orElse(null);
    }

    public boolean contains(String name) {
        return callbacks.containsKey(name);
    }

    public Set<String> names() {
        return callbacks.keySet();
    }

    /**
     * Builder for a {@link CallbackRegistry}.
     */
    public static final class Builder {
        private final Map<String, Callback> callbacks = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a callback under a name.
         *
         * @param name the name, unique within the registry
         * @param callback the callback
         * @return this builder
         * @throws IllegalArgumentException if the name is blank or already registered
         */
        public Builder register(String name, Callback callback) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(callback, "callback must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            if (callbacks.putIfAbsent(name, callback) != null) {
                throw new IllegalArgumentException("callback already registered: " + name);
            }
            return this;
        }

        public CallbackRegistry build() {
            return new CallbackRegistry(callbacks);
        }
    }
}
