package org.javai.decorator.async;

import java.util.Objects;

/**
 * A wrapper over an {@link AsyncOperation}. Composes like
 * {@link org.javai.decorator.Decorator}: {@code first.andThen(second)} makes
 * {@code second} the outermost wrapper.
 *
 * @param <T> The type of the successful value
 */
@FunctionalInterface
public interface AsyncDecorator<T> {

    AsyncOperation<T> apply(AsyncOperation<T> operation);

    default AsyncDecorator<T> andThen(AsyncDecorator<T> outer) {
        Objects.requireNonNull(outer, "outer must not be null");
        return operation -> outer.apply(apply(operation));
    }
}
