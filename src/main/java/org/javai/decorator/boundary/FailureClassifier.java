package org.javai.decorator.boundary;

import org.javai.decorator.Failure;
import org.javai.decorator.FailureId;

/**
 * Translates a checked exception into a {@link Failure}.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * @param operation The operation that was being performed
     * @param exception The exception that occurred
     * @return An operational failure describing it
     */
    Failure classify(String operation, Exception exception);

    /**
     * Names the failure after the exception class, in the "boundary" namespace.
     */
    static FailureClassifier standard() {
        return (operation, exception) -> Failure.operational(
                FailureId.of("boundary", exception.getClass().getSimpleName()),
                exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName(),
                operation,
                exception);
    }
}
