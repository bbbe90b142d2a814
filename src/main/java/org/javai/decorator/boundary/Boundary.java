package org.javai.decorator.boundary;

import org.javai.decorator.Failure;
import org.javai.decorator.Operation;
import org.javai.decorator.Outcome;
import org.javai.decorator.ops.OpReporter;

import java.util.Map;
import java.util.Objects;

/**
 * Adapts code that throws checked exceptions into {@link Operation}s.
 * Catches exceptions, classifies them into failures, reports them, and returns Outcome.
 *
 * <p>RuntimeExceptions (defects) are not caught. They propagate through every wrapper
 * to the caller, exactly like a failing callback.</p>
 *
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(reporter);
 *
 * Operation<Response> send = boundary.operation("HttpClient.send", () -> httpClient.send(request, handler));
 * Outcome<Response> result = send.decorate(decorators.retry(RetryConfig.ofMillis(2, 250))).invoke();
 * }</pre>
 */
public final class Boundary {

    private final FailureClassifier classifier;
    private final OpReporter reporter;

    /**
     * Creates a Boundary that classifies failures but does not report them.
     */
    public static Boundary silent() {
        return new Boundary(FailureClassifier.standard(), OpReporter.noOp());
    }

    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(FailureClassifier.standard(), reporter);
    }

    public static Boundary of(FailureClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into an Outcome.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        return call(operation, Map.of(), work);
    }

    /**
     * Executes work with additional tags for observability.
     */
    public <T> Outcome<T> call(String operation, Map<String, String> tags, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            // Defects propagate; they're not operational failures.
            throw e;
        } catch (Exception e) {
            Failure failure = classifier.classify(operation, e);
            if (!tags.isEmpty()) {
                failure = failure.withTags(tags);
            }
            reporter.report(failure);
            return Outcome.fail(failure);
        }
    }

    /**
     * Binds work into an operation; every invocation calls {@link #call(String, ThrowingSupplier)}.
     */
    public <T> Operation<T> operation(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return () -> call(operation, work);
    }
}
