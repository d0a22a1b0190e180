package org.javai.push.boundary;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.javai.push.FailureConversions;
import org.javai.push.FailureConverter;
import org.javai.push.FailureKind;
import org.javai.push.Outcome;
import org.javai.push.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The point where lower-layer failures cross into the client's public API.
 *
 * <p>Checked exceptions thrown by the wrapped work are converted into a {@link FailureKind} by
 * the converter the caller names, reported once, and returned as {@link Outcome.Fail}.
 * The converter decides how much detail survives, so the same {@link java.io.IOException}
 * becomes a {@code ReadFailure} when reading a key file and a {@code ConnectionFailure} when
 * talking to the gateway.</p>
 *
 * <p>RuntimeExceptions are defects and propagate unconverted. The Boundary never retries.</p>
 *
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jOpReporter());
 *
 * Outcome<byte[]> key = boundary.call("SigningKey.read",
 *         () -> Files.readAllBytes(path),
 *         IOException.class, FailureConversions.READ);
 * }</pre>
 */
public final class Boundary {

    private static final Logger log = LoggerFactory.getLogger(Boundary.class);

    private final OpReporter reporter;

    /**
     * Creates a Boundary that converts failures but does not report them.
     */
    public static Boundary silent() {
        return new Boundary(OpReporter.noOp());
    }

    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(reporter);
    }

    public Boundary(OpReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw a checked exception, converting it into an Outcome.
     *
     * <p>A checked exception that is not a {@code failureType} (one thrown without being
     * declared) is a defect and is rethrown as {@link IllegalStateException}.</p>
     *
     * @param operation the operation name for reporting
     * @param work the work to execute
     * @param failureType the checked exception type {@code converter} accepts
     * @param converter the conversion rule for {@code E}
     * @return Ok with the result, or Fail with the converted failure
     */
    public <T, E extends Exception> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends E> work,
                                                    Class<E> failureType, FailureConverter<? super E> converter) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(failureType, "failureType must not be null");
        Objects.requireNonNull(converter, "converter must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            return convert(operation, e, failureType, converter);
        }
    }

    /**
     * Waits for an in-flight send for at most {@code budget}.
     *
     * <p>Budgets too large to count in nanoseconds are capped rather than rejected.
     * An elapsed budget yields {@code TimeoutFailure}; the future is cancelled. A future that
     * completed exceptionally with a checked {@code E} has that cause converted. Any other
     * cause is a defect and is rethrown unchecked.</p>
     *
     * @param operation the operation name for reporting
     * @param future the pending send
     * @param budget the caller's time budget
     * @param failureType the checked exception type {@code converter} accepts
     * @param converter the conversion rule for the future's checked failure
     */
    public <T, E extends Exception> Outcome<T> await(String operation, CompletableFuture<T> future, Duration budget,
                                                     Class<E> failureType, FailureConverter<? super E> converter) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(future, "future must not be null");
        Objects.requireNonNull(budget, "budget must not be null");
        Objects.requireNonNull(failureType, "failureType must not be null");
        Objects.requireNonNull(converter, "converter must not be null");

        try {
            return Outcome.ok(future.get(TimeUnit.NANOSECONDS.convert(budget), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Operation [{}] exceeded its budget of {}", operation, budget);
            return fail(operation, FailureConversions.timeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return fail(operation, FailureConversions.timeout());
        } catch (ExecutionException e) {
            return convert(operation, e.getCause(), failureType, converter);
        }
    }

    private <T, E extends Exception> Outcome<T> convert(String operation, Throwable cause, Class<E> failureType,
                                                        FailureConverter<? super E> converter) {
        if (failureType.isInstance(cause)) {
            return fail(operation, converter.convert(failureType.cast(cause)));
        }
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Unexpected failure in operation " + operation, cause);
    }

    /**
     * Reports a failure that was detected without an exception (validation, gateway rejection)
     * and wraps it as an Outcome.
     */
    public <T> Outcome<T> fail(String operation, FailureKind failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        reporter.report(operation, failure);
        return Outcome.fail(failure);
    }
}
