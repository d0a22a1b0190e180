package org.javai.push;

/**
 * Converts one kind of lower-layer exception into a {@link FailureKind}.
 * Implementations must be total and must not throw.
 *
 * @param <E> the exception type this converter accepts
 */
@FunctionalInterface
public interface FailureConverter<E extends Exception> {

    FailureKind convert(E exception);
}
