package org.javai.push;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Result of a push client operation.
 * Either {@link Ok} containing a value, or {@link Fail} containing a {@link FailureKind}.
 *
 * @param <T> the type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Optional<FailureKind> failure() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super FailureKind, ? extends T> recovery) {
            return this;
        }

        @Override
        public Outcome<T> recoverWith(Function<? super FailureKind, ? extends Outcome<T>> recovery) {
            return this;
        }
    }

    /**
     * A failed outcome.
     *
     * @param kind what went wrong
     */
    record Fail<T>(FailureKind kind) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public Optional<FailureKind> failure() {
            return Optional.of(kind);
        }

        @Override
        public T getOrThrow() {
            throw new PushFailureException(kind);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(kind);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(kind);
        }

        @Override
        public Outcome<T> recover(Function<? super FailureKind, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(kind));
        }

        @Override
        public Outcome<T> recoverWith(Function<? super FailureKind, ? extends Outcome<T>> recovery) {
            Objects.requireNonNull(recovery);
            return recovery.apply(kind);
        }
    }

    boolean isOk();

    default boolean isFail() {
        return !isOk();
    }

    /**
     * The failure, or empty for a successful outcome.
     */
    Optional<FailureKind> failure();

    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    Outcome<T> recover(Function<? super FailureKind, ? extends T> recovery);
    Outcome<T> recoverWith(Function<? super FailureKind, ? extends Outcome<T>> recovery);

    static Outcome<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(FailureKind kind) {
        return new Fail<>(kind);
    }
}
