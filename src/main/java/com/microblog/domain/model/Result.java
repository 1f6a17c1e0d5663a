package com.microblog.domain.model;

/**
 * Outcome of an operation that either succeeds with a value or fails with a typed error.
 * Expected business outcomes (duplicate username, invalid body, unknown user) travel as
 * failures; exceptions are left for faults.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        public Failure {
            if (error == null) {
                throw new IllegalArgumentException("Failure requires an error");
            }
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * The success value; calling this on a failure is a programming error.
     */
    default T getOrThrow() {
        if (this instanceof Success<T, E> success) {
            return success.value();
        }
        throw new IllegalStateException("Result is a failure: " + errorOrNull());
    }

    default E errorOrNull() {
        return this instanceof Failure<T, E> failure ? failure.error() : null;
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
