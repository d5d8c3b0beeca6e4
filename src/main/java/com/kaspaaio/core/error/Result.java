package com.kaspaaio.core.error;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail with one or more {@link AioError}s.
 * Callers branch on {@link Success} and {@link Failure}; there is no third case.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(AioError error) {
        return new Failure<>(List.of(error));
    }

    static <T> Result<T> failure(List<AioError> errors) {
        return new Failure<>(errors);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Returns the value of a successful result.
     *
     * @throws AioException carrying the first error if this is a failure
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new AioException(((Failure<T>) this).errors().get(0));
    }

    default List<AioError> errors() {
        if (this instanceof Failure<T> failure) {
            return failure.errors();
        }
        return List.of();
    }

    default <R> Result<R> map(Function<T, R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return new Failure<>(((Failure<T>) this).errors());
    }

    record Success<T>(T value) implements Result<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure<T>(List<AioError> errors) implements Result<T> {
        public Failure {
            if (errors == null || errors.isEmpty()) {
                throw new IllegalArgumentException("a failure needs at least one error");
            }
            errors = List.copyOf(errors);
        }
    }
}
