package com.docrepo.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a repository operation: either a value or a {@link RepositoryError}.
 * A successful result may carry a {@code null} value (e.g. a delete).
 */
public final class RepositoryResult<T> {
    private final T value;
    private final RepositoryError error;

    private RepositoryResult(T value, RepositoryError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> RepositoryResult<T> success(T value) {
        return new RepositoryResult<>(value, null);
    }

    public static <T> RepositoryResult<T> failure(RepositoryError error) {
        return new RepositoryResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<RepositoryError> error() {
        return Optional.ofNullable(error);
    }

    public RepositoryResult<T> ifError(Consumer<RepositoryError> consumer) {
        if (error != null) {
            consumer.accept(error);
        }
        return this;
    }

    public RepositoryResult<T> ifSuccess(Consumer<T> consumer) {
        if (error == null) {
            consumer.accept(value);
        }
        return this;
    }

    public <R> RepositoryResult<R> map(Function<T, R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    /**
     * Returns the value, or throws the error as a {@link RepositoryException}.
     */
    public T orElseThrow() {
        if (error != null) {
            throw error.toException();
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error.message() + "]";
    }
}
