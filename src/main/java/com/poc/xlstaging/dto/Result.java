package com.poc.xlstaging.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Envelope returned by every fallible operation: either a value or an error kind plus message.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Result<T> {

    private final boolean ok;
    private final T value;
    private final ErrorKind errorKind;
    private final String message;

    public static <T> Result<T> success(T value) {
        return new Result<>(true, value, null, null);
    }

    public static <T> Result<T> failure(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        return new Result<>(false, null, kind, message);
    }

    public boolean isFailure() {
        return !ok;
    }

    public T getValue() {
        if (!ok) {
            throw new NoSuchElementException("No value on failed result: " + errorKind.getCode() + " - " + message);
        }
        return value;
    }

    /** Re-types a failure so it can be returned from a method with a different value type. */
    public <U> Result<U> propagate() {
        if (ok) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return failure(errorKind, message);
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return ok ? success(mapper.apply(value)) : propagate();
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        return ok ? mapper.apply(value) : propagate();
    }

    @Override
    public String toString() {
        return ok ? "Result[ok, " + value + "]" : "Result[" + errorKind.getCode() + ", " + message + "]";
    }
}
