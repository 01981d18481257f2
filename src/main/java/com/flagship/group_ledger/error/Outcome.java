package com.flagship.group_ledger.error;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a fallible ledger operation: either a value or a {@link LedgerError}.
 *
 * Business-rule failures travel as values so that every failure mode is
 * visible at the call site. Use {@link #orElseThrow()} at boundaries that
 * prefer exceptions.
 *
 * @param <T> type of the success value
 */
public final class Outcome<T> {

    private final T value;
    private final LedgerError error;

    private Outcome(T value, LedgerError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Outcome<T> failure(LedgerError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> Outcome<T> failure(ErrorCode code, String format, Object... args) {
        return failure(LedgerError.of(code, format, args));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this outcome is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present, outcome failed with " + error.getCode());
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this outcome is a success
     */
    public LedgerError getError() {
        if (error == null) {
            throw new IllegalStateException("No error present, outcome succeeded");
        }
        return error;
    }

    public Optional<ErrorCode> errorCode() {
        return error == null ? Optional.empty() : Optional.of(error.getCode());
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        return error == null ? success(mapper.apply(value)) : failure(error);
    }

    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        return error == null ? mapper.apply(value) : failure(error);
    }

    /**
     * Re-types a failure. Only valid on failed outcomes.
     */
    public <R> Outcome<R> asFailure() {
        return failure(getError());
    }

    public T orElseThrow() {
        if (error != null) {
            throw new LedgerOperationException(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
