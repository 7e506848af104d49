package com.bank.governance.model;

import com.bank.governance.exception.GovernanceValidationException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of an operation that validates its input: either a value or a {@link ValidationError}.
 * Callers branch on {@link #isOk()} instead of catching exceptions on the hot path.
 */
public final class Outcome<T> {

    private final T value;
    private final ValidationError error;

    private Outcome(T value, ValidationError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Outcome<T> rejected(ValidationError error) {
        return new Outcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> Outcome<T> rejected(String field, String message) {
        return rejected(new ValidationError(field, message));
    }

    public boolean isOk() {
        return error == null;
    }

    public T get() {
        if (error != null) {
            throw new IllegalStateException("Outcome was rejected: " + error.message());
        }
        return value;
    }

    public ValidationError getError() {
        if (error == null) {
            throw new IllegalStateException("Outcome has no error");
        }
        return error;
    }

    public T orElseThrow() {
        if (error != null) {
            throw new GovernanceValidationException(error);
        }
        return value;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return rejected(error);
        }
        return ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isOk() ? "Outcome.ok(" + value + ")" : "Outcome.rejected(" + error + ")";
    }
}
