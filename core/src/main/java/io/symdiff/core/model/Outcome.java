package io.symdiff.core.model;

import io.symdiff.core.error.ErrorKind;
import io.symdiff.core.error.SymbolicException;
import java.util.Objects;

/**
 * Result of an engine call. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: {@code value} holds the result.
 * <li>{@link Type#ERROR}: {@code error} holds the exception that aborted the call.
 * </ul>
 *
 * @param <T> the result type
 */
public final class Outcome<T> {

    /** The type of outcome. */
    public enum Type {
        SUCCESS,
        ERROR
    }

    private final Type type;
    private final T value;
    private final SymbolicException error;

    private Outcome(Type type, T value, SymbolicException error) {
        this.type = type;
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        Objects.requireNonNull(value, "value must not be null for SUCCESS");
        return new Outcome<>(Type.SUCCESS, value, null);
    }

    public static <T> Outcome<T> failure(SymbolicException error) {
        Objects.requireNonNull(error, "error must not be null for ERROR");
        return new Outcome<>(Type.ERROR, null, error);
    }

    public Type type() {
        return type;
    }

    /**
     * Returns the result value.
     *
     * @throws IllegalStateException if this is an ERROR outcome
     */
    public T value() {
        if (type != Type.SUCCESS) {
            throw new IllegalStateException("No value on an ERROR outcome: " + error.getMessage(), error);
        }
        return value;
    }

    /** Returns the error. Only valid when {@code type() == ERROR}. */
    public SymbolicException error() {
        return error;
    }

    /** Returns the error kind, or {@code null} on SUCCESS. */
    public ErrorKind errorKind() {
        return error != null ? error.kind() : null;
    }

    /** Returns the value, or rethrows the original exception on ERROR. */
    public T orElseThrow() {
        if (type == Type.ERROR) {
            throw error;
        }
        return value;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "Outcome[SUCCESS, value=" + value + "]";
            case ERROR -> "Outcome[ERROR, kind=" + error.kind() + ", detail=" + error.getMessage() + "]";
        };
    }
}
