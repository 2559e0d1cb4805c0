package com.build.cgraph.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of {@link Descriptor#parse(String)}: either a value or an error
 * message.
 *
 * @param <T> The parsed value type.
 */
public final class ParseResult<T> {
    private final T value;
    private final String error;

    private ParseResult(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> error(String message) {
        return new ParseResult<>(null, Objects.requireNonNull(message, "message"));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @return The parsed value.
     * @throws IllegalStateException if this is an error result.
     */
    public T value() {
        if (error != null)
            throw new IllegalStateException("Parse failed: " + error);
        return value;
    }

    /** The error message, or null for a successful parse. */
    public String error() {
        return error;
    }

    public <R> ParseResult<R> map(Function<? super T, ? extends R> fn) {
        return isOk() ? ParseResult.ok(fn.apply(value)) : ParseResult.error(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ParseResult<?> other))
            return false;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Error(" + error + ")";
    }
}
