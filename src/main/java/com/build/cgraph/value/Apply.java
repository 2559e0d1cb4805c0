package com.build.cgraph.value;

import java.util.Objects;
import java.util.function.Function;

/** Application of a function expression to an argument expression. */
public record Apply<A, B>(Value<Function<A, B>> fn, Value<A> arg) implements Value<B> {

    public Apply {
        Objects.requireNonNull(fn, "fn");
        Objects.requireNonNull(arg, "arg");
    }
}
