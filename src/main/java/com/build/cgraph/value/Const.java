package com.build.cgraph.value;

import java.util.Objects;

/** A constant expression. */
public record Const<T>(T value) implements Value<T> {

    public Const {
        Objects.requireNonNull(value, "value");
    }
}
