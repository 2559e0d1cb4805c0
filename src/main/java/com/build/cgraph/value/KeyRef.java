package com.build.cgraph.value;

import com.build.cgraph.key.Key;

import java.util.Objects;

/** The value of a key. */
public record KeyRef<T>(Key<T> key) implements Value<T> {

    public KeyRef {
        Objects.requireNonNull(key, "key");
    }
}
