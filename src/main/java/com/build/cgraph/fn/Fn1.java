package com.build.cgraph.fn;

/**
 * Function of one value, lifted over value expressions by
 * {@link com.build.cgraph.value.Values#map(Fn1, com.build.cgraph.value.Value)}.
 */
@FunctionalInterface
public interface Fn1<A, R> {
    R apply(A a);
}
