package com.build.cgraph.fn;

/** Function of three values. */
@FunctionalInterface
public interface Fn3<A, B, C, R> {
    R apply(A a, B b, C c);
}
