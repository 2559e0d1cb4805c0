package com.build.cgraph.fn;

/**
 * Function of two values, lifted over value expressions by
 * {@link com.build.cgraph.value.Values#map2(Fn2, com.build.cgraph.value.Value, com.build.cgraph.value.Value)}.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code (host, port) -> host + ":" + port}</li>
 * <li>{@code Math::max}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn2<A, B, R> {
    /**
     * Applies the function.
     *
     * @param a First input.
     * @param b Second input.
     * @return The result.
     */
    R apply(A a, B b);
}
