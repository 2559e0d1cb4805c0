package com.build.cgraph.value;

import com.build.cgraph.fn.Fn1;
import com.build.cgraph.fn.Fn2;
import com.build.cgraph.fn.Fn3;
import com.build.cgraph.key.Key;
import com.build.cgraph.key.KeySet;

import java.util.function.Function;

/**
 * Constructors for value expressions.
 *
 * Usage Pattern:
 * 1. Constants: Values.pure("localhost")
 * 2. Keys: Values.value(portKey)
 * 3. Combination: Values.map2((h, p) -> h + ":" + p, Values.value(hostKey), Values.value(portKey))
 */
public final class Values {

    private Values() {
        // Utility class
    }

    public static <T> Value<T> pure(T x) {
        return new Const<>(x);
    }

    public static <T> Value<T> value(Key<T> key) {
        return new KeyRef<>(key);
    }

    public static <A, B> Value<B> app(Value<Function<A, B>> fn, Value<A> arg) {
        return new Apply<>(fn, arg);
    }

    /** Alias of {@link #app(Value, Value)}. */
    public static <A, B> Value<B> ap(Value<Function<A, B>> fn, Value<A> arg) {
        return app(fn, arg);
    }

    public static <A, R> Value<R> map(Fn1<A, R> fn, Value<A> a) {
        Value<Function<A, R>> f = pure(fn::apply);
        return app(f, a);
    }

    public static <A, B, R> Value<R> map2(Fn2<A, B, R> fn, Value<A> a, Value<B> b) {
        Value<Function<A, Function<B, R>>> f = pure(x -> y -> fn.apply(x, y));
        return app(app(f, a), b);
    }

    public static <A, B, C, R> Value<R> map3(Fn3<A, B, C, R> fn, Value<A> a, Value<B> b, Value<C> c) {
        Value<Function<A, Function<B, Function<C, R>>>> f = pure(x -> y -> z -> fn.apply(x, y, z));
        return app(app(app(f, a), b), c);
    }

    /** Keys read by the expression. */
    public static KeySet deps(Value<?> value) {
        return Dependencies.of(value);
    }
}
