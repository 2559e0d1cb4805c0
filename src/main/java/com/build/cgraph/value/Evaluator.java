package com.build.cgraph.value;

import com.build.cgraph.api.ConfigGraphException;
import com.build.cgraph.api.UnresolvedKeyException;

import java.util.Optional;
import java.util.function.Function;

/**
 * Evaluating interpreter for value expressions.
 *
 * Two entry points:
 *
 * 1. peek: speculative. Succeeds only if every key the expression reaches
 * already has a value in the context (typically because it was given on the
 * command line). Never fills defaults.
 *
 * 2. eval: unconditional. Every key must have a value; a missing one is a
 * defect in graph construction and fails with {@link UnresolvedKeyException}.
 *
 * Expressions never evaluate to null: a function returning null fails both
 * entry points with a {@link ConfigGraphException}.
 */
public final class Evaluator {
    private static final Object UNKNOWN = new Object();

    private Evaluator() {
        // Utility class
    }

    /**
     * @return The value, or empty as soon as a reachable key is unset.
     */
    @SuppressWarnings("unchecked")
    public static <T> Optional<T> peek(Value<T> value, EvalContext ctx) {
        Object r = peekRaw(value, ctx);
        return r == UNKNOWN ? Optional.empty() : Optional.of((T) r);
    }

    /**
     * @return The value of the expression.
     * @throws UnresolvedKeyException if a reachable key has no value.
     */
    @SuppressWarnings("unchecked")
    public static <T> T eval(Value<T> value, EvalContext ctx) {
        if (value instanceof Const<?> c)
            return (T) c.value();
        if (value instanceof KeyRef<?> ref)
            return (T) ctx.get(ref.key()).orElseThrow(() -> new UnresolvedKeyException(ref.key().name()));
        if (value instanceof Apply<?, ?> apply)
            return (T) applyRaw(eval(apply.fn(), ctx), eval(apply.arg(), ctx));
        throw new IllegalArgumentException("Unknown value expression: " + value.getClass().getName());
    }

    private static Object peekRaw(Value<?> value, EvalContext ctx) {
        if (value instanceof Const<?> c)
            return c.value();
        if (value instanceof KeyRef<?> ref)
            return ctx.isSet(ref.key()) ? ctx.get(ref.key()).get() : UNKNOWN;
        if (value instanceof Apply<?, ?> apply) {
            Object fn = peekRaw(apply.fn(), ctx);
            if (fn == UNKNOWN)
                return UNKNOWN;
            Object arg = peekRaw(apply.arg(), ctx);
            if (arg == UNKNOWN)
                return UNKNOWN;
            return applyRaw(fn, arg);
        }
        throw new IllegalArgumentException("Unknown value expression: " + value.getClass().getName());
    }

    @SuppressWarnings("unchecked")
    private static Object applyRaw(Object fn, Object arg) {
        Object result = ((Function<Object, Object>) fn).apply(arg);
        if (result == null)
            throw new ConfigGraphException("Value expression function returned null for argument '" + arg + "'");
        return result;
    }
}
