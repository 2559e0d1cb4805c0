package com.build.cgraph.value;

/**
 * A value expression over configuration keys.
 *
 * Expressions form a small applicative term language with exactly three node
 * kinds:
 *
 * - {@link Const}: a constant, with no dependencies.
 * - {@link KeyRef}: the value of one key.
 * - {@link Apply}: a function expression applied to an argument expression.
 *
 * Because an expression can only combine keys through these nodes, the set of
 * keys it reads is known structurally, before any key has a value (see
 * {@link Dependencies}). This is what allows the argument parser of a graph to
 * be built, and a partial evaluation to be attempted, ahead of evaluation.
 *
 * Expressions are immutable. Build them with {@link Values}; interpret them
 * with {@link Dependencies} and {@link Evaluator}.
 *
 * @param <T> The type of the expression's value.
 */
public interface Value<T> {
}
