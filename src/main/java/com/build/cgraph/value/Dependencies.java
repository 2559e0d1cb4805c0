package com.build.cgraph.value;

import com.build.cgraph.key.KeySet;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Structural interpreter computing the keys an expression reads.
 *
 * Results are memoized per expression instance, so a subtree shared by several
 * expressions is walked once per interpreter. Nodes cache the dependencies of
 * their expressions at construction.
 */
public final class Dependencies {
    private final Map<Value<?>, KeySet> cache = new IdentityHashMap<>();

    /** One-off computation with a fresh cache. */
    public static KeySet of(Value<?> value) {
        return new Dependencies().deps(value);
    }

    /**
     * The union of the keys of every {@link KeyRef} reachable from the
     * expression: empty for a constant, a singleton for a key reference.
     */
    public KeySet deps(Value<?> value) {
        KeySet cached = cache.get(value);
        if (cached != null)
            return cached;
        KeySet result;
        if (value instanceof Const<?>)
            result = KeySet.empty();
        else if (value instanceof KeyRef<?> ref)
            result = KeySet.of(ref.key());
        else if (value instanceof Apply<?, ?> apply)
            result = deps(apply.fn()).union(deps(apply.arg()));
        else
            throw new IllegalArgumentException("Unknown value expression: " + value.getClass().getName());
        cache.put(value, result);
        return result;
    }
}
