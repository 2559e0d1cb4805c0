package com.build.cgraph.value;

import com.build.cgraph.key.Key;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.key.KeyTerms;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import lombok.extern.log4j.Log4j2;

/**
 * Resolved key values of one evaluation run.
 *
 * Each key is written at most once per run: either explicitly (from the
 * command line, or programmatically before evaluation) or by default filling
 * right before a full evaluation. The context remembers which keys were set
 * explicitly, so descriptions can tell a user-chosen value from a default.
 *
 * Thread Safety:
 * Not thread-safe. A context belongs to a single evaluation run.
 */
@Log4j2
public final class EvalContext {
    private final Map<String, Object> values = new TreeMap<>();
    private final Set<String> explicit = new HashSet<>();

    public static EvalContext empty() {
        return new EvalContext();
    }

    /**
     * Sets a key explicitly.
     *
     * @throws IllegalStateException if the key already has a value.
     */
    public <T> EvalContext set(Key<T> key, T value) {
        put(key.name(), value);
        explicit.add(key.name());
        return this;
    }

    /**
     * Sets every value of a parsed command line explicitly. Values that failed
     * to parse are not bound; the caller decides whether to report them.
     */
    public EvalContext bind(KeyTerms.Result parsed) {
        for (var e : parsed.values().entrySet()) {
            put(e.getKey().name(), e.getValue());
            explicit.add(e.getKey().name());
        }
        return this;
    }

    /**
     * Fills the key with its default if it has no value yet.
     *
     * @return true if the default was written.
     */
    public boolean fillDefault(Key<?> key) {
        if (values.containsKey(key.name()))
            return false;
        put(key.name(), key.defaultValue());
        log.debug("Key {} defaults to {}", key.name(), key.defaultValue());
        return true;
    }

    /** @return Number of keys that received their default. */
    public int fillDefaults(KeySet keys) {
        int filled = 0;
        for (Key<?> k : keys)
            if (fillDefault(k))
                filled++;
        return filled;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(Key<T> key) {
        return Optional.ofNullable((T) values.get(key.name()));
    }

    public boolean isSet(Key<?> key) {
        return values.containsKey(key.name());
    }

    /** Whether the key was set explicitly rather than defaulted. */
    public boolean isExplicit(Key<?> key) {
        return explicit.contains(key.name());
    }

    /** Resolved values by key name, in name order. */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public int size() {
        return values.size();
    }

    private void put(String name, Object value) {
        if (value == null)
            throw new IllegalArgumentException("Null value for key " + name);
        if (values.containsKey(name))
            throw new IllegalStateException("Key '" + name + "' is already resolved to " + values.get(name));
        values.put(name, value);
    }
}
