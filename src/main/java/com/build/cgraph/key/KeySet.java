package com.build.cgraph.key;

import com.build.cgraph.api.Stage;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Immutable set of keys, ordered canonically by name.
 *
 * The canonical order makes every consumer deterministic: option layout in the
 * argument parser, constructor argument order in generated source, and the
 * order of entries in generated key tables.
 */
public final class KeySet implements Iterable<Key<?>> {
    private static final KeySet EMPTY = new KeySet(new TreeMap<>());

    private final TreeMap<String, Key<?>> keys;

    private KeySet(TreeMap<String, Key<?>> keys) {
        this.keys = keys;
    }

    public static KeySet empty() {
        return EMPTY;
    }

    public static KeySet of(Key<?>... keys) {
        return of(List.of(keys));
    }

    public static KeySet of(Collection<? extends Key<?>> keys) {
        if (keys.isEmpty())
            return EMPTY;
        TreeMap<String, Key<?>> map = new TreeMap<>();
        for (Key<?> k : keys)
            map.put(k.name(), k);
        return new KeySet(map);
    }

    public KeySet union(KeySet other) {
        if (other.isEmpty())
            return this;
        if (isEmpty())
            return other;
        TreeMap<String, Key<?>> map = new TreeMap<>(keys);
        map.putAll(other.keys);
        return new KeySet(map);
    }

    public KeySet with(Key<?> key) {
        TreeMap<String, Key<?>> map = new TreeMap<>(keys);
        map.put(key.name(), key);
        return new KeySet(map);
    }

    /**
     * Keys belonging to the given build phase. A null or BOTH filter keeps all
     * keys.
     */
    public KeySet filter(Stage stage) {
        if (stage == null || stage == Stage.BOTH)
            return this;
        TreeMap<String, Key<?>> map = new TreeMap<>();
        for (Key<?> k : keys.values())
            if (k.stage().matches(stage))
                map.put(k.name(), k);
        return new KeySet(map);
    }

    public boolean contains(Key<?> key) {
        return keys.containsKey(key.name());
    }

    public Optional<Key<?>> get(String name) {
        return Optional.ofNullable(keys.get(name));
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /** Names in canonical order. */
    public List<String> names() {
        return List.copyOf(keys.keySet());
    }

    public Stream<Key<?>> stream() {
        return keys.values().stream();
    }

    @Override
    public Iterator<Key<?>> iterator() {
        return Collections.unmodifiableCollection(keys.values()).iterator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof KeySet other && keys.keySet().equals(other.keys.keySet()));
    }

    @Override
    public int hashCode() {
        return keys.keySet().hashCode();
    }

    @Override
    public String toString() {
        return keys.keySet().toString();
    }
}
