package com.build.cgraph.key;

import com.build.cgraph.api.Descriptor;
import com.build.cgraph.api.Stage;
import com.build.cgraph.api.UnresolvedKeyException;
import com.build.cgraph.codegen.JavaSyntax;
import com.build.cgraph.value.EvalContext;

import java.util.Objects;

/**
 * A named, typed, staged configuration setting.
 *
 * Keys are created through a {@link KeyRegistry}, which guarantees name
 * uniqueness. Identity is the name alone: two handles with the same name are
 * the same key. A key never changes after creation; its resolved value for a
 * given run lives in an {@link EvalContext}.
 *
 * @param <T> The value type, described by the key's {@link Descriptor}.
 */
public final class Key<T> implements Comparable<Key<?>> {
    private final String name;
    private final String identifier;
    private final Stage stage;
    private final T defaultValue;
    private final Doc doc;
    private final Descriptor<T> descriptor;

    Key(String name, Stage stage, T defaultValue, Doc doc, Descriptor<T> descriptor) {
        this.name = Objects.requireNonNull(name, "name");
        this.identifier = JavaSyntax.identifier(name);
        this.stage = Objects.requireNonNull(stage, "stage");
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue");
        this.doc = Objects.requireNonNull(doc, "doc");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    public String name() {
        return name;
    }

    /** Java identifier derived from the name, used in generated source. */
    public String identifier() {
        return identifier;
    }

    public Stage stage() {
        return stage;
    }

    public boolean isRuntime() {
        return stage.isRuntime();
    }

    public boolean isConfigure() {
        return stage.isConfigure();
    }

    public T defaultValue() {
        return defaultValue;
    }

    public Doc doc() {
        return doc;
    }

    public Descriptor<T> descriptor() {
        return descriptor;
    }

    /**
     * Java source reconstructing the key's resolved value in the given context
     * (not its default).
     *
     * @throws UnresolvedKeyException if the key has no value in the context.
     */
    public String serialize(EvalContext ctx) {
        T value = ctx.get(this).orElseThrow(() -> new UnresolvedKeyException(name));
        return descriptor.serialize(value);
    }

    @Override
    public int compareTo(Key<?> other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Key<?> other && name.equals(other.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
