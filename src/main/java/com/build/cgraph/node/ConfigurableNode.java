package com.build.cgraph.node;

import com.build.cgraph.api.NodeKind;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.value.Dependencies;
import com.build.cgraph.value.Value;

import java.util.List;
import java.util.Objects;

/**
 * A composable unit with its own keys.
 *
 * In generated source a configurable becomes a constructor call of its
 * implementation class. The constructor receives the bindings of the node's
 * argument children, in argument order, followed by the resolved values of
 * the node's keys in canonical key order.
 *
 * The keys of a configurable are the keys it declares plus every key read by
 * its value expressions, so a graph's argument parser and default filling
 * always cover what its expressions need.
 */
public final class ConfigurableNode extends AbstractNode {
    private final String implementation;
    private final KeySet keys;
    private final List<Value<?>> values;

    public ConfigurableNode(int id, String name, String implementation, KeySet declaredKeys, List<Value<?>> values) {
        super(id, name, NodeKind.CONFIGURABLE);
        this.implementation = Objects.requireNonNull(implementation, "implementation");
        this.values = List.copyOf(values);
        var deps = new Dependencies();
        KeySet all = declaredKeys;
        for (Value<?> v : this.values)
            all = all.union(deps.deps(v));
        this.keys = all;
    }

    /** Class instantiated for this node in generated source. */
    public String implementation() {
        return implementation;
    }

    @Override
    public KeySet keys() {
        return keys;
    }

    @Override
    public List<Value<?>> values() {
        return values;
    }
}
