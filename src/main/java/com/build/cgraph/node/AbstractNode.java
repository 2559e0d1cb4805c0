package com.build.cgraph.node;

import com.build.cgraph.api.Node;
import com.build.cgraph.api.NodeKind;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.value.Value;

import java.util.List;

/**
 * Base class holding the identity shared by all node kinds. Subclasses that
 * read no keys inherit the empty defaults.
 */
public abstract class AbstractNode implements Node {
    private final int id;
    private final String name;
    private final NodeKind kind;

    protected AbstractNode(int id, String name, NodeKind kind) {
        this.id = id;
        this.name = name;
        this.kind = kind;
    }

    @Override
    public final int id() {
        return id;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final NodeKind kind() {
        return kind;
    }

    @Override
    public KeySet keys() {
        return KeySet.empty();
    }

    @Override
    public List<Value<?>> values() {
        return List.of();
    }

    @Override
    public String toString() {
        return kind + "[" + id + ":" + name + "]";
    }
}
