package com.build.cgraph.node;

import com.build.cgraph.api.NodeKind;

import java.util.Objects;

/**
 * Leaf node carrying opaque data: a Java expression emitted as-is as the
 * node's binding in generated source.
 */
public final class VertexNode extends AbstractNode {
    private final String payload;

    public VertexNode(int id, String name, String payload) {
        super(id, name, NodeKind.VERTEX);
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public String payload() {
        return payload;
    }
}
