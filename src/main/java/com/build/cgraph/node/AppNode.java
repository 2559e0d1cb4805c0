package com.build.cgraph.node;

import com.build.cgraph.api.NodeKind;

/**
 * Application of a base node to argument nodes.
 *
 * The base is the first argument edge of the node; the remaining argument
 * edges are the applied arguments, in order.
 */
public final class AppNode extends AbstractNode {

    public AppNode(int id, String name) {
        super(id, name, NodeKind.APP);
    }
}
