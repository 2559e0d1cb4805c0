package com.build.cgraph.api;

import com.build.cgraph.key.KeySet;
import com.build.cgraph.value.Value;

import java.util.List;

/**
 * A node in the configuration graph.
 *
 * Nodes are plain immutable descriptions. They do not hold their edges: the
 * ordered argument edges and the data-dependency edges live in the graph,
 * addressed by the node's integer id. This keeps ownership flat (an arena of
 * nodes plus index lists) and makes cycle reporting trivial.
 *
 * Key Responsibilities:
 *
 * 1. Identity: a unique name within the graph, and a stable id equal to the
 * node's position in the graph's arena.
 *
 * 2. Settings: the keys the node reads and the value expressions the evaluator
 * must resolve for it.
 */
public interface Node {

    /** Arena index of this node, stable for the lifetime of the graph. */
    int id();

    /** Unique name; also the base of the node's binding in generated source. */
    String name();

    NodeKind kind();

    /**
     * Every key this node depends on, including the dependencies of its value
     * expressions.
     */
    KeySet keys();

    /** Value expressions resolved for this node during evaluation. */
    List<Value<?>> values();
}
