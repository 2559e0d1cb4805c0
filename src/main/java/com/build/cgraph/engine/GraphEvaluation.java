package com.build.cgraph.engine;

import com.build.cgraph.api.Node;
import com.build.cgraph.value.EvalContext;

import java.util.List;

/**
 * Result of evaluating a graph: one {@link NodeEvaluation} per node, indexed
 * by node id, plus the context the values were read from.
 */
public final class GraphEvaluation {
    private final ConfigGraph graph;
    private final EvalContext context;
    private final EvalMode mode;
    private final List<NodeEvaluation> nodes;

    GraphEvaluation(ConfigGraph graph, EvalContext context, EvalMode mode, List<NodeEvaluation> nodes) {
        this.graph = graph;
        this.context = context;
        this.mode = mode;
        this.nodes = List.copyOf(nodes);
    }

    public ConfigGraph graph() {
        return graph;
    }

    public EvalContext context() {
        return context;
    }

    public EvalMode mode() {
        return mode;
    }

    public NodeEvaluation of(Node node) {
        return nodes.get(node.id());
    }

    public NodeEvaluation of(String nodeName) {
        return of(graph.node(nodeName));
    }

    /** Per-node results, indexed by node id. */
    public List<NodeEvaluation> nodes() {
        return nodes;
    }
}
