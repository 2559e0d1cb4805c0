package com.build.cgraph.util;

import com.build.cgraph.api.Node;
import com.build.cgraph.engine.ConfigGraph;
import com.build.cgraph.engine.GraphEvaluation;
import com.build.cgraph.engine.NodeEvaluation;
import com.build.cgraph.engine.TopologicalOrder;
import com.build.cgraph.key.Key;
import com.build.cgraph.node.ConfigurableNode;
import com.build.cgraph.node.VertexNode;

import java.util.List;

/**
 * Diagnostic utility for inspecting graph topology and evaluation results.
 *
 * <p>
 * Generates human-readable text for logging errors or debugging sessions.
 */
public final class GraphExplain {
    private final ConfigGraph graph;
    private final TopologicalOrder topology;
    private final GraphEvaluation evaluation;

    public GraphExplain(ConfigGraph graph) {
        this(graph, null);
    }

    public GraphExplain(ConfigGraph graph, GraphEvaluation evaluation) {
        this.graph = graph;
        this.topology = graph.order();
        this.evaluation = evaluation;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeName) {
        int idx = topology.topoIndex(nodeName);
        Node node = topology.node(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Kind: ").append(node.kind()).append('\n');
        if (node instanceof ConfigurableNode c)
            sb.append("  Implementation: ").append(c.implementation()).append('\n');
        else if (node instanceof VertexNode v)
            sb.append("  Payload: ").append(v.payload()).append('\n');
        appendNames(sb, "Arguments", graph.arguments(node));
        appendNames(sb, "Data dependencies", graph.dataDependencies(node));
        sb.append("  Keys: ").append(node.keys().names()).append('\n');
        if (evaluation != null) {
            NodeEvaluation result = evaluation.of(node);
            for (Key<?> key : node.keys()) {
                Object v = result.keyValues().get(key);
                sb.append("    ").append(key.name()).append(" = ")
                        .append(v == null ? "<unknown>" : v)
                        .append(evaluation.context().isExplicit(key) ? "" : " (default)")
                        .append('\n');
            }
            if (node instanceof ConfigurableNode) {
                for (int i = 0; i < result.values().size(); i++)
                    sb.append("    $").append(i).append(" = ")
                            .append(result.values().get(i).map(String::valueOf).orElse("<unknown>"))
                            .append('\n');
            }
            result.selectedBranch().ifPresent(b -> sb.append("  Selected branch: ")
                    .append(graph.arguments(node).get(b).name()).append('\n'));
        }
        return sb.toString();
    }

    /**
     * Dumps the entire topology, one node per line in evaluation order, with
     * the nodes depending on it.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(topology.nodeCount()).append(" nodes):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            Node node = topology.node(i);
            sb.append("  [").append(i).append("] ").append(node.name());
            if (topology.parentCount(i) == 0)
                sb.append(" (LEAF)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)).name());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void appendNames(StringBuilder sb, String title, List<Node> nodes) {
        sb.append("  ").append(title).append(" (").append(nodes.size()).append("): ");
        for (int i = 0; i < nodes.size(); i++) {
            sb.append(nodes.get(i).name());
            if (i < nodes.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
    }
}
