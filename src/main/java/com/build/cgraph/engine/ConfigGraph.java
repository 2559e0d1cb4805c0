package com.build.cgraph.engine;

import com.build.cgraph.api.CyclicGraphException;
import com.build.cgraph.api.Node;
import com.build.cgraph.key.KeySet;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable, validated configuration graph.
 *
 * Nodes live in an arena addressed by id. Two edge kinds connect them:
 *
 * 1. Argument edges: ordered per node. Their order is the order of the
 * constructor (or application) arguments in generated source.
 *
 * 2. Data-dependency edges: unordered. They only force the dependency to be
 * evaluated and emitted first.
 *
 * The union of both edge relations is acyclic; this is checked when the graph
 * is created. Graphs are normally produced by
 * {@link com.build.cgraph.dsl.GraphBuilder}.
 */
public final class ConfigGraph {
    private final String name;
    private final List<Node> nodes;
    private final List<List<Node>> arguments;
    private final List<List<Node>> dataDependencies;
    private final TopologicalOrder order;
    private final KeySet keys;

    private ConfigGraph(String name, List<Node> nodes, List<List<Node>> arguments,
            List<List<Node>> dataDependencies, TopologicalOrder order) {
        this.name = name;
        this.nodes = nodes;
        this.arguments = arguments;
        this.dataDependencies = dataDependencies;
        this.order = order;
        KeySet all = KeySet.empty();
        for (Node n : nodes)
            all = all.union(n.keys());
        this.keys = all;
    }

    /**
     * Creates a graph.
     *
     * @param name             Graph name.
     * @param nodes            Nodes indexed by id.
     * @param arguments        Ordered argument node ids of each node.
     * @param dataDependencies Data-dependency node ids of each node.
     * @throws CyclicGraphException if the edges form a cycle.
     */
    public static ConfigGraph create(String name, List<Node> nodes, List<int[]> arguments,
            List<int[]> dataDependencies) {
        if (arguments.size() != nodes.size() || dataDependencies.size() != nodes.size())
            throw new IllegalArgumentException("Edge lists do not match node count");
        var topo = TopologicalOrder.builder();
        for (Node node : nodes)
            topo.addNode(node);
        for (int id = 0; id < nodes.size(); id++) {
            for (int dep : arguments.get(id))
                topo.addEdge(dep, id);
            for (int dep : dataDependencies.get(id))
                topo.addEdge(dep, id);
        }
        TopologicalOrder order = topo.build();
        return new ConfigGraph(name, List.copyOf(nodes), resolve(nodes, arguments), resolve(nodes, dataDependencies),
                order);
    }

    private static List<List<Node>> resolve(List<Node> nodes, List<int[]> edges) {
        List<List<Node>> out = new ArrayList<>(edges.size());
        for (int[] ids : edges) {
            List<Node> targets = new ArrayList<>(ids.length);
            for (int id : ids)
                targets.add(nodes.get(id));
            out.add(List.copyOf(targets));
        }
        return List.copyOf(out);
    }

    public String name() {
        return name;
    }

    public int nodeCount() {
        return nodes.size();
    }

    /** Node by id. */
    public Node node(int id) {
        return nodes.get(id);
    }

    /** Node by name. */
    public Node node(String name) {
        return order.node(order.topoIndex(name));
    }

    /** Nodes in id (insertion) order. */
    public List<Node> nodes() {
        return nodes;
    }

    /** Argument children of a node, in argument order. */
    public List<Node> arguments(Node node) {
        return arguments.get(node.id());
    }

    public List<Node> dataDependencies(Node node) {
        return dataDependencies.get(node.id());
    }

    public TopologicalOrder order() {
        return order;
    }

    /** Nodes in topological order: every node after everything it depends on. */
    public List<Node> toposort() {
        return order.nodes();
    }

    /**
     * The node the graph composes into: the last node in topological order,
     * which nothing depends on. Null for an empty graph.
     */
    public Node root() {
        return nodes.isEmpty() ? null : order.node(order.nodeCount() - 1);
    }

    /** Every key read by some node of the graph. */
    public KeySet keys() {
        return keys;
    }

    public int edgeCount() {
        int n = 0;
        for (int i = 0; i < nodes.size(); i++)
            n += arguments.get(i).size() + dataDependencies.get(i).size();
        return n;
    }
}
