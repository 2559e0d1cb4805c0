package com.build.cgraph.dsl;

import com.build.cgraph.api.*;
import com.build.cgraph.codegen.JavaSyntax;
import com.build.cgraph.engine.ConfigGraph;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.node.*;
import com.build.cgraph.value.Value;

import java.util.*;

/**
 * Graph Builder -- fluent API for composing an application.
 *
 * This class records nodes and edges and compiles them into an immutable
 * {@link ConfigGraph}.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("web");
 * 2. Define leaves: var clock = g.vertex("clock", "java.time.Clock.systemUTC()");
 * 3. Define components: var http = g.configurable("http", "HttpServer", KeySet.of(port), clock);
 * 4. Build: ConfigGraph graph = g.build();
 *
 * Argument order is significant: it is the constructor argument order in
 * generated source. Data dependencies may be added at any time before
 * {@link #build()}, also between nodes created earlier.
 */
public final class GraphBuilder {
    private final String graphName;

    // Accumulate nodes and edges in lists before compiling
    private final List<Node> nodes = new ArrayList<>();
    private final Map<String, Node> nodesByName = new HashMap<>();
    private final Set<String> identifiers = new HashSet<>();
    private final List<int[]> arguments = new ArrayList<>();
    private final List<List<Integer>> dataDependencies = new ArrayList<>();

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    // ── Leaves ───────────────────────────────────────────────────

    /**
     * Creates a vertex.
     *
     * @param name    Unique name of the node.
     * @param payload Java expression bound to the node in generated source.
     * @return The created node.
     */
    public VertexNode vertex(String name, String payload) {
        checkNotBuilt();
        var node = new VertexNode(nodes.size(), name, payload);
        register(node, new Node[0]);
        return node;
    }

    // ── Configurables ────────────────────────────────────────────

    /**
     * Creates a configurable node.
     *
     * @param name           Unique name of the node.
     * @param implementation Class instantiated in generated source.
     * @param keys           Keys passed to the constructor.
     * @param args           Argument children, in constructor order.
     * @return The created node.
     */
    public ConfigurableNode configurable(String name, String implementation, KeySet keys, Node... args) {
        return configurable(name, implementation, keys, List.of(), List.of(args), List.of());
    }

    /**
     * Creates a configurable node with value expressions and data
     * dependencies.
     *
     * @param values   Extra value expressions resolved for the node; the keys
     *                 they read are added to the node's keys.
     * @param dataDeps Nodes that must be evaluated first without being
     *                 constructor arguments.
     */
    public ConfigurableNode configurable(String name, String implementation, KeySet keys, List<Value<?>> values,
            List<? extends Node> args, List<? extends Node> dataDeps) {
        checkNotBuilt();
        var node = new ConfigurableNode(nodes.size(), name, implementation, keys, values);
        register(node, args.toArray(new Node[0]));
        for (Node dep : dataDeps)
            dataDependency(node, dep);
        return node;
    }

    // ── Composition ──────────────────────────────────────────────

    /**
     * Applies a base node to argument nodes.
     *
     * @param base The applied node; rendered as the primary edge.
     * @param args Applied arguments, in order.
     */
    public AppNode app(String name, Node base, Node... args) {
        checkNotBuilt();
        Node[] edges = new Node[args.length + 1];
        edges[0] = base;
        System.arraycopy(args, 0, edges, 1, args.length);
        var node = new AppNode(nodes.size(), name);
        register(node, edges);
        return node;
    }

    /**
     * Selects a branch from the value of a condition.
     *
     * @param condition     Expression yielding a branch label.
     * @param branches      Branches by label, in declaration order.
     * @param defaultBranch Label of the branch used when no label matches.
     */
    public ChoiceNode choice(String name, Value<String> condition, LinkedHashMap<String, ? extends Node> branches,
            String defaultBranch) {
        checkNotBuilt();
        List<String> labels = new ArrayList<>(branches.keySet());
        int defaultIndex = labels.indexOf(defaultBranch);
        if (defaultIndex < 0)
            throw new IllegalArgumentException("Choice " + name + ": unknown default branch " + defaultBranch);
        var node = new ChoiceNode(nodes.size(), name, condition, labels, defaultIndex);
        register(node, branches.values().toArray(new Node[0]));
        return node;
    }

    /** Records that {@code from} needs {@code to} evaluated first. */
    public GraphBuilder dataDependency(Node from, Node to) {
        checkNotBuilt();
        requireOwned(from);
        requireOwned(to);
        dataDependencies.get(from.id()).add(to.id());
        return this;
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Compiles the graph: topological sort and cycle detection.
     *
     * @throws CyclicGraphException if the edges form a cycle.
     */
    public ConfigGraph build() {
        checkNotBuilt();
        built = true;
        List<int[]> data = new ArrayList<>(dataDependencies.size());
        for (List<Integer> deps : dataDependencies)
            data.add(deps.stream().mapToInt(Integer::intValue).toArray());
        return ConfigGraph.create(graphName, nodes, arguments, data);
    }

    /** Retrieve a node by name during the build phase. */
    @SuppressWarnings("unchecked")
    public <T extends Node> T getNode(String name) {
        return (T) nodesByName.get(name);
    }

    // Internal helper to register a node and check for duplicates
    private void register(Node node, Node[] args) {
        if (nodesByName.containsKey(node.name()))
            throw new IllegalArgumentException("Duplicate node name: " + node.name());
        String id = JavaSyntax.identifier(node.name());
        if (identifiers.contains(id))
            throw new IllegalArgumentException("Node name " + node.name() + " clashes with another node as " + id);
        int[] argIds = new int[args.length];
        for (int i = 0; i < args.length; i++) {
            requireOwned(args[i]);
            argIds[i] = args[i].id();
        }
        nodes.add(node);
        nodesByName.put(node.name(), node);
        identifiers.add(id);
        arguments.add(argIds);
        dataDependencies.add(new ArrayList<>());
    }

    private void requireOwned(Node node) {
        if (node.id() < 0 || node.id() >= nodes.size() || nodes.get(node.id()) != node)
            throw new IllegalArgumentException("Node " + node.name() + " does not belong to graph " + graphName);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }
}
