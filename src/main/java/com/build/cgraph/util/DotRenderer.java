package com.build.cgraph.util;

import com.build.cgraph.api.Node;
import com.build.cgraph.engine.ConfigGraph;
import com.build.cgraph.engine.GraphEvaluation;
import com.build.cgraph.engine.NodeEvaluation;
import com.build.cgraph.key.Key;
import com.build.cgraph.node.AppNode;
import com.build.cgraph.node.ChoiceNode;
import com.build.cgraph.node.ConfigurableNode;
import com.build.cgraph.value.EvalContext;

import java.util.List;
import java.util.Optional;

/**
 * Renders a graph in Graphviz dot syntax.
 *
 * <p>
 * Shapes follow the node kind: vertices and choices are circles,
 * configurables are boxes, applications are diamonds. Edges point from a node
 * to what it depends on:
 * <ul>
 * <li>argument edges are solid; an application's base is bold,</li>
 * <li>choice branches are dotted, except the default branch (or the selected
 * one, once known) which is bold,</li>
 * <li>data-dependency edges are dashed.</li>
 * </ul>
 *
 * <p>
 * With an evaluation, configurable labels list their known key values,
 * followed by the results of their value expressions as {@code $0=...}. A
 * value marked {@code *} was filled with the key's default rather than given
 * explicitly; {@code ?} means the value is not known yet.
 */
public final class DotRenderer {

    private DotRenderer() {
    }

    public static String render(ConfigGraph graph) {
        return render(graph, null);
    }

    public static String render(ConfigGraph graph, GraphEvaluation evaluation) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("digraph ").append(quote(graph.name())).append(" {\n");
        sb.append("  node [fontname=\"monospace\"];\n");

        for (Node node : graph.nodes()) {
            sb.append("  n").append(node.id())
                    .append(" [label=").append(quote(label(node, evaluation)))
                    .append(", shape=").append(node.kind().shape())
                    .append("];\n");
        }

        for (Node node : graph.nodes()) {
            List<Node> args = graph.arguments(node);
            int primary = primaryEdge(node, evaluation);
            for (int i = 0; i < args.size(); i++) {
                String style;
                if (i == primary)
                    style = "bold";
                else if (node instanceof ChoiceNode)
                    style = "dotted";
                else
                    style = "solid";
                edge(sb, node, args.get(i), style);
            }
            for (Node dep : graph.dataDependencies(node))
                edge(sb, node, dep, "dashed");
        }
        return sb.append("}\n").toString();
    }

    private static int primaryEdge(Node node, GraphEvaluation evaluation) {
        if (node instanceof AppNode)
            return 0;
        if (node instanceof ChoiceNode choice) {
            if (evaluation != null) {
                var selected = evaluation.of(node).selectedBranch();
                if (selected.isPresent())
                    return selected.getAsInt();
            }
            return choice.defaultBranch();
        }
        return -1;
    }

    private static void edge(StringBuilder sb, Node from, Node to, String style) {
        sb.append("  n").append(from.id()).append(" -> n").append(to.id())
                .append(" [style=").append(style).append("];\n");
    }

    private static String label(Node node, GraphEvaluation evaluation) {
        StringBuilder sb = new StringBuilder(node.name());
        if (node instanceof ConfigurableNode c)
            sb.append("\n").append(c.implementation());
        if (node instanceof ChoiceNode choice)
            sb.append("\n").append(String.join("|", choice.labels()));
        if (evaluation == null) {
            for (Key<?> key : node.keys())
                sb.append("\n").append(key.name());
            return sb.toString();
        }
        NodeEvaluation result = evaluation.of(node);
        EvalContext ctx = evaluation.context();
        for (Key<?> key : node.keys())
            sb.append("\n").append(keyValue(key, result, ctx));
        // A choice's only expression is its condition, already shown by its key
        if (node instanceof ConfigurableNode) {
            List<Optional<Object>> values = result.values();
            for (int i = 0; i < values.size(); i++)
                sb.append("\n$").append(i).append('=').append(values.get(i).map(String::valueOf).orElse("?"));
        }
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static <T> String keyValue(Key<T> key, NodeEvaluation result, EvalContext ctx) {
        Object v = result.keyValues().get(key);
        if (v == null)
            return key.name() + "=?";
        String printed = key.descriptor().print((T) v);
        return key.name() + "=" + printed + (ctx.isExplicit(key) ? "" : "*");
    }

    /** Quotes a dot ID, escaping quotes and backslashes; newlines become dot line breaks. */
    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
