package com.build.cgraph.codegen;

import com.build.cgraph.api.Node;
import com.build.cgraph.engine.ConfigGraph;
import com.build.cgraph.engine.EvalMode;
import com.build.cgraph.engine.GraphEvaluation;
import com.build.cgraph.engine.GraphEvaluator;
import com.build.cgraph.key.Key;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.node.AppNode;
import com.build.cgraph.node.ChoiceNode;
import com.build.cgraph.node.ConfigurableNode;
import com.build.cgraph.node.VertexNode;
import com.build.cgraph.value.EvalContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Emits Java source that instantiates a fully evaluated graph.
 *
 * <p>
 * The generated class has a single {@code create()} method with one
 * {@code final var} binding per node, in topological order:
 * <ul>
 * <li>a vertex binds its payload expression,</li>
 * <li>a configurable binds {@code new Impl(args..., keys..., values...)}:
 * argument bindings by position, the serialized resolved value of each key in
 * name order, then the result of each value expression in order,</li>
 * <li>an application binds {@code base.apply(args...)},</li>
 * <li>a choice binds its selected branch.</li>
 * </ul>
 * The method returns the root binding. The same graph and resolved values
 * always give the same text.
 */
@Log4j2
public final class SourceGenerator {
    private static final String INDENT = "    ";

    /** Same escapes as list and optional options: backslash before ',' and '\', and "\0" for an empty value. */
    private static final String ESCAPE_HELPERS = ""
            + "    private static java.util.List<String> splitList(String raw) {\n"
            + "        final var tokens = new java.util.ArrayList<String>();\n"
            + "        if (raw.isEmpty())\n"
            + "            return tokens;\n"
            + "        final var token = new StringBuilder();\n"
            + "        for (int i = 0; i < raw.length(); i++) {\n"
            + "            final char c = raw.charAt(i);\n"
            + "            if (c == '\\\\' && i + 1 < raw.length()) {\n"
            + "                i = unescapeAt(raw, i, token);\n"
            + "            } else if (c == ',') {\n"
            + "                tokens.add(token.toString());\n"
            + "                token.setLength(0);\n"
            + "            } else {\n"
            + "                token.append(c);\n"
            + "            }\n"
            + "        }\n"
            + "        tokens.add(token.toString());\n"
            + "        return tokens;\n"
            + "    }\n"
            + "\n"
            + "    private static String unescape(String raw) {\n"
            + "        final var sb = new StringBuilder(raw.length());\n"
            + "        for (int i = 0; i < raw.length(); i++) {\n"
            + "            final char c = raw.charAt(i);\n"
            + "            if (c == '\\\\' && i + 1 < raw.length())\n"
            + "                i = unescapeAt(raw, i, sb);\n"
            + "            else\n"
            + "                sb.append(c);\n"
            + "        }\n"
            + "        return sb.toString();\n"
            + "    }\n"
            + "\n"
            + "    private static int unescapeAt(String raw, int i, StringBuilder out) {\n"
            + "        final char next = raw.charAt(i + 1);\n"
            + "        if (next == ',' || next == '\\\\')\n"
            + "            out.append(next);\n"
            + "        else if (next != '0')\n"
            + "            out.append('\\\\').append(next);\n"
            + "        return i + 1;\n"
            + "    }\n";

    private final String packageName;
    private final String className;

    /**
     * @param packageName Package of the generated class; empty for the
     *                    default package.
     * @param className   Simple name of the generated class.
     */
    public SourceGenerator(String packageName, String className) {
        this.packageName = packageName == null ? "" : packageName;
        this.className = JavaSyntax.identifier(className);
    }

    /**
     * Fully evaluates the graph against the context, then generates.
     *
     * @throws com.build.cgraph.api.UnresolvedKeyException if a key cannot be
     *                                                     resolved.
     */
    public String generate(ConfigGraph graph, EvalContext ctx) {
        return generate(new GraphEvaluator().evaluate(graph, ctx, EvalMode.FULL));
    }

    /**
     * Generates from a full evaluation.
     *
     * @throws IllegalArgumentException if the evaluation is partial.
     */
    public String generate(GraphEvaluation evaluation) {
        if (evaluation.mode() != EvalMode.FULL)
            throw new IllegalArgumentException("Source generation needs a full evaluation, got " + evaluation.mode());
        ConfigGraph graph = evaluation.graph();
        EvalContext ctx = evaluation.context();

        StringBuilder sb = new StringBuilder(2048);
        header(sb, "Instantiates graph " + graph.name() + ".");
        sb.append(INDENT).append("public static Object create() {\n");
        for (Node node : graph.toposort()) {
            sb.append(INDENT).append(INDENT)
                    .append("final var ").append(JavaSyntax.identifier(node.name()))
                    .append(" = ").append(expression(graph, evaluation, ctx, node))
                    .append(";\n");
        }
        Node root = graph.root();
        sb.append(INDENT).append(INDENT).append("return ")
                .append(root == null ? "null" : JavaSyntax.identifier(root.name()))
                .append(";\n");
        sb.append(INDENT).append("}\n");
        sb.append("}\n");
        log.debug("Generated {} bindings for graph {}", graph.nodeCount(), graph.name());
        return sb.toString();
    }

    /**
     * Emits a class holding the resolved value of every key, by key name.
     * <ul>
     * <li>one {@code String} constant per key name, e.g. {@code LOG_LEVEL},</li>
     * <li>{@code VALUES}, the resolved values,</li>
     * <li>{@code RUNTIME}, the keys needed at run time,</li>
     * <li>{@code withArgs(args)}, the values with run-time keys overridden by
     * {@code --name=value} arguments of the generated application.</li>
     * </ul>
     * A run-time key whose type generated code cannot parse keeps its value.
     *
     * @throws com.build.cgraph.api.UnresolvedKeyException if a key has no
     *                                                     value in the context.
     * @throws IllegalArgumentException                    if two key names
     *                                                     give the same
     *                                                     constant.
     */
    public String generateKeys(KeySet keys, EvalContext ctx) {
        StringBuilder sb = new StringBuilder(2048);
        header(sb, "Resolved configuration keys.");

        Map<String, String> constants = new LinkedHashMap<>();
        List<String> entries = new ArrayList<>(keys.size());
        List<String> runtime = new ArrayList<>();
        List<String> overrides = new ArrayList<>();
        for (Key<?> key : keys) {
            String constant = constantName(key, constants);
            constants.put(constant, JavaSyntax.stringLiteral(key.name()));
            entries.add("java.util.Map.entry(" + constant + ", " + key.serialize(ctx) + ")");
            if (!key.isRuntime())
                continue;
            runtime.add(constant);
            var parser = key.descriptor().parserSource("raw");
            if (parser.isPresent())
                overrides.add("case " + constant + " -> values.put(" + constant + ", " + parser.get() + ");");
            else
                log.warn("Key {} ({}) cannot be overridden at run time", key.name(), key.descriptor().description());
        }

        for (var c : constants.entrySet())
            sb.append(INDENT).append("public static final String ").append(c.getKey())
                    .append(" = ").append(c.getValue()).append(";\n");
        if (!constants.isEmpty())
            sb.append('\n');
        sb.append(INDENT).append("public static final java.util.Map<String, Object> VALUES = java.util.Map.ofEntries(");
        joinLines(sb, entries);
        sb.append(");\n\n");
        sb.append(INDENT).append("public static final java.util.Set<String> RUNTIME = java.util.Set.of(");
        joinLines(sb, runtime);
        sb.append(");\n\n");
        sb.append(INDENT).append("public static Object get(String name) {\n")
                .append(INDENT).append(INDENT).append("return VALUES.get(name);\n")
                .append(INDENT).append("}\n\n");
        withArgs(sb, overrides);
        String body = String.join("\n", overrides);
        if (body.contains("splitList(") || body.contains("unescape("))
            sb.append('\n').append(ESCAPE_HELPERS);
        sb.append("}\n");
        return sb.toString();
    }

    private static String constantName(Key<?> key, Map<String, String> taken) {
        String constant = JavaSyntax.constantName(key.name());
        if (constant.equals("VALUES") || constant.equals("RUNTIME"))
            constant += "_";
        if (taken.containsKey(constant))
            throw new IllegalArgumentException("Keys " + taken.get(constant) + " and \"" + key.name()
                    + "\" both give the constant " + constant);
        return constant;
    }

    private static void withArgs(StringBuilder sb, List<String> overrides) {
        String i2 = INDENT + INDENT;
        String i3 = i2 + INDENT;
        String i4 = i3 + INDENT;
        sb.append(INDENT).append("/** Resolved values, run-time keys overridden by {@code --name=value} arguments. */\n")
                .append(INDENT).append("public static java.util.Map<String, Object> withArgs(String... args) {\n")
                .append(i2).append("final var values = new java.util.TreeMap<String, Object>(VALUES);\n")
                .append(i2).append("for (final var arg : args) {\n")
                .append(i3).append("final int eq = arg.indexOf('=');\n")
                .append(i3).append("if (!arg.startsWith(\"--\") || eq < 0)\n")
                .append(i4).append("continue;\n")
                .append(i3).append("final var raw = arg.substring(eq + 1);\n")
                .append(i3).append("switch (arg.substring(2, eq)) {\n");
        for (String o : overrides)
            sb.append(i4).append(o).append('\n');
        sb.append(i4).append("default -> {\n")
                .append(i4).append("}\n")
                .append(i3).append("}\n")
                .append(i2).append("}\n")
                .append(i2).append("return java.util.Collections.unmodifiableMap(values);\n")
                .append(INDENT).append("}\n");
    }

    private void header(StringBuilder sb, String doc) {
        sb.append("// Generated by cgraph. Do not edit.\n");
        if (!packageName.isEmpty())
            sb.append("package ").append(packageName).append(";\n");
        sb.append('\n');
        sb.append("/** ").append(doc).append(" */\n");
        sb.append("public final class ").append(className).append(" {\n");
        sb.append(INDENT).append("private ").append(className).append("() {\n");
        sb.append(INDENT).append("}\n\n");
    }

    private static void joinLines(StringBuilder sb, List<String> items) {
        for (int i = 0; i < items.size(); i++) {
            sb.append('\n').append(INDENT).append(INDENT).append(INDENT).append(items.get(i));
            if (i < items.size() - 1)
                sb.append(',');
        }
    }

    private static String expression(ConfigGraph graph, GraphEvaluation evaluation, EvalContext ctx, Node node) {
        List<Node> args = graph.arguments(node);
        if (node instanceof VertexNode v)
            return v.payload();
        if (node instanceof ConfigurableNode c) {
            List<String> params = new ArrayList<>(args.size() + c.keys().size());
            for (Node arg : args)
                params.add(JavaSyntax.identifier(arg.name()));
            for (Key<?> key : c.keys())
                params.add(key.serialize(ctx));
            for (Optional<Object> value : evaluation.of(node).values())
                params.add(JavaSyntax.literal(value.orElseThrow()));
            return "new " + c.implementation() + "(" + String.join(", ", params) + ")";
        }
        if (node instanceof AppNode) {
            List<String> params = new ArrayList<>(args.size());
            for (Node arg : args.subList(1, args.size()))
                params.add(JavaSyntax.identifier(arg.name()));
            return JavaSyntax.identifier(args.get(0).name()) + ".apply(" + String.join(", ", params) + ")";
        }
        if (node instanceof ChoiceNode) {
            int branch = evaluation.of(node).selectedBranch()
                    .orElseThrow(() -> new IllegalStateException("Choice " + node.name() + " was not resolved"));
            return JavaSyntax.identifier(args.get(branch).name());
        }
        throw new IllegalArgumentException("Unsupported node kind: " + node.kind());
    }
}
