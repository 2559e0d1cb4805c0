package com.build.cgraph.engine;

import com.build.cgraph.api.*;
import com.build.cgraph.key.Key;
import com.build.cgraph.node.ChoiceNode;
import com.build.cgraph.value.EvalContext;
import com.build.cgraph.value.Evaluator;
import com.build.cgraph.value.Value;
import com.build.cgraph.value.Values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evaluates the keys and value expressions of a graph against a context.
 *
 * Nodes are visited in topological order, so a listener sees dependencies
 * before their dependents. Two modes:
 *
 * 1. PARTIAL: every key and expression is peeked. Only what is already known
 * (typically keys given on the command line) is resolved, and the context is
 * left untouched. Choice nodes whose condition is known are collapsed.
 *
 * 2. FULL: every key of the graph without a value is first filled with its
 * default, then every key and expression is evaluated. A key still missing at
 * that point is an internal defect and aborts the pass with an
 * {@link UnresolvedKeyException} naming the key and the node.
 *
 * Fail Fast:
 * An exception raised while evaluating a node stops the pass; listeners are
 * told about the failing node before the exception propagates.
 */
public final class GraphEvaluator {
    private static final Logger log = LogManager.getLogger(GraphEvaluator.class);

    private EvaluationListener listener;

    public void setListener(EvaluationListener listener) {
        this.listener = listener;
    }

    /**
     * Runs one evaluation pass.
     *
     * @throws UnresolvedKeyException if a full pass meets a key with no value.
     * @throws ConfigGraphException   if a value expression fails.
     */
    public GraphEvaluation evaluate(ConfigGraph graph, EvalContext ctx, EvalMode mode) {
        final int n = graph.nodeCount();
        final EvaluationListener l = this.listener;
        final boolean hasListener = l != null;

        log.info("Evaluating graph {} ({} nodes, {} keys, mode {})", graph.name(), n, graph.keys().size(), mode);
        if (hasListener)
            l.onEvaluationStart(mode, n);

        if (mode == EvalMode.FULL) {
            int filled = ctx.fillDefaults(graph.keys());
            log.debug("Filled {} default values", filled);
        }

        NodeEvaluation[] results = new NodeEvaluation[n];
        TopologicalOrder order = graph.order();
        int evaluated = 0;
        try {
            for (int ti = 0; ti < n; ti++) {
                Node node = order.node(ti);
                NodeEvaluation result;
                try {
                    result = evaluateNode(node, ctx, mode);
                } catch (UnresolvedKeyException e) {
                    log.error("Node {} reads key {} which was never resolved", node.name(), e.keyName());
                    if (hasListener)
                        l.onNodeError(ti, node.name(), e);
                    throw e.atNode(node.name());
                } catch (RuntimeException e) {
                    log.error("Evaluation of node {} failed", node.name(), e);
                    if (hasListener)
                        l.onNodeError(ti, node.name(), e);
                    throw new ConfigGraphException("Evaluation of node '" + node.name() + "' failed", e);
                }
                results[node.id()] = result;
                evaluated++;
                if (log.isDebugEnabled())
                    log.debug("Node {}: {}/{} keys known", node.name(), result.keyValues().size(), node.keys().size());
                if (hasListener)
                    l.onNodeEvaluated(ti, node.name(), result.keyValues().size(), node.keys().size());
            }
        } finally {
            if (hasListener)
                l.onEvaluationEnd(mode, evaluated);
        }
        log.info("Evaluated {} nodes of graph {}", evaluated, graph.name());
        return new GraphEvaluation(graph, ctx, mode, Arrays.asList(results));
    }

    private static NodeEvaluation evaluateNode(Node node, EvalContext ctx, EvalMode mode) {
        Map<Key<?>, Object> keyValues = new LinkedHashMap<>();
        for (Key<?> key : node.keys())
            resolve(Values.value(key), ctx, mode).ifPresent(v -> keyValues.put(key, v));

        List<Optional<Object>> values = new ArrayList<>(node.values().size());
        for (Value<?> v : node.values())
            values.add(resolve(v, ctx, mode).map(Object.class::cast));

        OptionalInt selected = OptionalInt.empty();
        if (node instanceof ChoiceNode choice) {
            Optional<String> label = resolve(choice.condition(), ctx, mode);
            if (label.isPresent())
                selected = OptionalInt.of(choice.select(label.get()));
        }
        return new NodeEvaluation(node, keyValues, values, selected);
    }

    private static <T> Optional<T> resolve(Value<T> value, EvalContext ctx, EvalMode mode) {
        return mode == EvalMode.FULL
                ? Optional.of(Evaluator.eval(value, ctx))
                : Evaluator.peek(value, ctx);
    }
}
