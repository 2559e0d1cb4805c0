package com.build.cgraph.api;

import com.build.cgraph.engine.EvalMode;

/**
 * Observability interface for monitoring a graph evaluation pass.
 *
 * Implementations can be registered with the GraphEvaluator to receive
 * callbacks while nodes are resolved. Typical uses are tracing which keys a
 * partial pass could already resolve, and collecting failures for reporting.
 */
public interface EvaluationListener {

    /**
     * Called before the first node is visited.
     *
     * @param mode      The evaluation mode of the pass.
     * @param nodeCount Number of nodes in the graph.
     */
    void onEvaluationStart(EvalMode mode, int nodeCount);

    /**
     * Called after a node has been visited.
     *
     * @param topoIndex    Position of the node in topological order.
     * @param nodeName     The node name.
     * @param resolvedKeys Number of the node's keys with a known value.
     * @param totalKeys    Number of keys the node depends on.
     */
    void onNodeEvaluated(int topoIndex, String nodeName, int resolvedKeys, int totalKeys);

    /**
     * Called when a node fails to evaluate.
     *
     * @param topoIndex Position of the node in topological order.
     * @param nodeName  The failing node.
     * @param error     The failure.
     */
    void onNodeError(int topoIndex, String nodeName, Throwable error);

    /**
     * Called once the pass is complete, whether it succeeded or not.
     *
     * @param mode           The evaluation mode of the pass.
     * @param nodesEvaluated Number of nodes visited without error.
     */
    void onEvaluationEnd(EvalMode mode, int nodesEvaluated);
}
