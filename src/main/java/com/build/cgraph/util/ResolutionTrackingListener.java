package com.build.cgraph.util;

import com.build.cgraph.api.EvaluationListener;
import com.build.cgraph.engine.EvalMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A listener that tracks how much of the graph each evaluation pass resolved.
 *
 * <p>
 * Captures, for the last pass:
 * <ul>
 * <li><b>Coverage:</b> keys known versus keys read, summed over nodes.</li>
 * <li><b>Incomplete nodes:</b> nodes with at least one unknown key, which a
 * partial pass leaves for the full one.</li>
 * <li><b>Failures:</b> the node that aborted the pass, if any.</li>
 * </ul>
 */
public final class ResolutionTrackingListener implements EvaluationListener {
    private static final org.apache.logging.log4j.Logger log = org.apache.logging.log4j.LogManager
            .getLogger(ResolutionTrackingListener.class);

    private EvalMode lastMode;
    private int lastNodeCount, lastNodesEvaluated;
    private int resolvedKeys, totalKeys;
    private final List<String> incompleteNodes = new ArrayList<>();
    private String failedNode;
    private long totalPasses;

    @Override
    public void onEvaluationStart(EvalMode mode, int nodeCount) {
        lastMode = mode;
        lastNodeCount = nodeCount;
        lastNodesEvaluated = 0;
        resolvedKeys = 0;
        totalKeys = 0;
        incompleteNodes.clear();
        failedNode = null;
    }

    @Override
    public void onNodeEvaluated(int topoIndex, String nodeName, int resolved, int total) {
        resolvedKeys += resolved;
        totalKeys += total;
        if (resolved < total)
            incompleteNodes.add(nodeName);
    }

    @Override
    public void onNodeError(int topoIndex, String nodeName, Throwable error) {
        failedNode = nodeName;
        log.warn("Evaluation failed at node '{}': {}", nodeName, error.getMessage());
    }

    @Override
    public void onEvaluationEnd(EvalMode mode, int nodesEvaluated) {
        lastNodesEvaluated = nodesEvaluated;
        totalPasses++;
        log.debug("{} pass: {}/{} nodes, {}/{} keys known", mode, nodesEvaluated, lastNodeCount, resolvedKeys,
                totalKeys);
    }

    public EvalMode lastMode() {
        return lastMode;
    }

    public int lastNodesEvaluated() {
        return lastNodesEvaluated;
    }

    public int resolvedKeys() {
        return resolvedKeys;
    }

    public int totalKeys() {
        return totalKeys;
    }

    /** Share of key reads resolved in the last pass, 1.0 when no node reads a key. */
    public double coverage() {
        return totalKeys > 0 ? (double) resolvedKeys / totalKeys : 1.0;
    }

    public List<String> incompleteNodes() {
        return Collections.unmodifiableList(incompleteNodes);
    }

    /** Node that aborted the last pass, or null. */
    public String failedNode() {
        return failedNode;
    }

    public long totalPasses() {
        return totalPasses;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s\n", "Mode", "Nodes", "Keys", "Coverage"));
        sb.append("--------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %4d/%-5d | %4d/%-5d | %9.1f%%\n",
                lastMode,
                lastNodesEvaluated, lastNodeCount,
                resolvedKeys, totalKeys,
                coverage() * 100));
        if (!incompleteNodes.isEmpty())
            sb.append("Incomplete: ").append(String.join(", ", incompleteNodes)).append('\n');
        if (failedNode != null)
            sb.append("Failed at: ").append(failedNode).append('\n');
        return sb.toString();
    }
}
