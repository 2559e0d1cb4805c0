package com.build.cgraph.util;

import com.build.cgraph.api.EvaluationListener;
import com.build.cgraph.engine.EvalMode;

import java.util.Arrays;

/**
 * Aggregates multiple {@link EvaluationListener} instances.
 */
public class CompositeEvaluationListener implements EvaluationListener {
    private EvaluationListener[] listeners = new EvaluationListener[0];

    public CompositeEvaluationListener add(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onEvaluationStart(EvalMode mode, int nodeCount) {
        for (EvaluationListener l : listeners)
            l.onEvaluationStart(mode, nodeCount);
    }

    @Override
    public void onNodeEvaluated(int topoIndex, String nodeName, int resolvedKeys, int totalKeys) {
        for (EvaluationListener l : listeners)
            l.onNodeEvaluated(topoIndex, nodeName, resolvedKeys, totalKeys);
    }

    @Override
    public void onNodeError(int topoIndex, String nodeName, Throwable error) {
        for (EvaluationListener l : listeners)
            l.onNodeError(topoIndex, nodeName, error);
    }

    @Override
    public void onEvaluationEnd(EvalMode mode, int nodesEvaluated) {
        for (EvaluationListener l : listeners)
            l.onEvaluationEnd(mode, nodesEvaluated);
    }
}
