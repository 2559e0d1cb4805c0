package com.build.cgraph.api;

import java.util.List;

/**
 * Raised when the edges of a graph form a cycle.
 *
 * The node names are listed in cycle order: each node depends on the next one,
 * and the last one depends on the first.
 */
public final class CyclicGraphException extends ConfigGraphException {
    private final List<String> cycle;

    public CyclicGraphException(List<String> cycle) {
        super("Cycle detected: " + String.join(" -> ", cycle)
                + (cycle.isEmpty() ? "" : " -> " + cycle.get(0)));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
