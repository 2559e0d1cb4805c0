package com.build.cgraph.engine;

import com.build.cgraph.api.CyclicGraphException;
import com.build.cgraph.api.Node;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Topology -- CSR-encoded static DAG (Directed Acyclic Graph).
 *
 * Data layout:
 * - topoOrder: the nodes sorted topologically. Iterating 0..N visits every
 * node after all the nodes it depends on.
 * - childrenList: a single flattened int array holding, for every node, the
 * topological indices of its dependents.
 * - childrenOffset: childrenOffset[i] points to the start of node i's
 * dependents in childrenList; they run up to childrenOffset[i+1] exclusive.
 *
 * Ordering is stable: among nodes with no relative constraint, the node
 * added first comes first. Generated source follows this order, so the same
 * graph always yields the same text.
 */
@Log4j2
public final class TopologicalOrder {
    // The nodes in topological order.
    private final Node[] topoOrder;

    // Node id -> topological index.
    private final int[] positions;

    // CSR Index and Data: dependents of each node, in topological indices.
    private final int[] childrenOffset;
    private final int[] childrenList;

    // Number of nodes each node depends on.
    private final int[] parentCount;

    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(Node[] topoOrder, int[] positions, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.positions = positions;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node at the given topological index. */
    public Node node(int ti) {
        return topoOrder[ti];
    }

    /** Topological index of a node id. */
    public int position(int nodeId) {
        return positions[nodeId];
    }

    /** Resolves a node name to its topological index. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** Nodes in topological order. */
    public List<Node> nodes() {
        return List.of(topoOrder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<Node> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();

        /** Adds a node. Nodes must be added in id order. */
        public Builder addNode(Node node) {
            if (node.id() != nodes.size())
                throw new IllegalArgumentException("Node " + node.name() + " has id " + node.id()
                        + ", expected " + nodes.size());
            if (nameToIdx.containsKey(node.name()))
                throw new IllegalArgumentException("Duplicate node name: " + node.name());
            nameToIdx.put(node.name(), nodes.size());
            nodes.add(node);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        /**
         * Records that {@code to} depends on {@code from}: {@code from} is
         * ordered first. A self-edge is reported as a cycle by {@link #build()}.
         */
        public Builder addEdge(int from, int to) {
            requireId(from);
            requireId(to);
            forwardEdges.get(from).add(to);
            return this;
        }

        public Builder addEdge(String from, String to) {
            return addEdge(requireIndex(from), requireIndex(to));
        }

        private void requireId(int id) {
            if (id < 0 || id >= nodes.size())
                throw new IllegalArgumentException("Unknown node id: " + id);
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm, always taking the ready node with the
         * smallest id, then reports one concrete cycle if nodes remain.
         *
         * @throws CyclicGraphException if the edges form a cycle.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (List<Integer> targets : forwardEdges)
                for (int child : targets)
                    inDegree[child]++;

            // 2. Seed with nodes that depend on nothing
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            // 3. Kahn's algorithm
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        ready.add(child);
            }
            if (topoIdx != n) {
                List<String> cycle = findCycle(inDegree);
                log.error("Cycle detected among {} of {} nodes: {}", n - topoIdx, n, cycle);
                throw new CyclicGraphException(cycle);
            }

            // 4. Construct compact arrays
            Node[] orderedNodes = new Node[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                orderedNodes[ti] = nodes.get(reverseMap[ti]);
                newNameToIndex.put(orderedNodes[ti].name(), ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            int[] parentCounts = new int[n];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            return new TopologicalOrder(orderedNodes, topoMap, offsets, flatChildren, parentCounts, newNameToIndex);
        }

        /**
         * Every node left over by Kahn's algorithm still has a dependency that is
         * also left over. Walking from dependent to dependency inside that set
         * must therefore revisit a node; the revisited stretch is a cycle, listed
         * so that each node depends on the next.
         */
        private List<String> findCycle(int[] inDegree) {
            int n = nodes.size();
            List<List<Integer>> dependencies = new ArrayList<>(n);
            for (int i = 0; i < n; i++)
                dependencies.add(new ArrayList<>());
            for (int from = 0; from < n; from++)
                for (int to : forwardEdges.get(from))
                    if (inDegree[from] > 0 && inDegree[to] > 0)
                        dependencies.get(to).add(from);

            int start = 0;
            while (inDegree[start] == 0)
                start++;

            Map<Integer, Integer> seenAt = new HashMap<>();
            List<Integer> path = new ArrayList<>();
            int curr = start;
            while (!seenAt.containsKey(curr)) {
                seenAt.put(curr, path.size());
                path.add(curr);
                curr = Collections.min(dependencies.get(curr));
            }
            List<String> cycle = new ArrayList<>();
            for (int id : path.subList(seenAt.get(curr), path.size()))
                cycle.add(nodes.get(id).name());
            return cycle;
        }
    }
}
