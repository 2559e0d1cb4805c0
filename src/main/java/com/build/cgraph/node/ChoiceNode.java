package com.build.cgraph.node;

import com.build.cgraph.api.NodeKind;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.value.Dependencies;
import com.build.cgraph.value.Value;

import java.util.List;
import java.util.Objects;

/**
 * Selects one of several branch nodes from the value of a condition.
 *
 * Branches are the node's argument edges, labelled in the same order. A
 * condition value matching no label selects the default branch. Once the
 * condition is known (after a full evaluation, or a partial one if its keys
 * were given on the command line), the choice collapses to the selected branch.
 */
public final class ChoiceNode extends AbstractNode {
    private final Value<String> condition;
    private final List<String> labels;
    private final int defaultBranch;
    private final KeySet keys;

    public ChoiceNode(int id, String name, Value<String> condition, List<String> labels, int defaultBranch) {
        super(id, name, NodeKind.CHOICE);
        if (labels.isEmpty())
            throw new IllegalArgumentException("Choice " + name + " needs at least one branch");
        if (defaultBranch < 0 || defaultBranch >= labels.size())
            throw new IllegalArgumentException("Choice " + name + ": default branch out of range");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.labels = List.copyOf(labels);
        this.defaultBranch = defaultBranch;
        this.keys = Dependencies.of(condition);
    }

    public Value<String> condition() {
        return condition;
    }

    public List<String> labels() {
        return labels;
    }

    public int defaultBranch() {
        return defaultBranch;
    }

    /** Branch position selected by a condition value. */
    public int select(String label) {
        int i = labels.indexOf(label);
        return i >= 0 ? i : defaultBranch;
    }

    @Override
    public KeySet keys() {
        return keys;
    }

    @Override
    public List<Value<?>> values() {
        return List.of(condition);
    }
}
