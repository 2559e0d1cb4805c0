package com.build.cgraph.engine;

import com.build.cgraph.api.Node;
import com.build.cgraph.key.Key;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * What an evaluation pass resolved for one node.
 *
 * @param node           The node.
 * @param keyValues      Known key values, in canonical key order. After a
 *                       full pass every key of the node is present.
 * @param values         Results of the node's value expressions, in order;
 *                       empty entries were not known in a partial pass.
 * @param selectedBranch For a choice node whose condition is known, the
 *                       position of the selected branch.
 */
public record NodeEvaluation(Node node, Map<Key<?>, Object> keyValues, List<Optional<Object>> values,
        OptionalInt selectedBranch) {

    public NodeEvaluation {
        keyValues = Collections.unmodifiableMap(new LinkedHashMap<>(keyValues));
        values = List.copyOf(values);
    }

    /** Whether every key and expression of the node is known. */
    public boolean isComplete() {
        return keyValues.size() == node.keys().size() && values.stream().allMatch(Optional::isPresent);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(Key<T> key) {
        return Optional.ofNullable((T) keyValues.get(key));
    }
}
