package com.build.cgraph.api;

/**
 * Raised when a full evaluation reaches a key that has no resolved value.
 *
 * Defaults are filled for every key of a graph before a full pass, so this
 * always points at a defect in graph construction (a value expression that
 * reads a key its node does not declare), never at bad user input.
 */
public final class UnresolvedKeyException extends ConfigGraphException {
    private final String keyName;
    private final String nodeName;

    public UnresolvedKeyException(String keyName) {
        this(keyName, null);
    }

    public UnresolvedKeyException(String keyName, String nodeName) {
        super("Key '" + keyName + "' has no resolved value"
                + (nodeName != null ? " while evaluating node '" + nodeName + "'" : ""));
        this.keyName = keyName;
        this.nodeName = nodeName;
    }

    public String keyName() {
        return keyName;
    }

    /** The node being evaluated, or null when raised outside a graph pass. */
    public String nodeName() {
        return nodeName;
    }

    /** Copy of this failure carrying the node that was being evaluated. */
    public UnresolvedKeyException atNode(String node) {
        UnresolvedKeyException e = new UnresolvedKeyException(keyName, node);
        e.setStackTrace(getStackTrace());
        return e;
    }
}
