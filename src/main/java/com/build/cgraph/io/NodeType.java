package com.build.cgraph.io;

/** Node types of a graph definition. */
public enum NodeType {
    VERTEX,
    CONFIGURABLE,
    APP,
    CHOICE;

    public static NodeType fromString(String text) {
        for (NodeType b : NodeType.values()) {
            if (b.name().equalsIgnoreCase(text)) {
                return b;
            }
        }
        throw new IllegalArgumentException("Unknown NodeType: " + text);
    }
}
