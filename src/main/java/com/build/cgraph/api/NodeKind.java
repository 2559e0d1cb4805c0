package com.build.cgraph.api;

/** The node kinds of a configuration graph, with their dot shapes. */
public enum NodeKind {
    VERTEX("circle"),
    CONFIGURABLE("box"),
    APP("diamond"),
    CHOICE("circle");

    private final String shape;

    NodeKind(String shape) {
        this.shape = shape;
    }

    public String shape() {
        return shape;
    }
}
