package com.build.cgraph.engine;

/** How much of a graph an evaluation pass resolves. */
public enum EvalMode {
    /**
     * Resolve only what is already known, typically keys given on the command
     * line. Defaults are not filled. Used for quick previews of a graph.
     */
    PARTIAL,

    /**
     * Fill every unset key with its default, then resolve everything. Used
     * before generating source or building.
     */
    FULL
}
