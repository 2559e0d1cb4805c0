package com.build.cgraph.api;

/**
 * When the value of a key is needed.
 *
 * CONFIGURE keys drive graph construction and code generation, RUN keys are
 * consumed by the generated artifact when it starts, BOTH keys are needed at
 * either point.
 */
public enum Stage {
    CONFIGURE,
    RUN,
    BOTH;

    public boolean isRuntime() {
        return this == RUN || this == BOTH;
    }

    public boolean isConfigure() {
        return this == CONFIGURE || this == BOTH;
    }

    /**
     * Whether a key of this stage belongs to the argument parser of the given
     * build phase. A BOTH filter (or no filter) keeps every key.
     */
    public boolean matches(Stage filter) {
        if (filter == null)
            return true;
        return switch (filter) {
            case RUN -> isRuntime();
            case CONFIGURE -> isConfigure();
            case BOTH -> true;
        };
    }
}
