package com.build.cgraph.api;

/** Raised when two keys claim the same command-line option name. */
public final class OptionNameClashException extends ConfigGraphException {
    private final String option;
    private final String firstKey;
    private final String secondKey;

    public OptionNameClashException(String option, String firstKey, String secondKey) {
        this(option, firstKey, secondKey, null);
    }

    public OptionNameClashException(String option, String firstKey, String secondKey, Throwable cause) {
        super("Option " + option + " of key '" + secondKey + "' is already used by key '" + firstKey + "'", cause);
        this.option = option;
        this.firstKey = firstKey;
        this.secondKey = secondKey;
    }

    /** The option name with its dash prefix. */
    public String option() {
        return option;
    }

    public String firstKey() {
        return firstKey;
    }

    public String secondKey() {
        return secondKey;
    }
}
