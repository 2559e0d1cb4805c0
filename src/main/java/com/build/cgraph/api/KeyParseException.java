package com.build.cgraph.api;

import java.util.List;
import java.util.stream.Collectors;

/** Raised when command-line key values cannot be parsed. */
public final class KeyParseException extends ConfigGraphException {
    private final List<ParseFailure> failures;

    public KeyParseException(List<ParseFailure> failures) {
        super("Invalid key values: " + failures.stream()
                .map(ParseFailure::toString)
                .collect(Collectors.joining("; ")));
        this.failures = List.copyOf(failures);
    }

    public KeyParseException(String message, Throwable cause) {
        super(message, cause);
        this.failures = List.of();
    }

    public List<ParseFailure> failures() {
        return failures;
    }
}
