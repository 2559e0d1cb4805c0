package com.build.cgraph.api;

import java.util.Optional;

/**
 * Type descriptor for the value of a configuration key.
 *
 * A descriptor bundles everything the engine needs to know about a value type
 * without ever inspecting the type itself:
 *
 * 1. Parsing: turning a raw command-line token into a typed value. Parsing is
 * total; malformed input yields an error result, never an exception.
 *
 * 2. Printing: the human-facing text of a value (help output, dot labels). For
 * every value produced by normal construction, parse(print(x)) equals x.
 *
 * 3. Serialization: a Java source expression that evaluates to the same value
 * in generated code.
 *
 * Descriptors are immutable and shared by every key of the same type.
 *
 * @param <T> The value type.
 */
public interface Descriptor<T> {

    /**
     * Parses a raw token.
     *
     * @param raw The raw text, never null.
     * @return The parsed value or an error message.
     */
    ParseResult<T> parse(String raw);

    /** Human-readable text for the value. */
    String print(T value);

    /** Java source expression reproducing the value. */
    String serialize(T value);

    /** Short description of the type, e.g. "string" or "list of int". */
    String description();

    /**
     * Java expression parsing the {@code String} expression {@code raw} into a
     * value, for generated code that reads overrides at run time. The
     * expression may call the {@code splitList} and {@code unescape} helpers
     * of the generated class.
     *
     * @return Empty if generated code cannot parse this type.
     */
    default Optional<String> parserSource(String raw) {
        return Optional.empty();
    }
}
