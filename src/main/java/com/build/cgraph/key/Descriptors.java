package com.build.cgraph.key;

import com.build.cgraph.api.Descriptor;
import com.build.cgraph.api.ParseResult;
import com.build.cgraph.codegen.JavaSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Factory for value-type descriptors.
 *
 * Every built-in descriptor satisfies the round-trip law
 * {@code parse(print(x)) == x} for values produced by normal construction, and
 * serializes to a Java expression that evaluates back to the value.
 */
public final class Descriptors {
    /** Printed form of an empty element, which would otherwise vanish. */
    static final String EMPTY_MARK = "\\0";

    private static final Descriptor<String> STRING = create(
            JavaSyntax::stringLiteral,
            ParseResult::ok,
            Function.identity(),
            "string",
            Function.identity());

    private static final Descriptor<Integer> INTEGER = create(
            i -> Integer.toString(i),
            Descriptors::parseInt,
            i -> Integer.toString(i),
            "int",
            raw -> "Integer.valueOf(" + raw + ".trim())");

    private static final Descriptor<Boolean> BOOL = create(
            b -> Boolean.toString(b),
            Descriptors::parseBool,
            b -> Boolean.toString(b),
            "bool",
            raw -> "Boolean.valueOf(" + raw + ".trim())");

    private Descriptors() {
        // Utility class
    }

    /**
     * Builds a descriptor from its parts.
     *
     * @param serializer  Value to Java source expression.
     * @param parser      Raw text to value; must not throw.
     * @param printer     Value to display text.
     * @param description Short type description.
     */
    public static <T> Descriptor<T> create(Function<T, String> serializer, Function<String, ParseResult<T>> parser,
            Function<T, String> printer, String description) {
        return create(serializer, parser, printer, description, raw -> null);
    }

    /**
     * Builds a descriptor whose values can also be parsed by generated code.
     *
     * @param parserSource Java expression of the value parsed from the given
     *                     {@code String} expression, or null if generated code
     *                     cannot parse it.
     */
    public static <T> Descriptor<T> create(Function<T, String> serializer, Function<String, ParseResult<T>> parser,
            Function<T, String> printer, String description, Function<String, String> parserSource) {
        return new SimpleDescriptor<>(serializer, parser, printer, description, parserSource);
    }

    public static Descriptor<String> string() {
        return STRING;
    }

    public static Descriptor<Integer> integer() {
        return INTEGER;
    }

    public static Descriptor<Boolean> bool() {
        return BOOL;
    }

    /**
     * Comma-separated list of elements. The empty string is the empty list.
     * Serialized as {@code java.util.List.of(...)}.
     *
     * <p>
     * Printed elements escape {@code ,} and {@code \} with a backslash. An
     * empty element prints as {@code \0}, so a list holding one empty element
     * does not read back as the empty list.
     */
    public static <T> Descriptor<List<T>> list(Descriptor<T> element) {
        return create(
                values -> values.stream()
                        .map(element::serialize)
                        .collect(Collectors.joining(", ", "java.util.List.of(", ")")),
                raw -> parseList(element, raw),
                values -> printList(values.stream().map(element::print).collect(Collectors.toList())),
                "list of " + element.description(),
                // Lists of lists have no run-time parser: the element lambdas would shadow each other
                raw -> element.parserSource("item")
                        .filter(elem -> !elem.contains("->"))
                        .map(elem -> "splitList(" + raw + ").stream().map(item -> " + elem
                                + ").collect(java.util.stream.Collectors.toList())")
                        .orElse(null));
    }

    /**
     * Optional value. The empty string is the empty optional, a present empty
     * value prints as {@code \0}. Backslashes of a present value are doubled.
     * Serialized as {@code java.util.Optional.empty()} or
     * {@code java.util.Optional.of(...)}.
     */
    public static <T> Descriptor<Optional<T>> optional(Descriptor<T> element) {
        return create(
                opt -> opt.map(v -> "java.util.Optional.of(" + element.serialize(v) + ")")
                        .orElse("java.util.Optional.empty()"),
                raw -> raw.isEmpty()
                        ? ParseResult.ok(Optional.<T>empty())
                        : element.parse(unescape(raw)).map(Optional::of),
                opt -> opt.map(v -> escape(element.print(v), false)).orElse(""),
                "optional " + element.description(),
                raw -> element.parserSource("unescape(" + raw + ")")
                        .map(elem -> "(" + raw + ".isEmpty() ? java.util.Optional.empty() : java.util.Optional.of("
                                + elem + "))")
                        .orElse(null));
    }

    /**
     * Joins already printed elements the way {@link #list(Descriptor)} prints
     * them.
     */
    public static String printList(List<String> printed) {
        return printed.stream().map(s -> escape(s, true)).collect(Collectors.joining(","));
    }

    /**
     * Splits on commas not preceded by a backslash and removes the escapes.
     * Inverse of {@link #printList(List)}; the empty string gives no element.
     */
    public static List<String> splitList(String raw) {
        List<String> tokens = new ArrayList<>();
        if (raw.isEmpty())
            return tokens;
        StringBuilder token = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                i = unescapeAt(raw, i, token);
            } else if (c == ',') {
                tokens.add(token.toString());
                token.setLength(0);
            } else {
                token.append(c);
            }
        }
        tokens.add(token.toString());
        return tokens;
    }

    static String unescape(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length())
                i = unescapeAt(raw, i, sb);
            else
                sb.append(c);
        }
        return sb.toString();
    }

    /** Appends the escape at {@code i} and returns the index of its last character. */
    private static int unescapeAt(String raw, int i, StringBuilder out) {
        char next = raw.charAt(i + 1);
        if (next == ',' || next == '\\')
            out.append(next);
        else if (next != '0')
            out.append('\\').append(next);
        return i + 1;
    }

    static String escape(String s, boolean comma) {
        if (s.isEmpty())
            return EMPTY_MARK;
        StringBuilder sb = new StringBuilder(s.length() + 4);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || (comma && c == ','))
                sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    private static <T> ParseResult<List<T>> parseList(Descriptor<T> element, String raw) {
        List<String> tokens = splitList(raw);
        List<T> values = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            ParseResult<T> r = element.parse(tokens.get(i));
            if (!r.isOk())
                return ParseResult.error("element " + (i + 1) + ": " + r.error());
            values.add(r.value());
        }
        return ParseResult.ok(List.copyOf(values));
    }

    private static ParseResult<Integer> parseInt(String raw) {
        String s = raw.trim();
        if (s.isEmpty())
            return ParseResult.error("invalid value '" + raw + "', expected an integer");
        int start = s.charAt(0) == '-' || s.charAt(0) == '+' ? 1 : 0;
        if (start == s.length())
            return ParseResult.error("invalid value '" + raw + "', expected an integer");
        for (int i = start; i < s.length(); i++)
            if (s.charAt(i) < '0' || s.charAt(i) > '9')
                return ParseResult.error("invalid value '" + raw + "', expected an integer");
        try {
            return ParseResult.ok(Integer.parseInt(s));
        } catch (NumberFormatException e) {
            return ParseResult.error("invalid value '" + raw + "', integer out of range");
        }
    }

    private static ParseResult<Boolean> parseBool(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> ParseResult.ok(Boolean.TRUE);
            case "false" -> ParseResult.ok(Boolean.FALSE);
            default -> ParseResult.error("invalid value '" + raw + "', expected either 'true' or 'false'");
        };
    }

    private record SimpleDescriptor<T>(Function<T, String> serializer, Function<String, ParseResult<T>> parser,
            Function<T, String> printer, String description, Function<String, String> parserSource)
            implements Descriptor<T> {

        @Override
        public Optional<String> parserSource(String raw) {
            return Optional.ofNullable(parserSource.apply(raw));
        }

        @Override
        public ParseResult<T> parse(String raw) {
            return parser.apply(raw);
        }

        @Override
        public String print(T value) {
            return printer.apply(value);
        }

        @Override
        public String serialize(T value) {
            return serializer.apply(value);
        }

        @Override
        public String toString() {
            return description;
        }
    }
}
