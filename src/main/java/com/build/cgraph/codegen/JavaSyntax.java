package com.build.cgraph.codegen;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Helpers for emitting Java source text: identifiers and literals.
 */
public final class JavaSyntax {
    private static final Set<String> RESERVED = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "false", "final", "finally",
            "float", "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long",
            "native", "new", "null", "package", "private", "protected", "public", "return", "short",
            "static", "strictfp", "super", "switch", "synchronized", "this", "throw", "throws",
            "transient", "true", "try", "var", "void", "volatile", "while", "record", "yield", "_");

    private JavaSyntax() {
        // Utility class
    }

    /**
     * Derives a Java identifier from a key or node name.
     *
     * Characters outside {@code [A-Za-z0-9_-]} are dropped and {@code -} becomes
     * {@code _}. Reserved words get a trailing underscore.
     *
     * @throws IllegalArgumentException if the result is empty or starts with a
     *                                  digit.
     */
    public static String identifier(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '-')
                sb.append('_');
            else if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_')
                sb.append(c);
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0)))
            throw new IllegalArgumentException("Illegal name, no valid Java identifier: '" + name + "'");
        String id = sb.toString();
        return RESERVED.contains(id) ? id + "_" : id;
    }

    /** Upper-case constant name, e.g. {@code log-level -> LOG_LEVEL}. */
    public static String constantName(String name) {
        return identifier(name).toUpperCase(Locale.ROOT);
    }

    /** Double-quoted Java string literal with escapes. */
    public static String stringLiteral(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20)
                        sb.append(String.format("\\u%04x", (int) c));
                    else
                        sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Java expression for a plain value: a string, character, int, long,
     * double, boolean or enum constant, or a list or optional of those.
     *
     * @throws IllegalArgumentException for any other type.
     */
    public static String literal(Object value) {
        if (value instanceof String s)
            return stringLiteral(s);
        if (value instanceof Integer || value instanceof Boolean)
            return value.toString();
        if (value instanceof Long l)
            return l + "L";
        if (value instanceof Double d)
            return doubleLiteral(d);
        if (value instanceof Character c)
            return charLiteral(c);
        if (value instanceof Enum<?> e)
            return e.getDeclaringClass().getCanonicalName() + "." + e.name();
        if (value instanceof List<?> list)
            return list.stream().map(JavaSyntax::literal).collect(Collectors.joining(", ", "java.util.List.of(", ")"));
        if (value instanceof Optional<?> opt)
            return opt.map(v -> "java.util.Optional.of(" + literal(v) + ")").orElse("java.util.Optional.empty()");
        throw new IllegalArgumentException("No Java literal for value of type " + value.getClass().getName());
    }

    private static String charLiteral(char c) {
        if (c == '\'')
            return "'\\''";
        if (c == '"')
            return "'\"'";
        String s = stringLiteral(String.valueOf(c));
        return "'" + s.substring(1, s.length() - 1) + "'";
    }

    private static String doubleLiteral(double d) {
        if (Double.isNaN(d))
            return "Double.NaN";
        if (Double.isInfinite(d))
            return d > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
        return Double.toString(d);
    }
}
