package com.build.cgraph.key;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Human-readable documentation of keys.
 */
public final class KeyDocs {

    private KeyDocs() {
        // Utility class
    }

    /**
     * One-line summary: name, type, stage, default and help text.
     * e.g. {@code port (int, configure, default: 8080): HTTP port.}
     */
    public static String describe(Key<?> key) {
        StringBuilder sb = new StringBuilder(64)
                .append(key.name())
                .append(" (").append(key.descriptor().description())
                .append(", ").append(key.stage().name().toLowerCase(Locale.ROOT))
                .append(", default: ").append(printDefault(key))
                .append(')');
        if (!key.doc().doc().isEmpty())
            sb.append(": ").append(key.doc().doc());
        return sb.toString();
    }

    /** Option entry as it appears in a manual. */
    public static String emit(Key<?> key) {
        Doc doc = key.doc();
        StringBuilder sb = new StringBuilder(128);
        sb.append("  ").append(String.join(", ", List.of(doc.optionNames())))
                .append('=').append(doc.docv()).append('\n');
        sb.append("      ");
        if (!doc.doc().isEmpty())
            sb.append(doc.doc()).append(' ');
        sb.append("(").append(key.descriptor().description())
                .append(", default: ").append(printDefault(key))
                .append(key.isRuntime() ? ", also at run time" : "")
                .append(")\n");
        return sb.toString();
    }

    /** Every key grouped under its help section, sections in name order. */
    public static String manual(KeySet keys) {
        Map<String, List<Key<?>>> sections = new TreeMap<>();
        for (Key<?> k : keys)
            sections.computeIfAbsent(k.doc().docs(), s -> new ArrayList<>()).add(k);
        StringBuilder sb = new StringBuilder(512);
        for (var section : sections.entrySet()) {
            if (sb.length() > 0)
                sb.append('\n');
            sb.append(section.getKey()).append('\n');
            for (Key<?> k : section.getValue())
                sb.append(emit(k));
        }
        return sb.toString();
    }

    private static <T> String printDefault(Key<T> key) {
        return key.descriptor().print(key.defaultValue());
    }
}
