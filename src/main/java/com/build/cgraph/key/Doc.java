package com.build.cgraph.key;

import com.build.cgraph.api.Descriptor;

import picocli.CommandLine;

import java.util.List;

/**
 * Command-line presentation of a key: help section, value placeholder, help
 * text and option names.
 *
 * @param docs  Help section the option is listed under.
 * @param docv  Placeholder for the option value, e.g. {@code PORT}.
 * @param doc   Help text; may be empty.
 * @param names Option names without dashes. One-letter names become short
 *              options ({@code -p}), longer ones long options ({@code --port}).
 */
public record Doc(String docs, String docv, String doc, List<String> names) {
    public static final String DEFAULT_SECTION = "APPLICATION OPTIONS";
    public static final String DEFAULT_DOCV = "VALUE";

    public Doc {
        if (names == null || names.isEmpty())
            throw new IllegalArgumentException("Doc needs at least one option name");
        docs = docs != null ? docs : DEFAULT_SECTION;
        docv = docv != null ? docv : DEFAULT_DOCV;
        doc = doc != null ? doc : "";
        names = List.copyOf(names);
    }

    public static Doc create(String docs, String docv, String doc, String... names) {
        return new Doc(docs, docv, doc, List.of(names));
    }

    /** Minimal doc: default section and placeholder, one option name. */
    public static Doc of(String name, String doc) {
        return new Doc(null, null, doc, List.of(name));
    }

    /** Option names with their dash prefixes, in declaration order. */
    public String[] optionNames() {
        return names.stream()
                .map(n -> n.length() == 1 ? "-" + n : "--" + n)
                .toArray(String[]::new);
    }

    /** The name used to look the option up in a parse result. */
    public String primaryOption() {
        return optionNames()[0];
    }

    /**
     * Converts this doc into a picocli option. The option is typed as a raw
     * string; conversion is done by the key's descriptor so that failures can
     * be reported per key.
     */
    public CommandLine.Model.OptionSpec toOptionSpec(Descriptor<?> descriptor, String defaultText) {
        String[] opts = optionNames();
        String[] aliases = new String[opts.length - 1];
        System.arraycopy(opts, 1, aliases, 0, aliases.length);
        String help = doc.isEmpty() ? descriptor.description() : doc;
        return CommandLine.Model.OptionSpec.builder(opts[0], aliases)
                .paramLabel(docv)
                .description(help + " (" + descriptor.description() + ", default: " + defaultText + ")")
                .type(String.class)
                .arity("1")
                .build();
    }
}
