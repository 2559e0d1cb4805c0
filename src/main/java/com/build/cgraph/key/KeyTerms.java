package com.build.cgraph.key;

import com.build.cgraph.api.KeyParseException;
import com.build.cgraph.api.OptionNameClashException;
import com.build.cgraph.api.ParseFailure;
import com.build.cgraph.api.ParseResult;
import com.build.cgraph.api.Stage;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Command-line parsing of key values.
 *
 * A term is a pure function from process arguments to the values of a set of
 * keys. It never writes to an evaluation context; the caller binds the result
 * (see {@code EvalContext#bind}). Keys that do not appear on the command line
 * are absent from the result, so a partial evaluation can tell explicit values
 * from defaults.
 *
 * Unknown options are ignored, so the same arguments can be fed to the parser
 * of each build phase (configure-time keys, run-time keys, or both).
 */
@Log4j2
public final class KeyTerms {

    private KeyTerms() {
        // Utility class
    }

    /** Parser for a single key. */
    public static <T> KeyTerm<T> termKey(Key<T> key) {
        return new KeyTerm<>(key);
    }

    /** Parser for every key in the set. */
    public static Term term(KeySet keys) {
        return new Term(keys);
    }

    /**
     * Parser for the keys of one build phase.
     *
     * @param stage Stage filter; RUN keeps runtime keys, CONFIGURE keeps
     *              configure keys, BOTH or null keeps all keys.
     */
    public static Term term(Stage stage, KeySet keys) {
        return new Term(keys.filter(stage));
    }

    private static CommandLine.ParseResult parseArgs(KeySet keys, String[] args) {
        CommandSpec spec = commandSpec(keys);
        try {
            return new CommandLine(spec).parseArgs(args);
        } catch (CommandLine.ParameterException e) {
            throw new KeyParseException(e.getMessage(), e);
        }
    }

    private static CommandSpec commandSpec(KeySet keys) {
        CommandSpec spec = CommandSpec.create();
        spec.parser().unmatchedArgumentsAllowed(true);
        spec.parser().overwrittenOptionsAllowed(true);
        Map<String, String> owners = new HashMap<>();
        for (Key<?> key : keys) {
            // Keys of different registries may share option names
            for (String option : key.doc().optionNames()) {
                String owner = owners.putIfAbsent(option, key.name());
                if (owner != null)
                    throw new OptionNameClashException(option, owner, key.name());
            }
            spec.addOption(optionSpec(key));
        }
        return spec;
    }

    private static <T> CommandLine.Model.OptionSpec optionSpec(Key<T> key) {
        return key.doc().toOptionSpec(key.descriptor(), key.descriptor().print(key.defaultValue()));
    }

    /** Raw option text for the key, or null when it was not given. */
    private static String rawValue(CommandLine.ParseResult parsed, Key<?> key) {
        String option = key.doc().primaryOption();
        if (!parsed.hasMatchedOption(option))
            return null;
        return parsed.matchedOption(option).getValue();
    }

    /** A parser for one key. */
    public static final class KeyTerm<T> {
        private final Key<T> key;

        private KeyTerm(Key<T> key) {
            this.key = key;
        }

        public Key<T> key() {
            return key;
        }

        /**
         * Parses the key from the arguments.
         *
         * @return The parsed value if the option was given, the key's default
         *         otherwise, or the descriptor's error for a malformed value.
         */
        public ParseResult<T> parse(String... args) {
            return parseExplicit(args).orElseGet(() -> ParseResult.ok(key.defaultValue()));
        }

        /** Like {@link #parse(String...)} but empty when the option is absent. */
        public Optional<ParseResult<T>> parseExplicit(String... args) {
            String raw = rawValue(parseArgs(KeySet.of(key), args), key);
            return raw == null ? Optional.empty() : Optional.of(key.descriptor().parse(raw));
        }

        /** The picocli option this key contributes to a command line. */
        public CommandLine.Model.OptionSpec optionSpec() {
            return KeyTerms.optionSpec(key);
        }
    }

    /** A combined parser for a set of keys. */
    public static final class Term {
        private final KeySet keys;

        private Term(KeySet keys) {
            this.keys = keys;
        }

        public KeySet keys() {
            return keys;
        }

        /**
         * A fresh picocli command spec holding one option per key, for glue code
         * that wants to print usage help or merge the options into its own
         * command.
         */
        public CommandSpec commandSpec() {
            return KeyTerms.commandSpec(keys);
        }

        /**
         * Parses the arguments. Values that fail their descriptor are collected
         * as failures; the other keys are still parsed.
         *
         * @throws KeyParseException on structural errors, e.g. an option
         *                           without its value.
         */
        public Result parse(String... args) {
            CommandLine.ParseResult parsed = parseArgs(keys, args);
            Map<Key<?>, Object> values = new LinkedHashMap<>();
            List<ParseFailure> failures = new ArrayList<>();
            for (Key<?> key : keys) {
                String raw = rawValue(parsed, key);
                if (raw == null)
                    continue;
                ParseResult<?> r = key.descriptor().parse(raw);
                if (r.isOk()) {
                    values.put(key, r.value());
                } else {
                    log.warn("Invalid value for --{}: {}", key.name(), r.error());
                    failures.add(new ParseFailure(key.name(), raw, r.error()));
                }
            }
            return new Result(values, failures);
        }
    }

    /** Values given on the command line, and the values that failed to parse. */
    public static final class Result {
        private final Map<Key<?>, Object> values;
        private final List<ParseFailure> failures;

        Result(Map<Key<?>, Object> values, List<ParseFailure> failures) {
            this.values = Collections.unmodifiableMap(values);
            this.failures = List.copyOf(failures);
        }

        /** Explicitly given values, in canonical key order. */
        public Map<Key<?>, Object> values() {
            return values;
        }

        @SuppressWarnings("unchecked")
        public <T> Optional<T> get(Key<T> key) {
            return Optional.ofNullable((T) values.get(key));
        }

        public List<ParseFailure> failures() {
            return failures;
        }

        public boolean hasFailures() {
            return !failures.isEmpty();
        }

        /**
         * @return this result.
         * @throws KeyParseException if any value failed to parse.
         */
        public Result orThrow() {
            if (hasFailures())
                throw new KeyParseException(failures);
            return this;
        }
    }
}
