package com.build.cgraph.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads graph definitions from JSON.
 */
public final class GraphDefinitionParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphDefinitionParser() {
        // Utility class
    }

    /** Parses a JSON file into a GraphDefinition. */
    public static GraphDefinition read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    /** Parses a JSON stream into a GraphDefinition. The stream is not closed. */
    public static GraphDefinition read(InputStream in) throws IOException {
        return validate(MAPPER.readValue(in, GraphDefinition.class));
    }

    /**
     * Parses a JSON string into a GraphDefinition.
     *
     * @throws IllegalArgumentException if the text is not a graph definition.
     */
    public static GraphDefinition parse(String json) {
        try {
            return validate(MAPPER.readValue(json, GraphDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed graph definition: " + e.getOriginalMessage(), e);
        }
    }

    /** Serializes a definition back to indented JSON. */
    public static String write(GraphDefinition def) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static GraphDefinition validate(GraphDefinition def) {
        if (def == null || def.getGraph() == null)
            throw new IllegalArgumentException("Missing 'graph' key");
        if (def.getGraph().getName() == null)
            throw new IllegalArgumentException("Missing graph name");
        return def;
    }
}
