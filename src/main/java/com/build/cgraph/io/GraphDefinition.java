package com.build.cgraph.io;

import java.util.LinkedHashMap;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;

/**
 * POJO representation of a configuration graph: its keys and its nodes.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Meta-information about the graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name, version;
        private List<KeyDef> keys;
        private List<NodeDef> nodes;
    }

    /** Definition of a configuration key. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class KeyDef {
        private String name, type, stage, doc, section, docv;
        private List<String> aliases;
        @JsonProperty("default")
        private Object defaultValue;
    }

    /**
     * Definition of a single node. Which fields apply depends on the type:
     * {@code payload} for vertices; {@code implementation}, {@code keys} and
     * {@code args} for configurables; {@code base} and {@code args} for
     * applications; {@code key}, {@code branches} and {@code default} for
     * choices. {@code dependencies} applies to every type.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, description;
        private String payload, implementation, base, key;
        private List<String> keys, args, dependencies;
        private LinkedHashMap<String, String> branches;
        @JsonProperty("default")
        private String defaultBranch;
    }
}
