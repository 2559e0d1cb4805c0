package com.build.cgraph.io;

import com.build.cgraph.api.CyclicGraphException;
import com.build.cgraph.api.DuplicateKeyNameException;
import com.build.cgraph.api.NodeKind;
import com.build.cgraph.api.Stage;
import com.build.cgraph.engine.ConfigGraph;
import com.build.cgraph.key.Descriptors;
import com.build.cgraph.key.Key;
import com.build.cgraph.key.KeyRegistry;
import com.build.cgraph.node.ChoiceNode;
import com.build.cgraph.node.ConfigurableNode;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.Assert.*;

public class JsonGraphCompilerTest {
    private KeyRegistry registry;
    private JsonGraphCompiler compiler;

    @Before
    public void setUp() {
        registry = new KeyRegistry();
        compiler = new JsonGraphCompiler();
    }

    private static GraphDefinition resource(String name) throws IOException {
        try (InputStream in = JsonGraphCompilerTest.class.getResourceAsStream("/graphs/" + name)) {
            assertNotNull("missing fixture " + name, in);
            return GraphDefinitionParser.read(in);
        }
    }

    @Test
    public void testCompileWebGraph() throws IOException {
        ConfigGraph graph = compiler.compile(resource("web.json"), registry);

        assertEquals("web", graph.name());
        assertEquals(7, graph.nodeCount());
        assertEquals("main", graph.root().name());
        assertEquals(5, graph.keys().size());
        assertEquals(5, registry.size());

        ConfigurableNode http = (ConfigurableNode) graph.node("http");
        assertEquals("com.example.web.HttpServer", http.implementation());
        assertEquals(List.of("hosts", "port"), http.keys().names());
        assertEquals(List.of("logger", "sessions"), graph.arguments(http).stream().map(n -> n.name()).toList());
        assertEquals(List.of("clock"), graph.dataDependencies(http).stream().map(n -> n.name()).toList());

        ChoiceNode sessions = (ChoiceNode) graph.node("sessions");
        assertEquals(List.of("memory", "disk"), sessions.labels());
        assertEquals(NodeKind.APP, graph.node("main").kind());
    }

    @Test
    public void testKeyDefinitions() throws IOException {
        compiler.compile(resource("web.json"), registry);

        Key<?> port = registry.get("port").orElseThrow();
        assertEquals(Integer.valueOf(8080), port.defaultValue());
        assertEquals(Stage.CONFIGURE, port.stage());
        assertEquals("PORT", port.doc().docv());

        Key<?> hosts = registry.get("hosts").orElseThrow();
        assertEquals(List.of("localhost"), hosts.defaultValue());
        assertTrue(hosts.isRuntime());

        Key<?> level = registry.get("log_level").orElseThrow();
        assertEquals("LOGGING", level.doc().docs());
        assertEquals(List.of("log_level", "l"), level.doc().names());
    }

    @Test
    public void testNodesMayBeListedInAnyOrder() {
        String json = "{\"graph\": {\"name\": \"g\", \"nodes\": ["
                + "{\"name\": \"b\", \"type\": \"configurable\", \"implementation\": \"B\", \"args\": [\"a\"]},"
                + "{\"name\": \"a\", \"type\": \"vertex\", \"payload\": \"1\"}]}}";
        ConfigGraph graph = compiler.compile(GraphDefinitionParser.parse(json), registry);
        assertEquals("b", graph.root().name());
    }

    @Test
    public void testArgumentCycle() throws IOException {
        try {
            compiler.compile(resource("argument_cycle.json"), registry);
            fail("Expected CyclicGraphException");
        } catch (CyclicGraphException e) {
            assertEquals(3, e.cycle().size());
            assertTrue(e.cycle().containsAll(List.of("A", "B", "C")));
        }
    }

    @Test
    public void testDataDependencyCycle() throws IOException {
        try {
            compiler.compile(resource("data_cycle.json"), registry);
            fail("Expected CyclicGraphException");
        } catch (CyclicGraphException e) {
            assertTrue(e.cycle().containsAll(List.of("A", "B", "C")));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNodeReference() {
        compiler.compile(GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\", \"nodes\": ["
                + "{\"name\": \"b\", \"type\": \"app\", \"base\": \"missing\"}]}}"), registry);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownKey() {
        compiler.compile(GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\", \"nodes\": ["
                + "{\"name\": \"b\", \"type\": \"configurable\", \"implementation\": \"B\", \"keys\": [\"nope\"]}]}}"),
                registry);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNodeType() {
        compiler.compile(GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\", \"nodes\": ["
                + "{\"name\": \"b\", \"type\": \"widget\"}]}}"), registry);
    }

    @Test
    public void testInvalidDefault() {
        try {
            compiler.compile(GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\", \"keys\": ["
                    + "{\"name\": \"port\", \"type\": \"int\", \"default\": \"http\"}]}}"), registry);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("port"));
        }
    }

    @Test(expected = DuplicateKeyNameException.class)
    public void testKeyAlreadyRegistered() {
        registry.create("port", "", Stage.BOTH, 1, Descriptors.integer());
        compiler.compile(GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\", \"keys\": ["
                + "{\"name\": \"port\", \"type\": \"int\"}]}}"), registry);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testChoiceNeedsStringKey() {
        compiler.compile(GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\","
                + "\"keys\": [{\"name\": \"n\", \"type\": \"int\"}],"
                + "\"nodes\": [{\"name\": \"a\", \"type\": \"vertex\", \"payload\": \"1\"},"
                + "{\"name\": \"c\", \"type\": \"choice\", \"key\": \"n\", \"branches\": {\"x\": \"a\"}}]}}"),
                registry);
    }

    @Test
    public void testListDefaultKeepsCommas() {
        compiler.compile(GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\", \"keys\": ["
                + "{\"name\": \"paths\", \"type\": \"string_list\", \"default\": [\"a,b\", \"\"]}]}}"), registry);
        assertEquals(List.of("a,b", ""), registry.get("paths").orElseThrow().defaultValue());
    }

    @Test
    public void testMissingDefaultIsEmptyValue() {
        compiler.compile(GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\", \"keys\": ["
                + "{\"name\": \"verbose\", \"type\": \"bool\"},"
                + "{\"name\": \"tags\", \"type\": \"string-list\"}]}}"), registry);
        assertEquals(Boolean.FALSE, registry.get("verbose").orElseThrow().defaultValue());
        assertEquals(List.of(), registry.get("tags").orElseThrow().defaultValue());
        assertEquals(Stage.BOTH, registry.get("tags").orElseThrow().stage());
    }
}
