package com.build.cgraph;

import com.build.cgraph.api.KeyParseException;
import com.build.cgraph.api.Stage;
import com.build.cgraph.engine.EvalMode;
import com.build.cgraph.engine.GraphEvaluation;
import com.build.cgraph.io.GraphDefinition;
import com.build.cgraph.io.GraphDefinitionParser;
import com.build.cgraph.key.Key;
import com.build.cgraph.util.ResolutionTrackingListener;
import com.build.cgraph.value.EvalContext;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.Assert.*;

public class ConfigSessionTest {
    private ConfigSession session;

    @Before
    public void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/graphs/web.json")) {
            GraphDefinition def = GraphDefinitionParser.read(in);
            session = new ConfigSession(def);
        }
    }

    @Test
    public void testDescribeShowsKnownValues() {
        String dot = session.describe("--port=9090");
        assertTrue(dot.startsWith("digraph \"web\" {\n"));
        assertTrue(dot.contains("port=9090"));
        // Not given on the command line, so unknown before the full pass
        assertTrue(dot.contains("log_level=?"));
    }

    @Test
    public void testDescribeAfterFullEvaluation() {
        String dot = session.describe(true, "--store=disk");
        assertTrue(dot.contains("log_level=info*"));
        assertTrue(dot.contains("hosts=localhost*\\nport=8080*"));
        assertTrue(dot.contains("store=disk\""));
        // sessions (n3) selects disk_store (n2) over the default memory_store (n1)
        assertTrue(dot.contains("n3 -> n2 [style=bold];"));
        assertTrue(dot.contains("n3 -> n1 [style=dotted];"));
        assertFalse(dot.contains("=?"));
    }

    @Test
    public void testGenerateWithDefaults() {
        String src = session.generate("com.example.gen", "Main");
        assertTrue(src.contains("package com.example.gen;\n"));
        assertTrue(src.contains("final var sessions = memory_store;\n"));
        assertTrue(src.contains("final var logger = new com.example.web.Logger(clock, \"info\");\n"));
        assertTrue(src.contains(
                "final var http = new com.example.web.HttpServer(logger, sessions, java.util.List.of(\"localhost\"), 8080);\n"));
        assertTrue(src.contains("final var main = http.apply(logger);\n"));
        assertTrue(src.contains("return main;\n"));
    }

    @Test
    public void testGenerateWithArguments() {
        String src = session.generate("", "Main", "--store=disk", "-l", "debug", "--hosts=a,b");
        assertFalse(src.contains("package "));
        assertTrue(src.contains("final var sessions = disk_store;\n"));
        assertTrue(src.contains("new com.example.web.Logger(clock, \"debug\")"));
        assertTrue(src.contains("java.util.List.of(\"a\", \"b\")"));
    }

    @Test
    public void testGenerateKeys() {
        String src = session.generateKeys("", "Keys", "--port=1");
        assertTrue(src.contains("public final class Keys {"));
        assertTrue(src.contains("java.util.Map.entry(PORT, 1)"));
        assertTrue(src.contains("java.util.Map.entry(STORE, \"memory\")"));
    }

    @Test
    public void testInvalidValue() {
        try {
            session.generate("", "Main", "--port=http");
            fail("Expected KeyParseException");
        } catch (KeyParseException e) {
            assertEquals(1, e.failures().size());
            assertEquals("port", e.failures().get(0).keyName());
        }
    }

    @Test
    public void testContextForRunStage() {
        EvalContext ctx = session.context(Stage.RUN, "--hosts=x");
        Key<?> hosts = session.registry().get("hosts").orElseThrow();
        assertTrue(ctx.isExplicit(hosts));
        assertEquals(List.of("x"), ctx.get(hosts).orElseThrow());
    }

    @Test
    public void testManual() {
        String man = session.manual();
        assertTrue(man.startsWith("APPLICATION OPTIONS\n"));
        assertTrue(man.contains("\nLOGGING\n  --log_level, -l=LEVEL\n"));
        assertTrue(man.contains("  --port=PORT\n"));
    }

    @Test
    public void testExplain() {
        String text = session.explain("--store=disk");
        assertTrue(text.startsWith("Graph web (7 nodes):\n"));
        assertTrue(text.contains("Node: sessions"));
    }

    @Test
    public void testResolutionTracking() {
        ResolutionTrackingListener tracking = session.enableResolutionTracking();

        GraphEvaluation full = session.evaluate(EvalMode.FULL);
        assertEquals(EvalMode.FULL, full.mode());
        assertEquals(7, tracking.lastNodesEvaluated());
        assertEquals(1.0, tracking.coverage(), 1e-9);

        session.evaluate(EvalMode.PARTIAL, "--port=1");
        assertEquals(EvalMode.PARTIAL, tracking.lastMode());
        assertTrue(tracking.incompleteNodes().contains("logger"));
        assertEquals(2, tracking.totalPasses());
    }
}
