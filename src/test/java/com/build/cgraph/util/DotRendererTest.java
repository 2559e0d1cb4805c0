package com.build.cgraph.util;

import com.build.cgraph.api.Node;
import com.build.cgraph.api.Stage;
import com.build.cgraph.dsl.GraphBuilder;
import com.build.cgraph.engine.ConfigGraph;
import com.build.cgraph.engine.EvalMode;
import com.build.cgraph.engine.GraphEvaluation;
import com.build.cgraph.engine.GraphEvaluator;
import com.build.cgraph.key.Descriptors;
import com.build.cgraph.key.Key;
import com.build.cgraph.key.KeyRegistry;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.value.EvalContext;
import com.build.cgraph.value.Values;
import org.junit.Before;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.Assert.*;

public class DotRendererTest {
    private Key<Integer> port;
    private Key<String> store;
    private ConfigGraph graph;

    @Before
    public void setUp() {
        KeyRegistry registry = new KeyRegistry();
        port = registry.create("port", "", Stage.CONFIGURE, 8080, Descriptors.integer());
        store = registry.create("store", "", Stage.CONFIGURE, "memory", Descriptors.string());

        GraphBuilder g = GraphBuilder.create("web");
        var clock = g.vertex("clock", "clock()");                                   // n0
        var memory = g.vertex("memory", "new Memory()");                            // n1
        var disk = g.vertex("disk", "new Disk()");                                  // n2
        LinkedHashMap<String, Node> branches = new LinkedHashMap<>();
        branches.put("memory", memory);
        branches.put("disk", disk);
        var sessions = g.choice("sessions", Values.value(store), branches, "memory"); // n3
        var http = g.configurable("http", "Http", KeySet.of(port), sessions);       // n4
        g.dataDependency(http, clock);
        g.app("main", http, clock);                                                 // n5
        graph = g.build();
    }

    @Test
    public void testShapesAndEdgeStyles() {
        String dot = DotRenderer.render(graph);

        assertTrue(dot.startsWith("digraph \"web\" {\n"));
        assertTrue(dot.endsWith("}\n"));
        assertTrue(dot.contains("n0 [label=\"clock\", shape=circle];"));
        assertTrue(dot.contains("n3 [label=\"sessions\\nmemory|disk\\nstore\", shape=circle];"));
        assertTrue(dot.contains("n4 [label=\"http\\nHttp\\nport\", shape=box];"));
        assertTrue(dot.contains("n5 [label=\"main\", shape=diamond];"));

        // Choice branches: default bold, others dotted
        assertTrue(dot.contains("n3 -> n1 [style=bold];"));
        assertTrue(dot.contains("n3 -> n2 [style=dotted];"));
        // Configurable argument solid, data dependency dashed
        assertTrue(dot.contains("n4 -> n3 [style=solid];"));
        assertTrue(dot.contains("n4 -> n0 [style=dashed];"));
        // App base bold
        assertTrue(dot.contains("n5 -> n4 [style=bold];"));
        assertTrue(dot.contains("n5 -> n0 [style=solid];"));
    }

    @Test
    public void testEvaluatedLabelsMarkDefaults() {
        EvalContext ctx = EvalContext.empty().set(store, "disk");
        GraphEvaluation eval = new GraphEvaluator().evaluate(graph, ctx, EvalMode.FULL);
        String dot = DotRenderer.render(graph, eval);

        assertTrue(dot.contains("port=8080*"));
        assertTrue(dot.contains("store=disk\""));
        // Selected branch replaces the default one
        assertTrue(dot.contains("n3 -> n2 [style=bold];"));
        assertTrue(dot.contains("n3 -> n1 [style=dotted];"));
    }

    @Test
    public void testPartialLabelsShowUnknownValues() {
        GraphEvaluation eval = new GraphEvaluator().evaluate(graph, EvalContext.empty(), EvalMode.PARTIAL);
        assertTrue(DotRenderer.render(graph, eval).contains("port=?"));
    }

    @Test
    public void testQuote() {
        assertEquals("\"a\\\"b\\\\c\\nd\"", DotRenderer.quote("a\"b\\c\nd"));
    }

    @Test
    public void testLabelsShowExpressionResults() {
        GraphBuilder g = GraphBuilder.create("addr");
        g.configurable("server", "Server", KeySet.empty(),
                List.of(Values.map(p -> "ADDR-" + p, Values.value(port))), List.of(), List.of());
        ConfigGraph addr = g.build();

        String partial = DotRenderer.render(addr,
                new GraphEvaluator().evaluate(addr, EvalContext.empty(), EvalMode.PARTIAL));
        assertTrue(partial.contains("label=\"server\\nServer\\nport=?\\n$0=?\""));

        String full = DotRenderer.render(addr,
                new GraphEvaluator().evaluate(addr, EvalContext.empty().set(port, 9000), EvalMode.FULL));
        assertTrue(full.contains("label=\"server\\nServer\\nport=9000\\n$0=ADDR-9000\""));
    }
}
