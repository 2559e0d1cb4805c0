package com.build.cgraph.dsl;

import com.build.cgraph.api.Node;
import com.build.cgraph.api.NodeKind;
import com.build.cgraph.api.Stage;
import com.build.cgraph.engine.ConfigGraph;
import com.build.cgraph.key.Descriptors;
import com.build.cgraph.key.Key;
import com.build.cgraph.key.KeyRegistry;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.node.ChoiceNode;
import com.build.cgraph.node.ConfigurableNode;
import com.build.cgraph.value.Values;
import org.junit.Before;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.Assert.*;

public class GraphBuilderTest {
    private GraphBuilder g;

    @Before
    public void setUp() {
        g = GraphBuilder.create("test");
    }

    @Test
    public void testArgumentOrderIsPreserved() {
        var a = g.vertex("a", "1");
        var b = g.vertex("b", "2");
        var c = g.vertex("c", "3");
        ConfigurableNode node = g.configurable("node", "Node", KeySet.empty(), c, a, b);
        ConfigGraph graph = g.build();

        assertEquals(List.of(c, a, b), graph.arguments(node));
        assertEquals(NodeKind.CONFIGURABLE, node.kind());
        assertEquals("Node", node.implementation());
    }

    @Test
    public void testAppBaseIsFirstArgument() {
        var f = g.vertex("f", "x -> x");
        var x = g.vertex("x", "1");
        var app = g.app("app", f, x);
        ConfigGraph graph = g.build();

        assertEquals(List.of(f, x), graph.arguments(app));
        assertEquals(NodeKind.APP, app.kind());
    }

    @Test
    public void testChoice() {
        KeyRegistry registry = new KeyRegistry();
        Key<String> mode = registry.create("mode", "", Stage.CONFIGURE, "fast", Descriptors.string());
        var fast = g.vertex("fast", "new Fast()");
        var safe = g.vertex("safe", "new Safe()");
        LinkedHashMap<String, Node> branches = new LinkedHashMap<>();
        branches.put("fast", fast);
        branches.put("safe", safe);
        ChoiceNode choice = g.choice("impl", Values.value(mode), branches, "safe");

        assertEquals(List.of("fast", "safe"), choice.labels());
        assertEquals(1, choice.defaultBranch());
        assertEquals(0, choice.select("fast"));
        assertEquals(1, choice.select("other"));
        assertEquals(KeySet.of(mode), choice.keys());
        assertEquals(List.of(fast, safe), g.build().arguments(choice));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testChoiceUnknownDefault() {
        LinkedHashMap<String, Node> branches = new LinkedHashMap<>();
        branches.put("a", g.vertex("a", "1"));
        g.choice("c", Values.pure("a"), branches, "b");
    }

    @Test
    public void testGetNode() {
        var v = g.vertex("v", "1");
        assertSame(v, g.getNode("v"));
        assertNull(g.getNode("w"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeName() {
        g.vertex("v", "1");
        g.vertex("v", "2");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testClashingIdentifiers() {
        g.vertex("my-node", "1");
        g.vertex("my_node", "2");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testForeignNodeRejected() {
        var foreign = GraphBuilder.create("other").vertex("v", "1");
        g.configurable("c", "C", KeySet.empty(), foreign);
    }

    @Test(expected = IllegalStateException.class)
    public void testNoChangesAfterBuild() {
        g.build();
        g.vertex("late", "1");
    }
}
