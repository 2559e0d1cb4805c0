package com.build.cgraph.io;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphDefinitionParserTest {

    @Test
    public void testParse() {
        GraphDefinition def = GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\", \"version\": \"2\","
                + "\"keys\": [{\"name\": \"port\", \"type\": \"int\", \"default\": 80, \"extra\": true}],"
                + "\"nodes\": [{\"name\": \"c\", \"type\": \"choice\", \"key\": \"k\","
                + "\"branches\": {\"z\": \"a\", \"a\": \"b\"}, \"default\": \"a\"}]}}");

        assertEquals("g", def.getGraph().getName());
        assertEquals("2", def.getGraph().getVersion());
        assertEquals(80, def.getGraph().getKeys().get(0).getDefaultValue());
        GraphDefinition.NodeDef c = def.getGraph().getNodes().get(0);
        assertEquals("a", c.getDefaultBranch());
        // Branch order follows the document
        assertEquals(List.of("z", "a"), List.copyOf(c.getBranches().keySet()));
    }

    @Test
    public void testWriteReadsBack() {
        GraphDefinition def = GraphDefinitionParser.parse("{\"graph\": {\"name\": \"g\","
                + "\"nodes\": [{\"name\": \"v\", \"type\": \"vertex\", \"payload\": \"1\"}]}}");
        String json = GraphDefinitionParser.write(def);
        assertEquals(def, GraphDefinitionParser.parse(json));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingGraph() {
        GraphDefinitionParser.parse("{}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        GraphDefinitionParser.parse("{\"graph\": ");
    }
}
