package com.codemap.dgml.util;

import java.util.List;

import com.codemap.dgml.model.DirectedGraph;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Style;
import com.codemap.dgml.model.StyleTarget;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private static DirectedGraph sample() {
        Node api = new Node("api", "API", "Service").addCategoryRef("p:web").withProperty("Hub", true);
        Node db = new Node("db.main", "Main \"DB\"");
        Link link = new Link("api", "db.main", "reads");
        return new DirectedGraph(List.of(api, db), List.of(link), List.of(),
                List.of(new Style(StyleTarget.NODE, "Hub")), List.of());
    }

    @Test
    public void testExplainNode() {
        String text = new GraphExplain(sample()).explainNode("api");

        assertTrue(text.startsWith("Node: api\n"));
        assertTrue(text.contains("  Label: API\n"));
        assertTrue(text.contains("  Category: Service\n"));
        assertTrue(text.contains("  Category refs: p:web\n"));
        assertTrue(text.contains("  Hub = true\n"));
        assertTrue(text.contains("  Links: 1 out, 0 in\n"));
    }

    @Test
    public void testExplainMissingNode() {
        assertEquals("Node: ghost (not in graph)\n", new GraphExplain(sample()).explainNode("ghost"));
    }

    @Test
    public void testDumpTopology() {
        String dump = new GraphExplain(sample()).dumpTopology();

        assertEquals("Graph (2 nodes, 1 links):\n"
                + "  api [Service] -> db.main\n"
                + "  db.main\n"
                + "  style NODE Hub\n", dump);
    }

    @Test
    public void testMermaid() {
        String mermaid = new GraphExplain(sample()).toMermaid();

        assertEquals("graph TD;\n"
                + "  n0[\"API\"];\n"
                + "  n1[\"Main #quot;DB#quot;\"];\n"
                + "  n0 -- \"reads\" --> n1;\n", mermaid);
    }

    @Test
    public void testMermaidKeepsPunctuationVariantsApart() {
        DirectedGraph g = new DirectedGraph(List.of(new Node("a.b", null), new Node("a_b", null)),
                List.of(new Link("a.b", "a_b"), new Link("a_b", "gone")), List.of(), List.of(), List.of());

        String mermaid = new GraphExplain(g).toMermaid();

        assertTrue(mermaid.contains("  n0[\"a.b\"];\n"));
        assertTrue(mermaid.contains("  n1[\"a_b\"];\n"));
        assertTrue(mermaid.contains("  n0 --> n1;\n"));
        assertTrue(mermaid.contains("  n2[\"gone\"];\n"));
        assertTrue(mermaid.contains("  n1 --> n2;\n"));
    }
}
