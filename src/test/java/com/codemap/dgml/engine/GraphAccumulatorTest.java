package com.codemap.dgml.engine;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Set;

import com.codemap.dgml.model.Category;
import com.codemap.dgml.model.DirectedGraph;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Property;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphAccumulatorTest {

    @Test
    public void testRemoveNodeDropsTouchingLinks() {
        GraphAccumulator g = new GraphAccumulator(null);
        g.addNode(new Node("A", "A"));
        g.addNode(new Node("B", "B"));
        g.addNode(new Node("C", "C"));
        g.addLink(new Link("A", "B"));
        g.addLink(new Link("B", "C"));
        g.addLink(new Link("A", "C"));

        assertTrue(g.removeNode("B"));
        assertFalse(g.removeNode("B"));

        assertEquals(2, g.nodes().size());
        assertEquals(1, g.links().size());
        assertNull(g.findLink("A", "B", null));
        // key is free again
        assertTrue(g.addLink(new Link("A", "B")));
    }

    @Test
    public void testRemoveLink() {
        GraphAccumulator g = new GraphAccumulator(null);
        g.addLink(new Link("A", "B", "x"));

        assertTrue(g.removeLink(new Link("A", "B", "x")));
        assertFalse(g.removeLink(new Link("A", "B", "x")));
        assertTrue(g.links().isEmpty());
    }

    @Test
    public void testLinksFromAndTo() {
        GraphAccumulator g = new GraphAccumulator(null);
        g.addLink(new Link("A", "B"));
        g.addLink(new Link("A", "C"));
        g.addLink(new Link("C", "A"));

        assertEquals(2, g.linksFrom("A").size());
        assertEquals(1, g.linksTo("A").size());
        assertTrue(g.linksFrom("B").isEmpty());
    }

    @Test
    public void testCategoryAndPropertyFirstWins() {
        GraphAccumulator g = new GraphAccumulator(null);

        assertTrue(g.addCategory(new Category("c", "first")));
        assertFalse(g.addCategory(new Category("c", "second")));
        assertTrue(g.declareProperty(Property.of("p", Property.INT, "first")));
        assertFalse(g.declareProperty(Property.of("p", Property.STRING, "second")));

        assertEquals("first", g.categories().get(0).getLabel());
        assertEquals(Property.INT, g.properties().get(0).getDataType());
    }

    @Test
    public void testDanglingLinks() {
        GraphAccumulator g = new GraphAccumulator(null);
        g.addNode(new Node("A", "A"));
        g.addLink(new Link("A", "A"));
        g.addLink(new Link("A", "Z"));
        g.addLink(new Link("Y", "A"));

        List<Link> dangling = g.danglingLinks();
        assertEquals(2, dangling.size());
        assertEquals("Z", dangling.get(0).getTarget());
        assertEquals("Y", dangling.get(1).getSource());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLinkWithoutEndpointRejected() {
        new GraphAccumulator(null).addLink(new Link("A", null));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testViewsAreReadOnly() {
        new GraphAccumulator(null).nodes().add(new Node("A", "A"));
    }

    @Test
    public void testToGraphIsASnapshot() {
        GraphAccumulator g = new GraphAccumulator(null);
        g.addNode(new Node("A", "A"));
        DirectedGraph snapshot = g.toGraph();
        g.addNode(new Node("B", "B"));

        assertEquals(1, snapshot.getNodes().size());
        assertEquals(2, g.nodes().size());
    }

    @Test
    public void testIdentityFieldsCannotBeReassigned() {
        Set<String> identitySetters = Set.of("setId", "setSource", "setTarget", "setCategory");
        for (Method m : Node.class.getMethods())
            assertFalse(m.getName(), m.getName().equals("setId"));
        for (Method m : Link.class.getMethods())
            assertFalse(m.getName(), identitySetters.contains(m.getName()));
    }

    @Test
    public void testEditedNodeKeepsItsIdentity() {
        GraphAccumulator g = new GraphAccumulator(null);
        g.addNode(new Node("A", "A"));

        Node a = g.findNode("A");
        a.setLabel("renamed");
        a.setCategory("Other");
        a.setProperty("Hub", true);

        assertFalse(g.addNode(new Node("A", "again")));
        assertEquals(1, g.nodes().size());
        assertSame(a, g.findNode("A"));
        assertEquals("renamed", g.toGraph().node("A").getLabel());
    }

    @Test
    public void testEditedLinkStaysReachable() {
        GraphAccumulator g = new GraphAccumulator(null);
        g.addNode(new Node("A", "A"));
        g.addNode(new Node("B", "B"));
        g.addLink(new Link("A", "B", "old"));

        Link l = g.findLink("A", "B", "old");
        l.setLabel("relabelled");
        l.setProperty("Weight", 3);

        assertFalse(g.addLink(new Link("A", "B", "old")));
        assertSame(l, g.findLink("A", "B", "old"));
        assertTrue(g.removeLink(l));
        assertTrue(g.links().isEmpty());
        assertNull(g.findLink("A", "B", "old"));
    }
}
