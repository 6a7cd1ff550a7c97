package com.codemap.dgml.builder;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.codemap.dgml.model.GraphElement;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Style;
import com.codemap.dgml.model.StyleTarget;
import org.junit.Test;

import static org.junit.Assert.*;

public class ElementBuilderTest {

    interface Shape {
        String name();
    }

    static class Circle implements Shape {
        @Override
        public String name() {
            return "circle";
        }
    }

    static class Disc extends Circle {
        @Override
        public String name() {
            return "disc";
        }
    }

    @Test
    public void testAssignableMatchAcceptsSubtypesAndInterfaces() {
        var byInterface = new NodeBuilder<>(Shape.class, s -> new Node(s.name(), s.name()));
        var byClass = new NodeBuilder<>(Circle.class, c -> new Node(c.name(), c.name()));

        assertTrue(byInterface.accepts(new Circle()));
        assertTrue(byInterface.accepts(new Disc()));
        assertTrue(byClass.accepts(new Disc()));
        assertFalse(byClass.accepts("not a shape"));
        assertFalse(byClass.accepts(null));
    }

    @Test
    public void testExactMatchRejectsSubtypes() {
        var exact = new NodeBuilder<>(Circle.class, c -> new Node(c.name(), c.name()), null, TypeMatch.EXACT);

        assertTrue(exact.accepts(new Circle()));
        assertFalse(exact.accepts(new Disc()));
        assertEquals(TypeMatch.EXACT, exact.typeMatch());
        assertTrue(exact.toString().contains("exact"));
    }

    @Test
    public void testPredicateIsEvaluatedAfterTypeCheck() {
        var onlyDiscs = new NodeBuilder<>(Shape.class, s -> new Node(s.name(), s.name()),
                s -> s.name().equals("disc"));

        assertFalse(onlyDiscs.accepts(new Circle()));
        assertTrue(onlyDiscs.accepts(new Disc()));
        // predicate must never see a foreign type
        assertFalse(onlyDiscs.accepts(42));
    }

    @Test
    public void testSingleBuilderNullResultProducesNothing() {
        var none = new LinkBuilder<>(String.class, s -> null);

        assertEquals(0, none.build("x").count());
    }

    @Test
    public void testMultiBuilderSkipsNullsAndKeepsOrder() {
        var many = new NodesBuilder<>(String.class,
                s -> Stream.of(new Node(s + "1", null), null, new Node(s + "2", null)));

        List<String> ids = many.build("n").map(Node::getId).collect(Collectors.toList());
        assertEquals(List.of("n1", "n2"), ids);
    }

    @Test
    public void testMultiBuilderNullStreamProducesNothing() {
        var nothing = new CategoriesBuilder<>(String.class, s -> null);

        assertEquals(0, nothing.build("x").count());
    }

    @Test
    public void testStyleBuilderStampsTargetType() {
        var nodeStyle = new StyleBuilder<>(Node.class, n -> new Style(StyleTarget.LINK, "wrong"));

        Style s = nodeStyle.build(new Node("A", "A")).findFirst().orElseThrow();
        assertEquals(StyleTarget.NODE, s.getTargetType());
        assertEquals(StyleTarget.NODE, nodeStyle.target());
        assertFalse(nodeStyle.accepts(new Link("A", "B")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStyleBuilderRejectsAmbiguousElementType() {
        new StyleBuilder<>(GraphElement.class, e -> new Style());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullSourceTypeRejected() {
        new NodeBuilder<String>(null, s -> new Node(s, s));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullMapperRejected() {
        new NodeBuilder<>(String.class, null);
    }

    @Test
    public void testRegistryKeepsRegistrationOrder() {
        var first = new NodeBuilder<>(String.class, s -> new Node(s, "first"));
        var second = new NodesBuilder<>(String.class, s -> Stream.of(new Node(s, "second")));
        var third = new NodeBuilder<>(Integer.class, i -> new Node(i.toString(), "third"));

        BuilderRegistry registry = BuilderRegistry.builder().node(first).nodes(second).node(third)
                .link(new LinkBuilder<>(String.class, s -> new Link(s, s)))
                .build();

        assertEquals(List.of(first, second, third), registry.nodeBuilders());
        assertEquals(1, registry.linkBuilders().size());
        assertEquals(4, registry.size());
        assertTrue(registry.styleBuilders().isEmpty());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testRegistryIsImmutable() {
        BuilderRegistry.builder().build().nodeBuilders().add(new NodeBuilder<>(String.class, s -> new Node(s, s)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRegistryRejectsNullRule() {
        BuilderRegistry.builder().node(null);
    }

    @Test
    public void testEmptyRegistry() {
        assertEquals(0, BuilderRegistry.empty().size());
    }
}
