package com.codemap.dgml.engine;

import java.util.ArrayList;
import java.util.List;

import com.codemap.dgml.api.Analysis;
import com.codemap.dgml.api.AssemblyListener;
import com.codemap.dgml.api.GraphEditor;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Property;
import com.codemap.dgml.model.Style;
import com.codemap.dgml.model.StyleTarget;
import org.junit.Test;

import static org.junit.Assert.*;

public class AnalysisRunnerTest {

    /** Declares one property and records which properties it could see when executed. */
    private static final class Declaring implements Analysis {
        private final String property;
        private final List<String> seen = new ArrayList<>();

        Declaring(String property) {
            this.property = property;
        }

        @Override
        public void execute(GraphEditor graph) {
            for (Property p : graph.properties())
                seen.add(p.getId());
        }

        @Override
        public List<Property> getProperties() {
            return List.of(Property.of(property, Property.STRING, property));
        }

        @Override
        public List<Style> getStyles() {
            return List.of(new Style(StyleTarget.NODE, property));
        }
    }

    @Test
    public void testAllDeclarationsPrecedeFirstExecute() {
        Declaring first = new Declaring("a");
        Declaring second = new Declaring("b");
        GraphAccumulator graph = new GraphAccumulator(null);

        new AnalysisRunner(List.of(first, second)).run(graph, new AssemblyListener() {
        });

        assertEquals(List.of("a", "b"), first.seen);
        assertEquals(List.of("a", "b"), second.seen);
        assertEquals(2, graph.styles().size());
        assertEquals("a", graph.styles().get(0).getGroupLabel());
    }

    @Test
    public void testAnalysesSeeEarlierChanges() {
        Analysis addsNode = g -> g.addNode(new Node("extra", "extra"));
        Analysis countsNodes = g -> g.findNode("extra").setProperty("Seen", g.nodes().size());
        GraphAccumulator graph = new GraphAccumulator(null);
        graph.addNode(new Node("A", "A"));
        List<String> applied = new ArrayList<>();

        new AnalysisRunner(List.of(addsNode, countsNodes)).run(graph, new AssemblyListener() {
            @Override
            public void onAnalysisApplied(String analysisName) {
                applied.add(analysisName);
            }
        });

        assertEquals(2, graph.findNode("extra").property("Seen"));
        assertEquals(2, applied.size());
    }

    @Test
    public void testFailureIsWrappedWithName() {
        Analysis failing = new Analysis() {
            @Override
            public void execute(GraphEditor graph) {
                throw new IllegalStateException("no luck");
            }

            @Override
            public String name() {
                return "Unlucky";
            }
        };

        try {
            new AnalysisRunner(List.of(failing)).run(new GraphAccumulator(null), new AssemblyListener() {
            });
            fail("Expected AnalysisException");
        } catch (AnalysisException e) {
            assertEquals("Unlucky", e.getAnalysisName());
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullAnalysisRejected() {
        List<Analysis> analyses = new ArrayList<>();
        analyses.add(null);
        new AnalysisRunner(analyses);
    }
}
