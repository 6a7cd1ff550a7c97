package com.codemap.dgml.analysis;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.codemap.dgml.api.Analysis;
import com.codemap.dgml.api.GraphEditor;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Property;
import com.codemap.dgml.model.Style;
import com.codemap.dgml.model.StyleTarget;

/**
 * Marks every node with {@code Referenced=true|false}: whether at least one
 * link points at it. Unreferenced nodes are greyed out.
 */
public final class NodeReferencedAnalysis implements Analysis {
    public static final String REFERENCED_PROPERTY = "Referenced";

    @Override
    public void execute(GraphEditor graph) {
        Set<String> targets = new HashSet<>();
        for (Link l : graph.links())
            targets.add(l.getTarget());
        for (Node node : graph.nodes())
            node.setProperty(REFERENCED_PROPERTY, targets.contains(node.getId()));
    }

    @Override
    public List<Property> getProperties() {
        return List.of(new Property(REFERENCED_PROPERTY, Property.BOOLEAN, "Referenced",
                "Whether any link targets the node"));
    }

    @Override
    public List<Style> getStyles() {
        return List.of(new Style(StyleTarget.NODE, "Unreferenced")
                .condition(REFERENCED_PROPERTY + "='False'")
                .setter("Background", "Gray"));
    }
}
