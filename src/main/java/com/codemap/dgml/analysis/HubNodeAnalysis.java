package com.codemap.dgml.analysis;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.codemap.dgml.api.Analysis;
import com.codemap.dgml.api.GraphEditor;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Property;
import com.codemap.dgml.model.Style;
import com.codemap.dgml.model.StyleTarget;

/**
 * Flags the most connected nodes of the graph.
 *
 * <p>
 * A node's degree is the number of links it takes part in, incoming or
 * outgoing; a self-loop counts once. By default the nodes sharing the highest
 * degree are hubs. With a threshold, every node whose degree reaches it is a
 * hub. Hubs get {@code Hub=true} and are painted red by the contributed
 * style. A graph without links has no hubs.
 */
public final class HubNodeAnalysis implements Analysis {
    public static final String HUB_PROPERTY = "Hub";

    private final int threshold;

    public HubNodeAnalysis() {
        this(0);
    }

    /**
     * @param threshold minimum degree of a hub; 0 or less selects the nodes of
     *                  maximum degree.
     */
    public HubNodeAnalysis(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public void execute(GraphEditor graph) {
        Map<String, Integer> degrees = degrees(graph.links());
        int cutoff = threshold > 0 ? threshold : maxDegree(degrees);
        if (cutoff <= 0)
            return;

        for (Node node : graph.nodes()) {
            if (degrees.getOrDefault(node.getId(), 0) >= cutoff)
                node.setProperty(HUB_PROPERTY, Boolean.TRUE);
        }
    }

    @Override
    public List<Property> getProperties() {
        return List.of(new Property(HUB_PROPERTY, Property.BOOLEAN, "Hub", "Node with the most connections"));
    }

    @Override
    public List<Style> getStyles() {
        return List.of(new Style(StyleTarget.NODE, "Hub")
                .condition(HUB_PROPERTY + "='True'")
                .setter("Background", "Red"));
    }

    static Map<String, Integer> degrees(List<Link> links) {
        Map<String, Integer> degrees = new HashMap<>();
        for (Link l : links) {
            degrees.merge(l.getSource(), 1, Integer::sum);
            if (!l.getTarget().equals(l.getSource()))
                degrees.merge(l.getTarget(), 1, Integer::sum);
        }
        return degrees;
    }

    private static int maxDegree(Map<String, Integer> degrees) {
        int max = 0;
        for (int d : degrees.values())
            max = Math.max(max, d);
        return max;
    }
}
