package com.codemap.dgml.util;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.codemap.dgml.model.CategoryRef;
import com.codemap.dgml.model.DirectedGraph;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Style;

/**
 * Diagnostic utility for inspecting an assembled graph.
 *
 * <p>
 * Generates human-readable string representations of the graph structure and
 * of single nodes. Intended for debugging sessions, test failure messages and
 * quick previews; the document for real viewers comes from
 * {@link com.codemap.dgml.io.DgmlWriter}.
 */
public final class GraphExplain {
    private final DirectedGraph graph;

    public GraphExplain(DirectedGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps the state of a single node.
     */
    public String explainNode(String nodeId) {
        Node node = graph.node(nodeId);
        if (node == null)
            return "Node: " + nodeId + " (not in graph)\n";

        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeId).append('\n')
                .append("  Label: ").append(node.getLabel()).append('\n')
                .append("  Category: ").append(node.getCategory()).append('\n');
        if (!node.getCategoryRefs().isEmpty()) {
            sb.append("  Category refs: ");
            List<CategoryRef> refs = node.getCategoryRefs();
            for (int i = 0; i < refs.size(); i++) {
                sb.append(refs.get(i).getRef());
                if (i < refs.size() - 1)
                    sb.append(", ");
            }
            sb.append('\n');
        }
        for (Map.Entry<String, Object> p : node.getProperties().entrySet())
            sb.append("  ").append(p.getKey()).append(" = ").append(p.getValue()).append('\n');

        int out = 0, in = 0;
        for (Link l : graph.getLinks()) {
            if (nodeId.equals(l.getSource()))
                out++;
            if (nodeId.equals(l.getTarget()))
                in++;
        }
        sb.append("  Links: ").append(out).append(" out, ").append(in).append(" in\n");
        return sb.toString();
    }

    /**
     * Dumps the whole graph, one line per node with its outgoing links.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.getNodes().size()).append(" nodes, ")
                .append(graph.getLinks().size()).append(" links):\n");
        for (Node node : graph.getNodes()) {
            sb.append("  ").append(node.getId());
            if (node.getCategory() != null)
                sb.append(" [").append(node.getCategory()).append(']');
            boolean first = true;
            for (Link l : graph.getLinks()) {
                if (!node.getId().equals(l.getSource()))
                    continue;
                sb.append(first ? " -> " : ", ").append(l.getTarget());
                first = false;
            }
            sb.append('\n');
        }
        for (Style s : graph.getStyles())
            sb.append("  style ").append(s.getTargetType()).append(' ').append(s.getGroupLabel()).append('\n');
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Nodes are declared first, in graph order, as {@code n0}, {@code n1}, ...
     * with the label (or, failing that, the id) as text; then the links. Link
     * endpoints that name no node get an alias of their own. Link labels (or,
     * failing that, categories) become edge labels.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        Map<String, String> aliases = new HashMap<>();
        for (Node node : graph.getNodes()) {
            String label = node.getLabel() != null ? node.getLabel() : node.getId();
            declare(sb, aliases, node.getId(), label);
        }

        for (Link l : graph.getLinks()) {
            String source = aliases.containsKey(l.getSource()) ? aliases.get(l.getSource())
                    : declare(sb, aliases, l.getSource(), l.getSource());
            String target = aliases.containsKey(l.getTarget()) ? aliases.get(l.getTarget())
                    : declare(sb, aliases, l.getTarget(), l.getTarget());
            String label = l.getLabel() != null ? l.getLabel() : l.getCategory();
            sb.append("  ").append(source);
            if (label != null)
                sb.append(" -- \"").append(escape(label)).append("\" --> ");
            else
                sb.append(" --> ");
            sb.append(target).append(";\n");
        }
        return sb.toString();
    }

    private static String declare(StringBuilder sb, Map<String, String> aliases, String id, String label) {
        String alias = "n" + aliases.size();
        aliases.put(id, alias);
        sb.append("  ").append(alias).append("[\"").append(escape(label)).append("\"];\n");
        return alias;
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
