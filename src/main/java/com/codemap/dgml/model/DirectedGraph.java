package com.codemap.dgml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The finished graph document: nodes, links, categories, styles and the
 * property schema, each in assembly order.
 *
 * <p>
 * The element lists are fixed at construction. Individual nodes and links
 * stay plain data objects, but nothing in this library touches them once the
 * graph has been handed out.
 */
@JsonPropertyOrder({ "nodes", "links", "categories", "properties", "styles" })
public final class DirectedGraph {
    private final List<Node> nodes;
    private final List<Link> links;
    private final List<Category> categories;
    private final List<Style> styles;
    private final List<Property> properties;

    private final Map<String, Node> nodesById;

    public DirectedGraph(List<Node> nodes, List<Link> links, List<Category> categories,
            List<Style> styles, List<Property> properties) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.links = Collections.unmodifiableList(new ArrayList<>(links));
        this.categories = Collections.unmodifiableList(new ArrayList<>(categories));
        this.styles = Collections.unmodifiableList(new ArrayList<>(styles));
        this.properties = Collections.unmodifiableList(new ArrayList<>(properties));

        this.nodesById = new HashMap<>(nodes.size() * 2);
        for (Node n : this.nodes)
            nodesById.putIfAbsent(n.getId(), n);
    }

    public static DirectedGraph empty() {
        return new DirectedGraph(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<Link> getLinks() {
        return links;
    }

    public List<Category> getCategories() {
        return categories;
    }

    public List<Style> getStyles() {
        return styles;
    }

    public List<Property> getProperties() {
        return properties;
    }

    /**
     * Looks up a node by id.
     *
     * @return The node, or null if not found.
     */
    public Node node(String id) {
        return nodesById.get(id);
    }

    /**
     * Looks up a link by its identity triple.
     *
     * @return The link, or null if not found.
     */
    public Link link(String source, String target, String category) {
        Link.Key key = new Link.Key(source, target, category);
        for (Link l : links) {
            if (l.key().equals(key))
                return l;
        }
        return null;
    }

    /**
     * Looks up a schema entry by id.
     *
     * @return The property declaration, or null if not declared.
     */
    public Property property(String id) {
        for (Property p : properties) {
            if (p.getId().equals(id))
                return p;
        }
        return null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty() && links.isEmpty() && categories.isEmpty() && styles.isEmpty()
                && properties.isEmpty();
    }

    @Override
    public String toString() {
        return "DirectedGraph[nodes=" + nodes.size() + ", links=" + links.size() + ", categories="
                + categories.size() + ", styles=" + styles.size() + ", properties=" + properties.size() + "]";
    }
}
