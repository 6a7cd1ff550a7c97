package com.codemap.dgml.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.codemap.dgml.api.AssemblyListener;
import com.codemap.dgml.api.GraphEditor;
import com.codemap.dgml.model.Category;
import com.codemap.dgml.model.DirectedGraph;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Property;
import com.codemap.dgml.model.Style;

/**
 * The graph under construction for a single assembly.
 *
 * <p>
 * All insertions funnel through here so the merge policy lives in one place:
 * nodes are unique by id, links by {@link Link#key()}, categories and
 * property declarations by id. The first element inserted for a key wins,
 * later ones are dropped and reported to the listener. Styles are appended
 * without any de-duplication.
 *
 * <p>
 * Not thread-safe; one instance per assembly.
 */
public final class GraphAccumulator implements GraphEditor {
    private final AssemblyListener listener;

    private final List<Node> nodes = new ArrayList<>();
    private final Map<String, Node> nodesById = new HashMap<>();
    private final List<Link> links = new ArrayList<>();
    private final Map<Link.Key, Link> linksByKey = new HashMap<>();
    private final List<Category> categories = new ArrayList<>();
    private final Map<String, Category> categoriesById = new HashMap<>();
    private final List<Style> styles = new ArrayList<>();
    private final List<Property> properties = new ArrayList<>();
    private final Map<String, Property> propertiesById = new HashMap<>();

    public GraphAccumulator(AssemblyListener listener) {
        this.listener = listener != null ? listener : new AssemblyListener() {
        };
    }

    @Override
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public List<Link> links() {
        return Collections.unmodifiableList(links);
    }

    @Override
    public List<Category> categories() {
        return Collections.unmodifiableList(categories);
    }

    @Override
    public List<Style> styles() {
        return Collections.unmodifiableList(styles);
    }

    @Override
    public List<Property> properties() {
        return Collections.unmodifiableList(properties);
    }

    @Override
    public Node findNode(String id) {
        return nodesById.get(id);
    }

    @Override
    public Link findLink(String source, String target, String category) {
        return linksByKey.get(new Link.Key(source, target, category));
    }

    @Override
    public List<Link> linksFrom(String nodeId) {
        List<Link> out = new ArrayList<>();
        for (Link l : links) {
            if (l.getSource().equals(nodeId))
                out.add(l);
        }
        return out;
    }

    @Override
    public List<Link> linksTo(String nodeId) {
        List<Link> in = new ArrayList<>();
        for (Link l : links) {
            if (l.getTarget().equals(nodeId))
                in.add(l);
        }
        return in;
    }

    @Override
    public boolean addNode(Node node) {
        if (node.getId() == null)
            throw new IllegalArgumentException("Node id must not be null (label: " + node.getLabel() + ")");
        if (nodesById.putIfAbsent(node.getId(), node) != null) {
            listener.onDuplicateDiscarded(node, node.getId());
            return false;
        }
        nodes.add(node);
        return true;
    }

    @Override
    public boolean addLink(Link link) {
        if (link.getSource() == null || link.getTarget() == null)
            throw new IllegalArgumentException("Link endpoints must not be null: " + link.key());
        Link.Key key = link.key();
        if (linksByKey.putIfAbsent(key, link) != null) {
            listener.onDuplicateDiscarded(link, key.toString());
            return false;
        }
        links.add(link);
        return true;
    }

    @Override
    public boolean addCategory(Category category) {
        if (category.getId() == null)
            throw new IllegalArgumentException("Category id must not be null");
        if (categoriesById.putIfAbsent(category.getId(), category) != null) {
            listener.onDuplicateDiscarded(category, category.getId());
            return false;
        }
        categories.add(category);
        return true;
    }

    @Override
    public void addStyle(Style style) {
        if (style == null)
            throw new IllegalArgumentException("Style must not be null");
        styles.add(style);
    }

    @Override
    public boolean declareProperty(Property property) {
        if (property.getId() == null)
            throw new IllegalArgumentException("Property id must not be null");
        if (propertiesById.putIfAbsent(property.getId(), property) != null) {
            listener.onDuplicateDiscarded(property, property.getId());
            return false;
        }
        properties.add(property);
        return true;
    }

    @Override
    public boolean removeNode(String id) {
        Node removed = nodesById.remove(id);
        if (removed == null)
            return false;
        nodes.remove(removed);
        Iterator<Link> it = links.iterator();
        while (it.hasNext()) {
            Link l = it.next();
            if (l.getSource().equals(id) || l.getTarget().equals(id)) {
                linksByKey.remove(l.key());
                it.remove();
            }
        }
        return true;
    }

    @Override
    public boolean removeLink(Link link) {
        Link removed = linksByKey.remove(link.key());
        if (removed == null)
            return false;
        links.remove(removed);
        return true;
    }

    /** Links with a source or target that names no node in the graph, in link order. */
    public List<Link> danglingLinks() {
        List<Link> dangling = new ArrayList<>();
        for (Link l : links) {
            if (!nodesById.containsKey(l.getSource()) || !nodesById.containsKey(l.getTarget()))
                dangling.add(l);
        }
        return dangling;
    }

    /** Snapshot of the current state as a finished, structurally immutable graph. */
    public DirectedGraph toGraph() {
        return new DirectedGraph(nodes, links, categories, styles, properties);
    }
}
