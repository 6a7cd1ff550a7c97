package com.codemap.dgml.api;

import java.util.List;

import com.codemap.dgml.model.Category;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Property;
import com.codemap.dgml.model.Style;

/**
 * Mutation surface handed to an {@link Analysis}.
 *
 * <p>
 * Collections are exposed as read-only views; structural changes go through
 * the methods below so the uniqueness rules (node id, link triple, category
 * id, property id; first one wins) stay enforced in one place. Custom
 * properties are written directly on the returned {@link Node} and
 * {@link Link} objects.
 */
public interface GraphEditor {

    List<Node> nodes();

    List<Link> links();

    List<Category> categories();

    List<Style> styles();

    List<Property> properties();

    /**
     * @return The node, or null if not found.
     */
    Node findNode(String id);

    /**
     * @return The link with this identity triple, or null if not found.
     */
    Link findLink(String source, String target, String category);

    /** Links whose source is {@code nodeId}, in graph order. */
    List<Link> linksFrom(String nodeId);

    /** Links whose target is {@code nodeId}, in graph order. */
    List<Link> linksTo(String nodeId);

    /**
     * @return true if added, false if a node with the same id already exists.
     */
    boolean addNode(Node node);

    /**
     * @return true if added, false if a link with the same key already exists.
     */
    boolean addLink(Link link);

    /**
     * @return true if added, false if a category with the same id already
     *         exists.
     */
    boolean addCategory(Category category);

    /** Appends a style; styles are never de-duplicated. */
    void addStyle(Style style);

    /**
     * @return true if declared, false if the id was already declared.
     */
    boolean declareProperty(Property property);

    /**
     * Removes a node and every link touching it.
     *
     * @return true if the node existed.
     */
    boolean removeNode(String id);

    /**
     * @return true if the link existed.
     */
    boolean removeLink(Link link);
}
