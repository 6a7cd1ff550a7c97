package com.codemap.dgml.model;

import java.util.Map;
import java.util.Set;

/**
 * Common surface of the two element kinds that carry custom attributes and
 * can be targeted by styles: {@link Node} and {@link Link}.
 */
public interface GraphElement {

    /** Attribute names the document format owns; never usable as custom properties. */
    Set<String> RESERVED_ATTRIBUTES = Set.of("Id", "Label", "Category", "Source", "Target");

    String getLabel();

    String getCategory();

    /**
     * @return true if the element is classified by {@code category}, either
     *         as its primary category or as a secondary category reference.
     */
    boolean hasCategory(String category);

    /** Read-only view of the custom properties, in insertion order. */
    Map<String, Object> getProperties();

    /**
     * Sets (or overwrites) a custom property.
     *
     * @throws IllegalArgumentException if {@code name} is null, a reserved
     *                                  attribute name, or not usable as an XML
     *                                  attribute name.
     */
    void setProperty(String name, Object value);

    /**
     * @return the custom property value, or null if absent.
     */
    default Object property(String name) {
        return getProperties().get(name);
    }

    /** The style target this element kind maps to. */
    StyleTarget styleTarget();

    static void checkPropertyName(String name) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Property name must not be empty");
        if (RESERVED_ATTRIBUTES.contains(name))
            throw new IllegalArgumentException("'" + name + "' is a reserved attribute and cannot be a custom property");
        if (!isAttributeName(name))
            throw new IllegalArgumentException("'" + name + "' is not a valid attribute name");
    }

    /**
     * Unprefixed XML name: a letter or '_', then letters, digits, '_', '-' or
     * '.'. Names starting with "xml" belong to XML itself.
     */
    static boolean isAttributeName(String name) {
        if (name.regionMatches(true, 0, "xml", 0, 3))
            return false;
        char first = name.charAt(0);
        if (!Character.isLetter(first) && first != '_')
            return false;
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_' && c != '-' && c != '.')
                return false;
        }
        return true;
    }
}
