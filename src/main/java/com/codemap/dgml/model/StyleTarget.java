package com.codemap.dgml.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Element kind a {@link Style} applies to. */
public enum StyleTarget {
    NODE("Node"),
    LINK("Link");

    private final String markupName;

    StyleTarget(String markupName) {
        this.markupName = markupName;
    }

    @JsonValue
    public String markupName() {
        return markupName;
    }

    /**
     * Resolves the style target for an element class.
     *
     * @throws IllegalArgumentException if the class is neither {@link Node}
     *                                  nor {@link Link} (or a subtype).
     */
    public static StyleTarget of(Class<?> elementType) {
        if (Node.class.isAssignableFrom(elementType))
            return NODE;
        if (Link.class.isAssignableFrom(elementType))
            return LINK;
        throw new IllegalArgumentException("Styles can only target Node or Link, not " + elementType.getName());
    }
}
