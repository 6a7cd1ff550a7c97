package com.codemap.dgml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;

/**
 * A graph vertex. Identity is {@link #id}, fixed at construction; the
 * assembler keeps the first node produced for any id and discards later ones.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "id", "label", "category", "categoryRefs" })
public final class Node implements GraphElement {
    private final String id;
    private String label;
    private String category;
    private List<CategoryRef> categoryRefs = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public Node(String id, String label) {
        this(id, label, null);
    }

    public Node(String id, String label, String category) {
        this.id = id;
        this.label = label;
        this.category = category;
    }

    /**
     * Adds a secondary category reference unless one with the same ref is
     * already present.
     */
    public Node addCategoryRef(String ref) {
        for (CategoryRef r : categoryRefs) {
            if (r.getRef().equals(ref))
                return this;
        }
        categoryRefs.add(new CategoryRef(ref));
        return this;
    }

    @Override
    public boolean hasCategory(String c) {
        if (c == null)
            return false;
        if (c.equals(category))
            return true;
        for (CategoryRef r : categoryRefs) {
            if (c.equals(r.getRef()))
                return true;
        }
        return false;
    }

    @Override
    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    @Override
    public void setProperty(String name, Object value) {
        GraphElement.checkPropertyName(name);
        properties.put(name, value);
    }

    public Node withProperty(String name, Object value) {
        setProperty(name, value);
        return this;
    }

    @Override
    @JsonIgnore
    public StyleTarget styleTarget() {
        return StyleTarget.NODE;
    }
}
