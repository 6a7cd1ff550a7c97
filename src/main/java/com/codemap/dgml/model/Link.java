package com.codemap.dgml.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;

/**
 * A directed edge between two node ids. Identity is the
 * (source, target, category) triple, see {@link #key()}; the three are fixed
 * at construction.
 *
 * <p>
 * Endpoints are plain ids; nothing here checks that they resolve to a node.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "source", "target", "label", "category" })
public final class Link implements GraphElement {
    private final String source;
    private final String target;
    private String label;
    private final String category;

    @Getter(AccessLevel.NONE)
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public Link(String source, String target) {
        this(source, target, null);
    }

    public Link(String source, String target, String category) {
        this.source = source;
        this.target = target;
        this.category = category;
    }

    /** Identity of a link within a graph. A null category is a valid component. */
    public record Key(String source, String target, String category) {
        @Override
        public String toString() {
            return source + " -> " + target + (category != null ? " [" + category + "]" : "");
        }
    }

    public Key key() {
        return new Key(source, target, category);
    }

    @Override
    public boolean hasCategory(String c) {
        return c != null && c.equals(category);
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

    public Link withProperty(String name, Object value) {
        setProperty(name, value);
        return this;
    }

    @Override
    @JsonIgnore
    public StyleTarget styleTarget() {
        return StyleTarget.LINK;
    }
}
