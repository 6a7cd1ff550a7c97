package com.codemap.dgml.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declarative visual rule: when every {@link Condition} holds for an element
 * of {@link #targetType}, the {@link Setter}s apply.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "targetType", "groupLabel", "valueLabel", "conditions", "setters" })
public final class Style {
    private StyleTarget targetType;
    private String groupLabel;
    private String valueLabel;
    private List<Condition> conditions = new ArrayList<>();
    private List<Setter> setters = new ArrayList<>();

    public Style(StyleTarget targetType, String groupLabel) {
        this.targetType = targetType;
        this.groupLabel = groupLabel;
    }

    public Style condition(String expression) {
        conditions.add(new Condition(expression));
        return this;
    }

    public Style setter(String property, String value) {
        setters.add(new Setter(property, value));
        return this;
    }
}
