package com.codemap.dgml.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One visual attribute assignment of a {@link Style}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Setter {
    private String property;
    private String value;
    /** Optional computed value; overrides {@link #value} in the renderer. */
    private String expression;

    public Setter(String property, String value) {
        this(property, value, null);
    }
}
