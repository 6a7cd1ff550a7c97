package com.codemap.dgml.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Attribute expression guarding a {@link Style}, e.g. {@code HasCategory('Interface')}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public final class Condition {
    private String expression;
}
