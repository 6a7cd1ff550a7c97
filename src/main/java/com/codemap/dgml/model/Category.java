package com.codemap.dgml.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Classification tag. Referenced by {@link Node#getCategory()} as a primary
 * kind, or by {@link CategoryRef} as a grouping.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Category {
    private String id;
    private String label;
}
