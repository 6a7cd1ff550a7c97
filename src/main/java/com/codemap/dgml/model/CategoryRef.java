package com.codemap.dgml.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Secondary category membership of a node, e.g. a containment group. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public final class CategoryRef {
    private String ref;
}
