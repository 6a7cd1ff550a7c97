package com.codemap.dgml.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Schema entry declaring a custom attribute, so the output encoder knows its
 * type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Property {
    public static final String BOOLEAN = "System.Boolean";
    public static final String INT = "System.Int32";
    public static final String DOUBLE = "System.Double";
    public static final String STRING = "System.String";

    private String id;
    private String dataType;
    private String label;
    private String description;

    public static Property of(String id, String dataType, String label) {
        return new Property(id, dataType, label, null);
    }
}
