package com.codemap.dgml.api;

import java.util.List;

import com.codemap.dgml.model.Property;
import com.codemap.dgml.model.Style;

/**
 * Post-processing step run on a fully assembled graph.
 *
 * <p>
 * Before any analysis executes, the assembler merges the property
 * declarations and styles of <b>every</b> registered analysis into the
 * graph, so {@link #execute(GraphEditor)} may set custom properties declared
 * by itself or by any other analysis. Analyses then execute in registration
 * order and each one sees the changes made by the previous ones.
 *
 * <p>
 * An exception thrown from {@link #execute(GraphEditor)} aborts the whole
 * assembly.
 */
public interface Analysis {

    /**
     * Reads and mutates the graph under construction.
     *
     * @param graph capability over the in-progress graph.
     */
    void execute(GraphEditor graph);

    /** Custom attributes this analysis writes; declared even if never used. */
    default List<Property> getProperties() {
        return List.of();
    }

    /** Styles this analysis contributes, typically conditioned on its properties. */
    default List<Style> getStyles() {
        return List.of();
    }

    /** Name used in logs and error messages. */
    default String name() {
        return getClass().getSimpleName();
    }
}
