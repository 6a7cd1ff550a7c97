package com.codemap.dgml.api;

import com.codemap.dgml.model.DirectedGraph;

/**
 * Observability hook for graph assembly.
 *
 * <p>
 * Callbacks run synchronously on the assembling thread, in the order the
 * events happen. All methods default to no-ops so implementations override
 * only what they need.
 */
public interface AssemblyListener {

    /**
     * Called before the first input is dispatched.
     *
     * @param inputCount number of domain objects after flattening all input
     *                   collections.
     */
    default void onAssemblyStart(int inputCount) {
    }

    /**
     * Called after one domain object went through the node, link and category
     * rules.
     *
     * @param input    the domain object.
     * @param produced number of elements the matching rules produced, counting
     *                 discarded duplicates.
     */
    default void onElementDispatched(Object input, int produced) {
    }

    /**
     * Called when a produced node, link, category or property declaration is
     * dropped because its key is already taken.
     *
     * @param discarded the element that was dropped.
     * @param key       the identity key it collided on.
     */
    default void onDuplicateDiscarded(Object discarded, String key) {
    }

    /** Called after an analysis executed successfully. */
    default void onAnalysisApplied(String analysisName) {
    }

    /** Called when assembly aborts; the error is rethrown to the caller afterwards. */
    default void onAssemblyError(Throwable error) {
    }

    /** Called with the finished graph. */
    default void onAssemblyEnd(DirectedGraph graph) {
    }
}
