package com.codemap.dgml.util;

import java.util.Arrays;

import com.codemap.dgml.api.AssemblyListener;
import com.codemap.dgml.model.DirectedGraph;

/**
 * Fans {@link AssemblyListener} callbacks out to several listeners, in the
 * order they were added.
 */
public class CompositeAssemblyListener implements AssemblyListener {
    private AssemblyListener[] listeners = new AssemblyListener[0];

    public void addForComposite(AssemblyListener listener) {
        AssemblyListener[] old = listeners;
        AssemblyListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onAssemblyStart(int inputCount) {
        for (AssemblyListener l : listeners)
            l.onAssemblyStart(inputCount);
    }

    @Override
    public void onElementDispatched(Object input, int produced) {
        for (AssemblyListener l : listeners)
            l.onElementDispatched(input, produced);
    }

    @Override
    public void onDuplicateDiscarded(Object discarded, String key) {
        for (AssemblyListener l : listeners)
            l.onDuplicateDiscarded(discarded, key);
    }

    @Override
    public void onAnalysisApplied(String analysisName) {
        for (AssemblyListener l : listeners)
            l.onAnalysisApplied(analysisName);
    }

    @Override
    public void onAssemblyError(Throwable error) {
        for (AssemblyListener l : listeners)
            l.onAssemblyError(error);
    }

    @Override
    public void onAssemblyEnd(DirectedGraph graph) {
        for (AssemblyListener l : listeners)
            l.onAssemblyEnd(graph);
    }
}
