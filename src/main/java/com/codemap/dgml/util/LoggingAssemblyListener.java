package com.codemap.dgml.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.codemap.dgml.api.AssemblyListener;
import com.codemap.dgml.model.DirectedGraph;

/**
 * Logs assembly progress: a DEBUG line per discarded duplicate and per
 * analysis, and per-input TRACE lines.
 *
 * <p>
 * Also counts what it saw, which makes it handy in tests.
 */
public final class LoggingAssemblyListener implements AssemblyListener {
    private static final Logger log = LogManager.getLogger(LoggingAssemblyListener.class);

    private long startNanos;
    private int inputs, produced, duplicates, analyses;

    @Override
    public void onAssemblyStart(int inputCount) {
        startNanos = System.nanoTime();
        inputs = inputCount;
        produced = 0;
        duplicates = 0;
        analyses = 0;
    }

    @Override
    public void onElementDispatched(Object input, int count) {
        produced += count;
        log.trace("{} -> {} element(s)", input, count);
    }

    @Override
    public void onDuplicateDiscarded(Object discarded, String key) {
        duplicates++;
        log.debug("Discarded duplicate {} '{}'", discarded.getClass().getSimpleName(), key);
    }

    @Override
    public void onAnalysisApplied(String analysisName) {
        analyses++;
        log.debug("Applied analysis {}", analysisName);
    }

    @Override
    public void onAssemblyError(Throwable error) {
        log.warn("Assembly aborted after {} input(s): {}", inputs, error.getMessage());
    }

    @Override
    public void onAssemblyEnd(DirectedGraph graph) {
        log.debug("Assembly of {} input(s) took {} us: {} produced, {} duplicate(s), {} analyses -> {}",
                inputs, (System.nanoTime() - startNanos) / 1_000, produced, duplicates, analyses, graph);
    }

    public int inputs() {
        return inputs;
    }

    public int produced() {
        return produced;
    }

    public int duplicates() {
        return duplicates;
    }

    public int analyses() {
        return analyses;
    }
}
