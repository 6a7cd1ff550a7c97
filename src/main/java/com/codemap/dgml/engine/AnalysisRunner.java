package com.codemap.dgml.engine;

import java.util.List;

import com.codemap.dgml.api.Analysis;
import com.codemap.dgml.api.AssemblyListener;
import com.codemap.dgml.model.Property;
import com.codemap.dgml.model.Style;

import lombok.extern.log4j.Log4j2;

/**
 * Applies registered analyses to an assembled graph.
 *
 * <p>
 * Three ordered phases: declare every analysis's properties, append every
 * analysis's styles, then execute each analysis in registration order. The
 * declarations all land before the first {@link Analysis#execute} so any
 * analysis can use any declared property.
 */
@Log4j2
public final class AnalysisRunner {
    private final List<Analysis> analyses;

    public AnalysisRunner(List<Analysis> analyses) {
        for (Analysis a : analyses) {
            if (a == null)
                throw new IllegalArgumentException("Analysis must not be null");
        }
        this.analyses = List.copyOf(analyses);
    }

    public List<Analysis> analyses() {
        return analyses;
    }

    /**
     * @throws AnalysisException if an analysis fails in any phase.
     */
    public void run(GraphAccumulator graph, AssemblyListener listener) {
        for (Analysis a : analyses) {
            try {
                for (Property p : a.getProperties())
                    graph.declareProperty(p);
            } catch (RuntimeException e) {
                throw new AnalysisException(a.name(), e);
            }
        }

        for (Analysis a : analyses) {
            try {
                for (Style s : a.getStyles())
                    graph.addStyle(s);
            } catch (RuntimeException e) {
                throw new AnalysisException(a.name(), e);
            }
        }

        for (Analysis a : analyses) {
            log.debug("Running analysis {}", a.name());
            try {
                a.execute(graph);
            } catch (RuntimeException e) {
                throw new AnalysisException(a.name(), e);
            }
            listener.onAnalysisApplied(a.name());
        }
    }
}
