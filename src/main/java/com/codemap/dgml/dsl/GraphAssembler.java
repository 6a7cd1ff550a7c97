package com.codemap.dgml.dsl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import com.codemap.dgml.api.Analysis;
import com.codemap.dgml.api.AssemblyListener;
import com.codemap.dgml.builder.BuilderRegistry;
import com.codemap.dgml.engine.AnalysisRunner;
import com.codemap.dgml.engine.DispatchEngine;
import com.codemap.dgml.engine.GraphAccumulator;
import com.codemap.dgml.engine.GraphAssemblyException;
import com.codemap.dgml.model.DirectedGraph;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.util.CompositeAssemblyListener;

import lombok.extern.log4j.Log4j2;

/**
 * Graph Assembler -- entry point turning collections of domain objects into
 * a {@link DirectedGraph}.
 *
 * Usage Pattern:
 * 1. Describe the rules: BuilderRegistry rules = BuilderRegistry.builder()...build();
 * 2. Configure: GraphAssembler a = GraphAssembler.builder().registry(rules).analysis(new HubNodeAnalysis()).build();
 * 3. Assemble: DirectedGraph g = a.assemble(services, dependencies);
 *
 * Algorithm:
 * 1. Flatten all input collections into one sequence, keeping both the order
 * of the collections and the order inside each one.
 * 2. Dispatch every object through the node, link and category rules into a
 * fresh graph (first element per id wins).
 * 3. Apply the dangling link policy.
 * 4. Run the style rules over the assembled nodes and links. Style rules
 * therefore see properties set by builders, never those set by analyses.
 * 5. Merge the analyses' property and style declarations, then run the
 * analyses in order.
 * 6. Return the graph.
 *
 * Any failure aborts the whole assembly; nothing partial is returned.
 *
 * Thread Safety:
 * An assembler holds no per-assembly state, so concurrent {@link #assemble}
 * calls on independent inputs are safe as long as the rules, analyses and
 * listeners are.
 */
@Log4j2
public final class GraphAssembler {
    private final DispatchEngine engine;
    private final AnalysisRunner analyses;
    private final AssemblyListener listener;
    private final AssemblyOptions options;

    private GraphAssembler(Builder b) {
        this.engine = new DispatchEngine(b.registry);
        this.analyses = new AnalysisRunner(b.analyses);
        this.listener = b.listener;
        this.options = b.options;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * One-shot assembly.
     *
     * @param rules    builder rules.
     * @param analyses analyses to run after the base graph is built.
     * @param inputs   ordered collections of domain objects.
     * @return the finished graph.
     */
    public static DirectedGraph assemble(BuilderRegistry rules, List<? extends Analysis> analyses,
            List<? extends Collection<?>> inputs) {
        return builder().registry(rules).analyses(analyses).build().assemble(inputs);
    }

    public DirectedGraph assemble(Collection<?>... inputs) {
        return assemble(Arrays.asList(inputs));
    }

    /**
     * Assembles a graph from the given collections, processed in order.
     *
     * @throws GraphAssemblyException (or one of its subtypes) if any rule or
     *                                analysis fails.
     */
    public DirectedGraph assemble(List<? extends Collection<?>> inputs) {
        List<Object> sequence = flatten(inputs);
        GraphAccumulator graph = new GraphAccumulator(listener);
        listener.onAssemblyStart(sequence.size());

        try {
            for (Object input : sequence) {
                int produced = engine.dispatch(input, graph);
                listener.onElementDispatched(input, produced);
            }
            applyDanglingLinkPolicy(graph);

            int styled = engine.applyStyles(graph);
            log.debug("Style rules produced {} style(s)", styled);

            analyses.run(graph, listener);
        } catch (RuntimeException e) {
            log.error("Graph assembly aborted: {}", e.getMessage());
            listener.onAssemblyError(e);
            throw e;
        }

        DirectedGraph result = graph.toGraph();
        if (options.isLogSummary())
            log.info("Assembled {} from {} input(s)", result, sequence.size());
        listener.onAssemblyEnd(result);
        return result;
    }

    public BuilderRegistry registry() {
        return engine.registry();
    }

    public List<Analysis> analyses() {
        return analyses.analyses();
    }

    public AssemblyOptions options() {
        return options;
    }

    private static List<Object> flatten(List<? extends Collection<?>> inputs) {
        if (inputs == null)
            throw new IllegalArgumentException("Inputs must not be null");
        int size = 0;
        for (Collection<?> c : inputs) {
            if (c != null)
                size += c.size();
        }
        List<Object> sequence = new ArrayList<>(size);
        for (Collection<?> c : inputs) {
            if (c != null)
                sequence.addAll(c);
        }
        return sequence;
    }

    private void applyDanglingLinkPolicy(GraphAccumulator graph) {
        if (options.getDanglingLinks() == DanglingLinkPolicy.ALLOW)
            return;
        List<Link> dangling = graph.danglingLinks();
        if (dangling.isEmpty())
            return;
        if (options.getDanglingLinks() == DanglingLinkPolicy.REJECT) {
            throw new GraphAssemblyException(dangling.size() + " link(s) reference unknown nodes, first: "
                    + dangling.get(0).key());
        }
        for (Link l : dangling)
            graph.removeLink(l);
        log.debug("Dropped {} dangling link(s)", dangling.size());
    }

    /** Collects the configuration of a {@link GraphAssembler}. */
    public static final class Builder {
        private BuilderRegistry registry = BuilderRegistry.empty();
        private final List<Analysis> analyses = new ArrayList<>();
        private final CompositeAssemblyListener listener = new CompositeAssemblyListener();
        private AssemblyOptions options = AssemblyOptions.defaults();

        private Builder() {
        }

        public Builder registry(BuilderRegistry registry) {
            if (registry == null)
                throw new IllegalArgumentException("Registry must not be null");
            this.registry = registry;
            return this;
        }

        /** Appends an analysis; analyses run in the order they are added. */
        public Builder analysis(Analysis analysis) {
            if (analysis == null)
                throw new IllegalArgumentException("Analysis must not be null");
            analyses.add(analysis);
            return this;
        }

        public Builder analyses(Collection<? extends Analysis> more) {
            for (Analysis a : more)
                analysis(a);
            return this;
        }

        /** Adds a listener; several listeners are notified in the order added. */
        public Builder listener(AssemblyListener l) {
            if (l == null)
                throw new IllegalArgumentException("Listener must not be null");
            listener.addForComposite(l);
            return this;
        }

        public Builder options(AssemblyOptions options) {
            if (options == null)
                throw new IllegalArgumentException("Options must not be null");
            this.options = options;
            return this;
        }

        public GraphAssembler build() {
            return new GraphAssembler(this);
        }
    }
}
