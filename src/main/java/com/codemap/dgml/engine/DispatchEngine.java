package com.codemap.dgml.engine;

import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

import com.codemap.dgml.builder.BuilderRegistry;
import com.codemap.dgml.builder.ElementBuilder;
import com.codemap.dgml.builder.StyleBuilder;
import com.codemap.dgml.model.GraphElement;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;

import lombok.extern.log4j.Log4j2;

/**
 * Matches objects against the rules of a {@link BuilderRegistry} and merges
 * what they produce into a {@link GraphAccumulator}.
 *
 * <p>
 * Two passes:
 * <ol>
 * <li>{@link #dispatch(Object, GraphAccumulator)}: one domain object against
 * the node, then link, then category rules. Within each kind every matching
 * rule runs, in registration order.</li>
 * <li>{@link #applyStyles(GraphAccumulator)}: once all domain objects are in,
 * every assembled node and then every assembled link against the style
 * rules.</li>
 * </ol>
 *
 * <p>
 * A rule matches when the input's runtime type satisfies the rule's type
 * filter and its predicate accepts the input. Mapping functions see only
 * their own input, never the graph being built.
 *
 * <p>
 * Fail fast: the first exception thrown by a predicate or mapping function is
 * wrapped in a {@link RuleInvocationException} and aborts the assembly.
 *
 * <p>
 * Stateless apart from the registry it reads, so one engine can serve
 * concurrent assemblies.
 */
@Log4j2
public final class DispatchEngine {
    private final BuilderRegistry registry;

    public DispatchEngine(BuilderRegistry registry) {
        if (registry == null)
            throw new IllegalArgumentException("Registry must not be null");
        this.registry = registry;
    }

    public BuilderRegistry registry() {
        return registry;
    }

    /**
     * Runs every matching node, link and category rule on one domain object.
     *
     * @return number of elements produced, including duplicates that the
     *         accumulator discarded.
     * @throws RuleInvocationException if a rule fails.
     */
    public int dispatch(Object input, GraphAccumulator graph) {
        int produced = 0;
        produced += apply(registry.nodeBuilders(), input, graph::addNode);
        produced += apply(registry.linkBuilders(), input, graph::addLink);
        produced += apply(registry.categoryBuilders(), input, graph::addCategory);
        return produced;
    }

    /**
     * Runs the style rules over the nodes, then the links, currently in the
     * graph. Each produced style is appended.
     *
     * @return number of styles appended.
     * @throws RuleInvocationException if a rule fails.
     */
    public int applyStyles(GraphAccumulator graph) {
        List<StyleBuilder<?>> rules = registry.styleBuilders();
        if (rules.isEmpty())
            return 0;

        int produced = 0;
        // Snapshot so a style rule can never observe its own pass.
        for (Node node : List.copyOf(graph.nodes()))
            produced += applyStyles(rules, node, graph);
        for (Link link : List.copyOf(graph.links()))
            produced += applyStyles(rules, link, graph);
        return produced;
    }

    private int applyStyles(List<StyleBuilder<?>> rules, GraphElement element, GraphAccumulator graph) {
        int produced = 0;
        for (StyleBuilder<?> rule : rules) {
            if (rule.target() != element.styleTarget())
                continue;
            produced += apply(rule, element, graph::addStyle);
        }
        return produced;
    }

    private <R> int apply(List<? extends ElementBuilder<?, R>> rules, Object input, Consumer<R> sink) {
        int produced = 0;
        for (ElementBuilder<?, R> rule : rules)
            produced += apply(rule, input, sink);
        return produced;
    }

    private <R> int apply(ElementBuilder<?, R> rule, Object input, Consumer<? super R> sink) {
        try {
            if (!rule.accepts(input))
                return 0;
            int produced = 0;
            try (Stream<R> out = rule.build(input)) {
                Iterator<R> it = out.iterator();
                while (it.hasNext()) {
                    sink.accept(it.next());
                    produced++;
                }
            }
            if (log.isTraceEnabled())
                log.trace("{} produced {} element(s) from {}", rule, produced, input.getClass().getSimpleName());
            return produced;
        } catch (RuleInvocationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RuleInvocationException(rule, input, e);
        }
    }
}
