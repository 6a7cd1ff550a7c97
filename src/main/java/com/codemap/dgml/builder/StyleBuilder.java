package com.codemap.dgml.builder;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

import com.codemap.dgml.model.GraphElement;
import com.codemap.dgml.model.Style;
import com.codemap.dgml.model.StyleTarget;

/**
 * Style rule. Unlike the other rules it is not applied to domain objects but
 * to the nodes and links already assembled into the graph.
 *
 * <p>
 * The produced style's target type is always set from the rule's element
 * type, whatever the mapping function put there.
 *
 * @param <T> {@link com.codemap.dgml.model.Node} or
 *            {@link com.codemap.dgml.model.Link}
 */
public final class StyleBuilder<T extends GraphElement> extends SingleElementBuilder<T, Style> {
    private final StyleTarget target;

    public StyleBuilder(Class<T> elementType, Function<? super T, ? extends Style> mapper) {
        this(elementType, mapper, null);
    }

    /**
     * @throws IllegalArgumentException if {@code elementType} is neither Node
     *                                  nor Link.
     */
    public StyleBuilder(Class<T> elementType, Function<? super T, ? extends Style> mapper,
            Predicate<? super T> acceptor) {
        super(elementType, mapper, acceptor, TypeMatch.ASSIGNABLE);
        this.target = StyleTarget.of(elementType);
    }

    public StyleTarget target() {
        return target;
    }

    @Override
    protected Stream<Style> produce(T source) {
        return super.produce(source).map(s -> {
            s.setTargetType(target);
            return s;
        });
    }
}
