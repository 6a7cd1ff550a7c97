package com.codemap.dgml.builder;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

import com.codemap.dgml.model.Node;

/** Maps a source object to zero or more {@link Node}s. */
public final class NodesBuilder<T> extends MultiElementBuilder<T, Node> {

    public NodesBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends Node>> mapper) {
        this(sourceType, mapper, null, TypeMatch.ASSIGNABLE);
    }

    public NodesBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends Node>> mapper,
            Predicate<? super T> acceptor) {
        this(sourceType, mapper, acceptor, TypeMatch.ASSIGNABLE);
    }

    public NodesBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends Node>> mapper,
            Predicate<? super T> acceptor, TypeMatch typeMatch) {
        super(sourceType, mapper, acceptor, typeMatch);
    }
}
