package com.codemap.dgml.builder;

import java.util.function.Function;
import java.util.function.Predicate;

import com.codemap.dgml.model.Node;

/** Maps a source object to at most one {@link Node}; a null result produces nothing. */
public final class NodeBuilder<T> extends SingleElementBuilder<T, Node> {

    public NodeBuilder(Class<T> sourceType, Function<? super T, ? extends Node> mapper) {
        this(sourceType, mapper, null, TypeMatch.ASSIGNABLE);
    }

    public NodeBuilder(Class<T> sourceType, Function<? super T, ? extends Node> mapper,
            Predicate<? super T> acceptor) {
        this(sourceType, mapper, acceptor, TypeMatch.ASSIGNABLE);
    }

    public NodeBuilder(Class<T> sourceType, Function<? super T, ? extends Node> mapper,
            Predicate<? super T> acceptor, TypeMatch typeMatch) {
        super(sourceType, mapper, acceptor, typeMatch);
    }
}
