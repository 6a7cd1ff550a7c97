package com.codemap.dgml.builder;

import java.util.function.Function;
import java.util.function.Predicate;

import com.codemap.dgml.model.Link;

/** Maps a source object to at most one {@link Link}; a null result produces nothing. */
public final class LinkBuilder<T> extends SingleElementBuilder<T, Link> {

    public LinkBuilder(Class<T> sourceType, Function<? super T, ? extends Link> mapper) {
        this(sourceType, mapper, null, TypeMatch.ASSIGNABLE);
    }

    public LinkBuilder(Class<T> sourceType, Function<? super T, ? extends Link> mapper,
            Predicate<? super T> acceptor) {
        this(sourceType, mapper, acceptor, TypeMatch.ASSIGNABLE);
    }

    public LinkBuilder(Class<T> sourceType, Function<? super T, ? extends Link> mapper,
            Predicate<? super T> acceptor, TypeMatch typeMatch) {
        super(sourceType, mapper, acceptor, typeMatch);
    }
}
